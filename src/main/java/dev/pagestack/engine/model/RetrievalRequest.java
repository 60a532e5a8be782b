package dev.pagestack.engine.model;

import java.time.ZoneId;
import java.util.List;

/**
 * A read against one data table.
 *
 * @param userId restricts the rows to this user's entries when not null
 */
public record RetrievalRequest(
        String table,
        String filter,
        List<String> fields,
        boolean excludeDeleted,
        long languageId,
        ZoneId timezone,
        Long userId
) {

    public RetrievalRequest {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }
}
