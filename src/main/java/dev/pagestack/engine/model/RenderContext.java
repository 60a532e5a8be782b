package dev.pagestack.engine.model;

import lombok.Builder;

import java.time.ZoneId;
import java.util.List;

/**
 * Who is rendering which page in which language. Identity is supplied by the caller;
 * every user attribute may be null for anonymous visitors.
 */
@Builder(toBuilder = true)
public record RenderContext(
        Long userId,
        String userName,
        String userEmail,
        String userCode,
        List<String> userGroups,
        String lastLogin,
        long languageId,
        String languageLocale,
        String pageKeyword,
        String platform,
        ZoneId timezone
) {

    public RenderContext {
        userGroups = userGroups == null ? List.of() : List.copyOf(userGroups);
    }

    public static RenderContext anonymous(long languageId) {
        return RenderContext.builder().languageId(languageId).build();
    }

    public RenderContext forPage(String keyword) {
        return toBuilder().pageKeyword(keyword).build();
    }
}
