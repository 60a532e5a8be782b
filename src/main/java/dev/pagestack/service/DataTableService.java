package dev.pagestack.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pagestack.engine.DataRetriever;
import dev.pagestack.engine.model.RetrievalRequest;
import dev.pagestack.repository.DataRowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Reads data-table rows for section declarations. Each row is its JSON payload plus the
 * standard columns {@code record_id}, {@code user_id} and {@code entry_date} (rendered in the
 * request's timezone).
 * <p>
 * An unknown table yields no rows. A filter that cannot be parsed or a payload that is not a
 * JSON object fails the read.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DataTableService implements DataRetriever {

    static final Set<String> STANDARD_COLUMNS = Set.of("record_id", "user_id", "entry_date");

    private static final DateTimeFormatter ENTRY_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {};

    private final DataRowRepository dataRowRepository;
    private final ObjectMapper objectMapper;

    @Override
    public Flux<Map<String, Object>> retrieve(RetrievalRequest request) {
        DataFilter filter = DataFilter.parse(request.filter());
        ZoneId zone = request.timezone() != null ? request.timezone() : ZoneOffset.UTC;

        return dataRowRepository.findTableId(request.table())
                .doOnSuccess(id -> {
                    if (id == null) {
                        log.debug("Data table '{}' does not exist, returning no rows", request.table());
                    }
                })
                .flatMapMany(tableId -> dataRowRepository.findRows(
                        tableId, request.userId(), request.languageId(), request.excludeDeleted()))
                .map(row -> toMap(row, zone, request.table()))
                .filter(filter)
                .map(row -> project(row, request));
    }

    private Map<String, Object> toMap(DataRowRepository.DataRow row, ZoneId zone, String table) {
        Map<String, Object> payload;
        try {
            payload = objectMapper.readValue(row.payload(), ROW_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Row " + row.id() + " of table '" + table
                    + "' has an invalid payload: " + e.getOriginalMessage(), e);
        }
        if (payload == null) {
            throw new IllegalStateException("Row " + row.id() + " of table '" + table + "' has an empty payload");
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("record_id", row.id());
        result.put("user_id", row.userId());
        result.put("entry_date", row.createdAt() == null ? null
                : row.createdAt().atOffset(ZoneOffset.UTC).atZoneSameInstant(zone).format(ENTRY_DATE));
        payload.forEach(result::putIfAbsent);
        return result;
    }

    // standard columns are always kept
    private static Map<String, Object> project(Map<String, Object> row, RetrievalRequest request) {
        if (request.fields().isEmpty()) {
            return row;
        }
        Map<String, Object> projected = new LinkedHashMap<>();
        row.forEach((name, value) -> {
            if (STANDARD_COLUMNS.contains(name) || request.fields().contains(name)) {
                projected.put(name, value);
            }
        });
        return projected;
    }
}
