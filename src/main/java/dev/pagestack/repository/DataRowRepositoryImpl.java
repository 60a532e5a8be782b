package dev.pagestack.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
@RequiredArgsConstructor
public class DataRowRepositoryImpl implements DataRowRepository {

    private final R2dbcEntityTemplate r2dbcTemplate;

    private static final String FIND_TABLE_ID =
            "SELECT id FROM data_tables WHERE name = :name";

    private static final String FIND_ROWS_BASE =
            "SELECT id, user_id, language_id, payload, created_at FROM data_rows " +
            "WHERE table_id = :tableId AND (language_id IS NULL OR language_id = :languageId)";

    @Override
    public Mono<Long> findTableId(String tableName) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(FIND_TABLE_ID)
                .bind("name", tableName)
                .map((row, meta) -> row.get("id", Long.class))
                .one();
    }

    @Override
    public Flux<DataRow> findRows(Long tableId, Long userId, long languageId, boolean excludeDeleted) {
        StringBuilder sql = new StringBuilder(FIND_ROWS_BASE);
        if (userId != null) {
            sql.append(" AND user_id = :userId");
        }
        if (excludeDeleted) {
            sql.append(" AND deleted = FALSE");
        }
        sql.append(" ORDER BY id");

        DatabaseClient.GenericExecuteSpec spec = r2dbcTemplate.getDatabaseClient()
                .sql(sql.toString())
                .bind("tableId", tableId)
                .bind("languageId", languageId);
        if (userId != null) {
            spec = spec.bind("userId", userId);
        }
        return spec.map((row, meta) -> new DataRow(
                        row.get("id", Long.class),
                        row.get("user_id", Long.class),
                        row.get("language_id", Long.class),
                        row.get("payload", String.class),
                        row.get("created_at", LocalDateTime.class)))
                .all();
    }
}
