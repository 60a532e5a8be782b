package dev.pagestack.service;

import dev.pagestack.util.SnowflakeId;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Issues Snowflake ids for new rows.
 *
 * <pre>
 * PageVersion version = PageVersion.builder()
 *     .id(idService.nextId())
 *     ...
 * </pre>
 */
@Service
@RequiredArgsConstructor
public class IdService {

    private final SnowflakeId snowflakeId;

    public long nextId() {
        return snowflakeId.nextId();
    }
}
