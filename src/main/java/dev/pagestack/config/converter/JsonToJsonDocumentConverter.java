package dev.pagestack.config.converter;

import dev.pagestack.entity.JsonDocument;
import io.r2dbc.postgresql.codec.Json;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

/**
 * R2DBC reading converter: PostgreSQL JSONB → JsonDocument.
 */
@ReadingConverter
public class JsonToJsonDocumentConverter implements Converter<Json, JsonDocument> {

    @Override
    public JsonDocument convert(Json source) {
        return JsonDocument.of(source.asString());
    }
}
