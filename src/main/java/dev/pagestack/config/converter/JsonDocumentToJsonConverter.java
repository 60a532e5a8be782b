package dev.pagestack.config.converter;

import dev.pagestack.entity.JsonDocument;
import io.r2dbc.postgresql.codec.Json;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

/**
 * R2DBC writing converter: JsonDocument → PostgreSQL JSONB.
 */
@WritingConverter
public class JsonDocumentToJsonConverter implements Converter<JsonDocument, Json> {

    @Override
    public Json convert(JsonDocument source) {
        return Json.of(source.asString());
    }
}
