package dev.pagestack.config.converter;

import dev.pagestack.entity.JsonDocument;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

/**
 * R2DBC writing converter: JsonDocument → H2 TEXT.
 */
@WritingConverter
public class JsonDocumentToStringConverter implements Converter<JsonDocument, String> {

    @Override
    public String convert(JsonDocument source) {
        return source.asString();
    }
}
