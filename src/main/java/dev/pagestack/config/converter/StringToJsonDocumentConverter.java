package dev.pagestack.config.converter;

import dev.pagestack.entity.JsonDocument;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

/**
 * R2DBC reading converter: H2 TEXT → JsonDocument.
 */
@ReadingConverter
public class StringToJsonDocumentConverter implements Converter<String, JsonDocument> {

    @Override
    public JsonDocument convert(String source) {
        return JsonDocument.of(source);
    }
}
