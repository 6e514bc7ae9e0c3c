package com.thedigest.continuity.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link Depth} by its wire code. Unknown stored values read back as null
 * so callers fall through to their own default.
 */
@Converter(autoApply = true)
public class DepthConverter implements AttributeConverter<Depth, String> {

    @Override
    public String convertToDatabaseColumn(Depth depth) {
        return depth == null ? null : depth.code();
    }

    @Override
    public Depth convertToEntityAttribute(String dbData) {
        return Depth.parse(dbData).orElse(null);
    }
}
