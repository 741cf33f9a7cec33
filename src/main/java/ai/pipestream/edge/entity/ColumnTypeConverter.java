package ai.pipestream.edge.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link ColumnType} by its lower-case wire name.
 */
@Converter
public class ColumnTypeConverter implements AttributeConverter<ColumnType, String> {

    @Override
    public String convertToDatabaseColumn(ColumnType attribute) {
        return attribute == null ? null : attribute.wireName();
    }

    @Override
    public ColumnType convertToEntityAttribute(String dbData) {
        return dbData == null ? null : ColumnType.fromWireName(dbData);
    }
}
