package ai.pipestream.edge.entity;

import java.util.Locale;

/**
 * Value types a secondary index may declare. The wire name is the lower-case form stored in
 * {@code userdb_table_indexes.col_type}.
 */
public enum ColumnType {
    STRING,
    NUMBER,
    INTEGER,
    DATETIME,
    BOOLEAN;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param wireName lower- or upper-case type name
     * @return the matching type
     * @throws IllegalArgumentException for an unknown name
     */
    public static ColumnType fromWireName(String wireName) {
        if (wireName == null) {
            throw new IllegalArgumentException("Column type is required");
        }
        return ColumnType.valueOf(wireName.trim().toUpperCase(Locale.ROOT));
    }
}
