package ai.pipestream.edge.service;

import ai.pipestream.edge.entity.ColumnType;
import ai.pipestream.edge.entity.UserDocumentIndexEntry;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Objects;

/**
 * A JSON value coerced to an index {@link ColumnType}.
 * <p>
 * Index writes, index lookups and full scans all compare through this class, which is what keeps
 * an index lookup and a filtered scan returning the same documents.
 */
public final class IndexValue implements Comparable<IndexValue> {

    private final ColumnType type;
    private final String stringValue;
    private final Double numberValue;
    private final Long longValue;
    private final Boolean booleanValue;

    private IndexValue(ColumnType type, String stringValue, Double numberValue, Long longValue, Boolean booleanValue) {
        this.type = type;
        this.stringValue = stringValue;
        this.numberValue = numberValue;
        this.longValue = longValue;
        this.booleanValue = booleanValue;
    }

    /**
     * Coerce a JSON value to {@code type}.
     *
     * @param node value read at the index path
     * @param maxStringLength longest string accepted for {@link ColumnType#STRING}
     * @return the coerced value, or null when the value is absent or JSON null (no index entry)
     * @throws IllegalArgumentException when the value does not match the type
     */
    public static IndexValue coerce(ColumnType type, JsonNode node, int maxStringLength) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        switch (type) {
            case STRING:
                if (!node.isTextual()) {
                    throw mismatch(type, node);
                }
                if (node.textValue().length() > maxStringLength) {
                    throw new IllegalArgumentException("String of length " + node.textValue().length()
                        + " exceeds the indexable length " + maxStringLength);
                }
                return new IndexValue(type, node.textValue(), null, null, null);
            case NUMBER:
                if (!node.isNumber()) {
                    throw mismatch(type, node);
                }
                return new IndexValue(type, null, node.doubleValue(), null, null);
            case INTEGER:
                if (!node.isNumber() || !isIntegral(node)) {
                    throw mismatch(type, node);
                }
                return new IndexValue(type, null, null, node.longValue(), null);
            case DATETIME:
                if (!node.isTextual()) {
                    throw mismatch(type, node);
                }
                return new IndexValue(type, null, null, parseEpochMillis(node.textValue()), null);
            case BOOLEAN:
                return new IndexValue(type, null, null, null, parseBoolean(node));
            default:
                throw new IllegalStateException("Unhandled column type " + type);
        }
    }

    /**
     * Rebuild the value stored in an index entry.
     */
    public static IndexValue fromEntry(ColumnType type, UserDocumentIndexEntry entry) {
        return new IndexValue(type, entry.stringValue, entry.numberValue, entry.longValue, entry.booleanValue);
    }

    /**
     * Build an index entry carrying this value.
     */
    public UserDocumentIndexEntry toEntry(String phyTable, String colName, String pk) {
        UserDocumentIndexEntry entry = new UserDocumentIndexEntry();
        entry.phyTable = phyTable;
        entry.colName = colName;
        entry.pk = pk;
        entry.stringValue = stringValue;
        entry.numberValue = numberValue;
        entry.longValue = longValue;
        entry.booleanValue = booleanValue;
        return entry;
    }

    /**
     * Name of the {@link UserDocumentIndexEntry} attribute that holds values of {@code type}.
     */
    public static String entryAttribute(ColumnType type) {
        switch (type) {
            case STRING:
                return "stringValue";
            case NUMBER:
                return "numberValue";
            case INTEGER:
            case DATETIME:
                return "longValue";
            case BOOLEAN:
                return "booleanValue";
            default:
                throw new IllegalStateException("Unhandled column type " + type);
        }
    }

    /**
     * The stored representation, as bound to a query parameter.
     */
    public Object storedValue() {
        switch (type) {
            case STRING:
                return stringValue;
            case NUMBER:
                return numberValue;
            case INTEGER:
            case DATETIME:
                return longValue;
            case BOOLEAN:
                return booleanValue;
            default:
                throw new IllegalStateException("Unhandled column type " + type);
        }
    }

    public ColumnType type() {
        return type;
    }

    @Override
    public int compareTo(IndexValue other) {
        if (type != other.type) {
            throw new IllegalArgumentException("Cannot compare " + type + " with " + other.type);
        }
        switch (type) {
            case STRING:
                return stringValue.compareTo(other.stringValue);
            case NUMBER:
                return Double.compare(numberValue, other.numberValue);
            case INTEGER:
            case DATETIME:
                return Long.compare(longValue, other.longValue);
            case BOOLEAN:
                return Boolean.compare(booleanValue, other.booleanValue);
            default:
                throw new IllegalStateException("Unhandled column type " + type);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IndexValue)) {
            return false;
        }
        IndexValue that = (IndexValue) o;
        return type == that.type && compareTo(that) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, storedValue());
    }

    @Override
    public String toString() {
        return type.wireName() + ":" + storedValue();
    }

    private static boolean isIntegral(JsonNode node) {
        if (node.isIntegralNumber()) {
            return node.canConvertToLong();
        }
        double d = node.doubleValue();
        return !Double.isInfinite(d) && d == Math.rint(d) && node.canConvertToLong();
    }

    private static Boolean parseBoolean(JsonNode node) {
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber() && isIntegral(node) && (node.longValue() == 0 || node.longValue() == 1)) {
            return node.longValue() == 1;
        }
        if (node.isTextual() && ("true".equalsIgnoreCase(node.textValue()) || "false".equalsIgnoreCase(node.textValue()))) {
            return Boolean.parseBoolean(node.textValue());
        }
        throw mismatch(ColumnType.BOOLEAN, node);
    }

    /**
     * Parse an ISO-8601 date-time; values without an offset are taken as UTC.
     */
    static long parseEpochMillis(String text) {
        try {
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC).toEpochMilli();
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                .parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant().toEpochMilli();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC).toEpochMilli();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Not an ISO-8601 datetime: " + text, e);
        }
    }

    private static IllegalArgumentException mismatch(ColumnType type, JsonNode node) {
        return new IllegalArgumentException("Expected " + type.wireName() + " but found "
            + node.getNodeType().name().toLowerCase(Locale.ROOT) + " " + node);
    }
}
