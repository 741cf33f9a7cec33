package ai.pipestream.edge.service;

import ai.pipestream.edge.util.JsonDocuments;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A comparison applied to one column (or JSON path) of a UserDB table.
 * <p>
 * Operands are JSON values; they are coerced to the column's type when the predicate is
 * evaluated. Documents with no value at the column never match, whatever the operator.
 */
public final class QueryPredicate {

    public enum Operator {
        EQ("="),
        NE("<>"),
        GT(">"),
        GTE(">="),
        LT("<"),
        LTE("<="),
        IN("IN");

        private final String jpql;

        Operator(String jpql) {
            this.jpql = jpql;
        }

        public String jpql() {
            return jpql;
        }
    }

    private final Operator operator;
    private final List<JsonNode> operands;

    private QueryPredicate(Operator operator, List<JsonNode> operands) {
        this.operator = operator;
        this.operands = Collections.unmodifiableList(operands);
    }

    public static QueryPredicate eq(Object value) {
        return of(Operator.EQ, value);
    }

    public static QueryPredicate ne(Object value) {
        return of(Operator.NE, value);
    }

    public static QueryPredicate gt(Object value) {
        return of(Operator.GT, value);
    }

    public static QueryPredicate gte(Object value) {
        return of(Operator.GTE, value);
    }

    public static QueryPredicate lt(Object value) {
        return of(Operator.LT, value);
    }

    public static QueryPredicate lte(Object value) {
        return of(Operator.LTE, value);
    }

    public static QueryPredicate in(Object... values) {
        List<JsonNode> operands = new ArrayList<>(values.length);
        for (Object value : values) {
            operands.add(JsonDocuments.valueToTree(value));
        }
        if (operands.isEmpty()) {
            throw new IllegalArgumentException("IN requires at least one value");
        }
        return new QueryPredicate(Operator.IN, operands);
    }

    public static QueryPredicate of(Operator operator, Object value) {
        if (operator == Operator.IN) {
            return in(value);
        }
        return new QueryPredicate(operator, List.of(JsonDocuments.valueToTree(value)));
    }

    public Operator operator() {
        return operator;
    }

    public List<JsonNode> operands() {
        return operands;
    }

    /**
     * Evaluate against a value already coerced to the column type.
     *
     * @param value document value, null when the document has none
     * @param coercedOperands operands coerced to the same type, in operand order
     */
    public boolean test(IndexValue value, List<IndexValue> coercedOperands) {
        if (value == null) {
            return false;
        }
        int cmp;
        switch (operator) {
            case IN:
                return coercedOperands.contains(value);
            case EQ:
                return value.compareTo(coercedOperands.get(0)) == 0;
            case NE:
                return value.compareTo(coercedOperands.get(0)) != 0;
            case GT:
                cmp = value.compareTo(coercedOperands.get(0));
                return cmp > 0;
            case GTE:
                cmp = value.compareTo(coercedOperands.get(0));
                return cmp >= 0;
            case LT:
                cmp = value.compareTo(coercedOperands.get(0));
                return cmp < 0;
            case LTE:
                cmp = value.compareTo(coercedOperands.get(0));
                return cmp <= 0;
            default:
                throw new IllegalStateException("Unhandled operator " + operator);
        }
    }

    @Override
    public String toString() {
        return operator + " " + operands;
    }
}
