package com.instaclustr.bulkrestore.impl.filter;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Filter document of a listing call. Top-level fields are combined with logical AND, every field maps
 * operators to their operands, e.g. {@code {"start_timestamp": {"$gt": "...", "$lte": "..."}}}.
 * <p>
 * Expressions are immutable, {@link #and(FilterExpression)} and the builder produce new instances.
 */
public final class FilterExpression {

    private static final FilterExpression EMPTY = new FilterExpression(ImmutableMap.of());

    private final Map<String, Map<FilterOperator, Object>> conditions;

    private FilterExpression(final Map<String, Map<FilterOperator, Object>> conditions) {
        this.conditions = conditions;
    }

    public static FilterExpression empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static FilterExpression eq(final String field, final Object value) {
        return builder().eq(field, value).build();
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    public Map<String, Map<FilterOperator, Object>> getConditions() {
        return conditions;
    }

    /**
     * @return operand of the given field and operator, null when the expression has no such condition
     */
    public Object get(final String field, final FilterOperator operator) {
        final Map<FilterOperator, Object> operators = conditions.get(field);
        return operators == null ? null : operators.get(operator);
    }

    /**
     * Conjunction of both expressions. Conditions of the same field are merged, an operator present in
     * both is taken from {@code other}.
     */
    public FilterExpression and(final FilterExpression other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        final Builder builder = builder();
        builder.putAll(conditions);
        builder.putAll(other.conditions);
        return builder.build();
    }

    @JsonValue
    public Map<String, Map<String, Object>> toMap() {
        final Map<String, Map<String, Object>> document = new LinkedHashMap<>();
        conditions.forEach((field, operators) -> {
            final Map<String, Object> ops = new LinkedHashMap<>();
            operators.forEach((operator, operand) -> ops.put(operator.getSymbol(), operand));
            document.put(field, ops);
        });
        return document;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return conditions.equals(((FilterExpression) o).conditions);
    }

    @Override
    public int hashCode() {
        return conditions.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("conditions", toMap()).toString();
    }

    public static final class Builder {

        private final Map<String, Map<FilterOperator, Object>> conditions = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder with(final String field, final FilterOperator operator, final Object operand) {
            conditions.computeIfAbsent(field, f -> new LinkedHashMap<>()).put(operator, operand);
            return this;
        }

        public Builder eq(final String field, final Object value) {
            return with(field, FilterOperator.EQ, value);
        }

        public Builder in(final String field, final Collection<?> values) {
            return with(field, FilterOperator.IN, ImmutableList.copyOf(values));
        }

        public Builder contains(final String field, final Object value) {
            return with(field, FilterOperator.CONTAINS, value);
        }

        public Builder all(final String field, final Collection<?> values) {
            return with(field, FilterOperator.ALL, ImmutableList.copyOf(values));
        }

        public Builder gt(final String field, final Object value) {
            return with(field, FilterOperator.GT, value);
        }

        public Builder lte(final String field, final Object value) {
            return with(field, FilterOperator.LTE, value);
        }

        private void putAll(final Map<String, Map<FilterOperator, Object>> other) {
            other.forEach((field, operators) -> operators.forEach((operator, operand) -> with(field, operator, operand)));
        }

        public FilterExpression build() {
            if (conditions.isEmpty()) {
                return EMPTY;
            }
            final ImmutableMap.Builder<String, Map<FilterOperator, Object>> copy = ImmutableMap.builder();
            conditions.forEach((field, operators) -> copy.put(field, ImmutableMap.copyOf(operators)));
            return new FilterExpression(copy.build());
        }
    }
}
