package com.embeddingstudio.vectordb.common.payload;

import com.embeddingstudio.vectordb.common.serialization.PayloadValueDeserializer;
import com.embeddingstudio.vectordb.common.serialization.PayloadValueSerializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A JSON-like value stored in an object payload.
 */
@JsonSerialize(using = PayloadValueSerializer.class)
@JsonDeserialize(using = PayloadValueDeserializer.class)
public sealed interface PayloadValue {

    /**
     * Text form used by the text operators and by SQL's {@code ->>} extraction.
     * Containers render as the concatenation of their elements.
     */
    String asText();

    default boolean isNull() {
        return false;
    }

    record StringValue(String value) implements PayloadValue {
        public StringValue {
            if (value == null) {
                throw new IllegalArgumentException("String value cannot be null, use NullValue");
            }
        }

        @Override
        public String asText() {
            return value;
        }
    }

    record NumberValue(BigDecimal value) implements PayloadValue {
        public NumberValue {
            if (value == null) {
                throw new IllegalArgumentException("Number value cannot be null, use NullValue");
            }
            value = value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
        }

        public static NumberValue of(double value) {
            return new NumberValue(BigDecimal.valueOf(value));
        }

        public static NumberValue of(long value) {
            return new NumberValue(BigDecimal.valueOf(value));
        }

        @Override
        public String asText() {
            return value.toPlainString();
        }
    }

    record BoolValue(boolean value) implements PayloadValue {
        @Override
        public String asText() {
            return Boolean.toString(value);
        }
    }

    record ListValue(List<PayloadValue> values) implements PayloadValue {
        public ListValue {
            values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
        }

        @Override
        public String asText() {
            return String.join(" ", values.stream().map(PayloadValue::asText).toList());
        }
    }

    record MapValue(Map<String, PayloadValue> values) implements PayloadValue {
        public MapValue {
            values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }

        public Optional<PayloadValue> get(String key) {
            return Optional.ofNullable(values.get(key));
        }

        @Override
        public String asText() {
            return String.join(" ", values.values().stream().map(PayloadValue::asText).toList());
        }
    }

    record NullValue() implements PayloadValue {
        public static final NullValue INSTANCE = new NullValue();

        @Override
        public String asText() {
            return "";
        }

        @Override
        public boolean isNull() {
            return true;
        }
    }

    static PayloadValue string(String value) {
        return value == null ? NullValue.INSTANCE : new StringValue(value);
    }

    static PayloadValue number(double value) {
        return NumberValue.of(value);
    }

    static PayloadValue bool(boolean value) {
        return new BoolValue(value);
    }

    /**
     * Converts plain Java values (strings, numbers, booleans, lists, maps, null) into the union.
     */
    static PayloadValue of(Object value) {
        if (value == null) {
            return NullValue.INSTANCE;
        }
        if (value instanceof PayloadValue payloadValue) {
            return payloadValue;
        }
        if (value instanceof String s) {
            return new StringValue(s);
        }
        if (value instanceof Boolean b) {
            return new BoolValue(b);
        }
        if (value instanceof BigDecimal d) {
            return new NumberValue(d);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return NumberValue.of(((Number) value).longValue());
        }
        if (value instanceof Number n) {
            return NumberValue.of(n.doubleValue());
        }
        if (value instanceof List<?> list) {
            List<PayloadValue> values = new ArrayList<>(list.size());
            for (Object element : list) {
                values.add(of(element));
            }
            return new ListValue(values);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, PayloadValue> values = new LinkedHashMap<>();
            map.forEach((k, v) -> values.put(String.valueOf(k), of(v)));
            return new MapValue(values);
        }
        throw new IllegalArgumentException("Unsupported payload value type: " + value.getClass().getName());
    }
}
