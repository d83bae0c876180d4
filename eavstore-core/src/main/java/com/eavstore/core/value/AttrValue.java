package com.eavstore.core.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A typed attribute value. Closed set of kinds: string, number, boolean, null,
 * array and map. The kind's {@link #type()} name is what the attrs table stores
 * in its type column.
 */
public sealed interface AttrValue
        permits AttrValue.Str, AttrValue.Num, AttrValue.Bool, AttrValue.Null, AttrValue.Arr, AttrValue.Obj {

    String STRING = "string";
    String NUMBER = "number";
    String BOOLEAN = "boolean";
    String NULL = "null";
    String ARRAY = "array";
    String MAP = "map";

    /**
     * Discriminant name stored alongside the serialized text.
     */
    String type();

    /**
     * Plain Java form: String, BigDecimal, Boolean, null, List or Map.
     */
    Object toJava();

    record Str(String value) implements AttrValue {
        public Str {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String type() { return STRING; }

        @Override
        public Object toJava() { return value; }
    }

    /**
     * Numbers compare by numeric value, so 1 and 1.0 are equal.
     */
    record Num(BigDecimal value) implements AttrValue {
        public Num {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String type() { return NUMBER; }

        @Override
        public Object toJava() { return value; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Num other && value.compareTo(other.value) == 0;
        }

        @Override
        public int hashCode() {
            return value.signum() == 0 ? 0 : value.stripTrailingZeros().hashCode();
        }
    }

    record Bool(boolean value) implements AttrValue {
        @Override
        public String type() { return BOOLEAN; }

        @Override
        public Object toJava() { return value; }
    }

    record Null() implements AttrValue {
        @Override
        public String type() { return NULL; }

        @Override
        public Object toJava() { return null; }
    }

    record Arr(List<AttrValue> values) implements AttrValue {
        public Arr {
            values = List.copyOf(values);
        }

        @Override
        public String type() { return ARRAY; }

        @Override
        public Object toJava() {
            List<Object> out = new ArrayList<>(values.size());
            for (AttrValue v : values) {
                out.add(v.toJava());
            }
            return out;
        }
    }

    record Obj(Map<String, AttrValue> entries) implements AttrValue {
        public Obj {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public String type() { return MAP; }

        @Override
        public Object toJava() {
            Map<String, Object> out = new LinkedHashMap<>();
            entries.forEach((k, v) -> out.put(k, v.toJava()));
            return out;
        }
    }

    // ==================== Factories ====================

    static AttrValue of(String value) {
        return value == null ? nullValue() : new Str(value);
    }

    static AttrValue of(long value) {
        return new Num(BigDecimal.valueOf(value));
    }

    static AttrValue of(double value) {
        return new Num(BigDecimal.valueOf(value));
    }

    static AttrValue of(boolean value) {
        return new Bool(value);
    }

    static AttrValue nullValue() {
        return new Null();
    }

    static AttrValue list(AttrValue... values) {
        return new Arr(List.of(values));
    }

    /**
     * Convert a plain Java value. Supports String, Number, Boolean, null,
     * Iterable, arrays of Object and Map with String keys.
     *
     * @throws ValueCodecException for any other kind
     */
    static AttrValue from(Object value) {
        if (value == null) return nullValue();
        if (value instanceof AttrValue v) return v;
        if (value instanceof String s) return new Str(s);
        if (value instanceof Boolean b) return new Bool(b);
        if (value instanceof BigDecimal d) return new Num(d);
        if (value instanceof BigInteger i) return new Num(new BigDecimal(i));
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return new Num(BigDecimal.valueOf(((Number) value).longValue()));
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new ValueCodecException("Non-finite number has no JSON form: " + d);
            }
            return new Num(BigDecimal.valueOf(d));
        }
        if (value instanceof Iterable<?> it) {
            List<AttrValue> values = new ArrayList<>();
            for (Object o : it) {
                values.add(from(o));
            }
            return new Arr(values);
        }
        if (value instanceof Object[] arr) {
            List<AttrValue> values = new ArrayList<>(arr.length);
            for (Object o : arr) {
                values.add(from(o));
            }
            return new Arr(values);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, AttrValue> entries = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (!(e.getKey() instanceof String key)) {
                    throw new ValueCodecException("Map keys must be strings, got: " + e.getKey());
                }
                entries.put(key, from(e.getValue()));
            }
            return new Obj(entries);
        }
        throw new ValueCodecException("No codec mapping for type " + value.getClass().getName());
    }
}
