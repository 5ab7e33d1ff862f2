package io.sqltx.util;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;

/**
 * Lightweight JSON encoder for dynamic values. Has no external dependencies.
 *
 * <p>Maps encode as objects in their iteration order, {@link Iterable}s and arrays as arrays,
 * numbers in their shortest decimal form (non-finite floats as {@code null}), and any other
 * object as the JSON string of its {@code toString()}.
 *
 * <p>This is the default {@link JsonCodec} implementation, accessible via
 * {@link JsonCodec#getDefault()} or the singleton {@link #INSTANCE}.
 */
public final class DefaultJsonCodec implements JsonCodec {
    static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

    DefaultJsonCodec() {
    }

    @Override
    public String toJson(Object value) {
        StringBuilder sb = new StringBuilder();
        write(sb, value);
        return sb.toString();
    }

    private static void write(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof Boolean b) {
            sb.append(b.booleanValue());
        } else if (value instanceof Number n) {
            writeNumber(sb, n);
        } else if (value instanceof CharSequence || value instanceof Character) {
            writeString(sb, value.toString());
        } else if (value instanceof Map<?, ?> map) {
            writeObject(sb, map);
        } else if (value instanceof Iterable<?> items) {
            sb.append('[');
            boolean first = true;
            for (Object item : items) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                write(sb, item);
            }
            sb.append(']');
        } else if (value.getClass().isArray()) {
            sb.append('[');
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                if (i > 0) {
                    sb.append(',');
                }
                write(sb, Array.get(value, i));
            }
            sb.append(']');
        } else if (value instanceof Optional<?> optional) {
            write(sb, optional.orElse(null));
        } else {
            writeString(sb, value.toString());
        }
    }

    private static void writeObject(StringBuilder sb, Map<?, ?> map) {
        sb.append('{');
        boolean first = true;
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("JSON objects cannot contain null keys");
            }
            if (!first) {
                sb.append(',');
            }
            first = false;
            writeString(sb, entry.getKey().toString());
            sb.append(':');
            write(sb, entry.getValue());
        }
        sb.append('}');
    }

    private static void writeNumber(StringBuilder sb, Number n) {
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                sb.append("null");
            } else {
                sb.append(Double.toString(d).replace('E', 'e'));
            }
        } else if (n instanceof BigDecimal decimal) {
            sb.append(decimal.toString());
        } else if (n instanceof BigInteger big) {
            sb.append(big.toString());
        } else {
            sb.append(n.longValue());
        }
    }

    private static void writeString(StringBuilder sb, String value) {
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }
}
