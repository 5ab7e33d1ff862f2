package io.sqltx.util;

/**
 * Encoder producing the canonical JSON text of a dynamic value.
 *
 * <p>Used as the fallback binding for parameters that are neither null, text, numbers nor
 * booleans (lists, arrays, maps, arbitrary objects). The default implementation
 * ({@link DefaultJsonCodec}) has no external dependencies. Users who already have Jackson,
 * Gson, or another JSON library on the classpath can implement this interface to delegate to
 * their preferred library.
 *
 * @see #getDefault()
 * @see DefaultJsonCodec
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a value as compact JSON text.
     *
     * @param value the value to encode, possibly {@code null}
     * @return JSON text, {@code "null"} for a null value
     * @throws IllegalArgumentException if a map contains a null key
     */
    String toJson(Object value);
}
