package io.sqltx.util;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DefaultJsonCodecTest {

    private final JsonCodec codec = JsonCodec.getDefault();

    @Test
    void defaultIsSingleton() {
        assertSame(DefaultJsonCodec.INSTANCE, JsonCodec.getDefault());
    }

    @Test
    void encodesScalars() {
        assertEquals("null", codec.toJson(null));
        assertEquals("true", codec.toJson(true));
        assertEquals("42", codec.toJson(42));
        assertEquals("1.5", codec.toJson(1.5d));
        assertEquals("\"hi\"", codec.toJson("hi"));
    }

    @Test
    void encodesNonFiniteAsNull() {
        assertEquals("[null,null]", codec.toJson(List.of(Double.NaN, Double.NEGATIVE_INFINITY)));
    }

    @Test
    void encodesListsAndArrays() {
        assertEquals("[1,2,3]", codec.toJson(List.of(1, 2, 3)));
        assertEquals("[1,2]", codec.toJson(new int[]{1, 2}));
        assertEquals("[\"a\",null]", codec.toJson(Arrays.asList("a", null)));
    }

    @Test
    void encodesMapsInIterationOrder() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("b", 1);
        map.put("a", List.of(true, "x"));
        map.put("n", null);
        assertEquals("{\"b\":1,\"a\":[true,\"x\"],\"n\":null}", codec.toJson(map));
    }

    @Test
    void escapesControlCharacters() {
        assertEquals("\"a\\\"b\\\\c\\n\\u0001\"", codec.toJson("a\"b\\c\n\u0001"));
    }

    @Test
    void unwrapsOptional() {
        assertEquals("\"v\"", codec.toJson(Optional.of("v")));
        assertEquals("null", codec.toJson(Optional.empty()));
    }

    @Test
    void rejectsNullKeys() {
        Map<String, Object> map = new HashMap<>();
        map.put(null, 1);
        assertThrows(IllegalArgumentException.class, () -> codec.toJson(map));
    }

    @Test
    void otherObjectsEncodeAsStrings() {
        assertEquals("\"PT1S\"", codec.toJson(java.time.Duration.ofSeconds(1)));
    }
}
