package com.techstock.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TagCodecTest {

    private final TagCodec tagCodec = new TagCodec(new ObjectMapper());

    @Test
    void testDecode_FlattensValues() {
        Optional<Map<String, String>> tags = tagCodec.decode("{\"Env\":\"prod\",\"Cost\":12,\"Gone\":null}");

        assertEquals(Optional.of(Map.of("Env", "prod", "Cost", "12")), tags);
    }

    @Test
    void testDecode_EmptyForms() {
        assertEquals(Optional.of(Map.of()), tagCodec.decode(null));
        assertEquals(Optional.of(Map.of()), tagCodec.decode(" "));
        assertEquals(Optional.of(Map.of()), tagCodec.decode("null"));
    }

    @Test
    void testDecode_RejectsNonObjects() {
        assertTrue(tagCodec.decode("[1,2]").isEmpty());
        assertTrue(tagCodec.decode("{oops").isEmpty());
        assertEquals(Map.of(), tagCodec.decodeOrEmpty("{oops"));
    }

    @Test
    void testEncode_SortedKeys() {
        assertEquals("{\"a\":\"1\",\"b\":\"2\"}", tagCodec.encode(Map.of("b", "2", "a", "1")));
        assertEquals("{}", tagCodec.encode(null));
    }
}
