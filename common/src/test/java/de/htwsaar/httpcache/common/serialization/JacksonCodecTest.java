package de.htwsaar.httpcache.common.serialization;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class JacksonCodecTest {

    record Sample(String path, String etag) {}

    @Test
    void testToPrettyJson() {
        String json = JacksonCodec.toPrettyJson(new Sample("content/abc", "\"v1\""));

        assertNotNull(json);
        assertTrue(json.contains("\"path\" : \"content/abc\""), json);
        assertTrue(json.contains("\"etag\" : \"\\\"v1\\\"\""), json);
    }

    @Test
    void testToPrettyJson_omitsNullFields() {
        String json = JacksonCodec.toPrettyJson(new Sample("content/abc", null));

        assertFalse(json.contains("etag"), json);
        assertTrue(json.contains("content/abc"), json);
    }

    @Test
    void testToPrettyJson_isMultiLine() {
        String json = JacksonCodec.toPrettyJson(new Sample("content/abc", "x"));

        assertTrue(json.lines().count() > 1, json);
    }

    @Test
    void testToPrettyJson_Unserializable_ThrowsException() {
        // Objekt ohne Properties
        assertThrows(HttpCacheSerializationException.class, () -> JacksonCodec.toPrettyJson(new Object()));
    }
}
