package de.htwsaar.httpcache.common.serialization;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

public final class JacksonCodec {

    private static final ObjectMapper PRETTY_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private JacksonCodec() {
        // Utility
    }

    /**
     * Serialisiert ein Objekt als eingerücktes JSON; {@code null}-Felder werden weggelassen.
     *
     * @param obj zu serialisierendes Objekt
     * @return JSON-Text
     * @throws HttpCacheSerializationException wenn das Objekt nicht serialisierbar ist
     */
    public static String toPrettyJson(Object obj) {
        try {
            return PRETTY_MAPPER.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new HttpCacheSerializationException(
                    "Failed to serialize [" + obj.getClass().getSimpleName() + "] to JSON", e);
        }
    }
}
