package de.htwsaar.httpcache.common.serialization;

public class HttpCacheSerializationException extends RuntimeException {

    public HttpCacheSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
