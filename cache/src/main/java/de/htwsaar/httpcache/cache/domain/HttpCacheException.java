package de.htwsaar.httpcache.cache.domain;

/**
 * Basisklasse aller fachlichen Cache-Fehler.
 * Dateisystemfehler werden dagegen als {@link java.io.IOException} gemeldet.
 */
public class HttpCacheException extends RuntimeException {

    public HttpCacheException(String message) {
        super(message);
    }

    public HttpCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
