package de.htwsaar.httpcache.cache.domain;

import java.net.URI;

/**
 * Der Origin hat mit einem Fehlerstatus (400–599) geantwortet.
 */
public class HttpStatusException extends HttpCacheException {

    private final URI url;
    private final int statusCode;

    /**
     * Erstellt eine neue Status-Exception.
     *
     * @param url        angefragte URL
     * @param statusCode empfangener HTTP-Statuscode
     */
    public HttpStatusException(URI url, int statusCode) {
        super("Origin responded with " + statusCode + " for " + url);
        this.url = url;
        this.statusCode = statusCode;
    }

    public URI getUrl() {
        return url;
    }

    /**
     * Gibt den empfangenen HTTP-Statuscode zurück.
     *
     * @return HTTP-Statuscode
     */
    public int getStatusCode() {
        return statusCode;
    }
}
