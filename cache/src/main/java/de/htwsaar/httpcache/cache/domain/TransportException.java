package de.htwsaar.httpcache.cache.domain;

/**
 * Der Origin war nicht erreichbar (Netzwerk, TLS, Timeout, Abbruch).
 * HTTP-Fehlerstatus fallen <b>nicht</b> hierunter, siehe {@link HttpStatusException}.
 */
public class TransportException extends HttpCacheException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
