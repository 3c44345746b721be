package de.htwsaar.httpcache.cache.store;

import de.htwsaar.httpcache.cache.domain.HttpCacheException;

/**
 * Fehler der Metadaten-Datenbank (Abfrage, Transaktion, Commit).
 */
public class CacheStoreException extends HttpCacheException {

    public CacheStoreException(String message) {
        super(message);
    }

    public CacheStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
