package de.htwsaar.httpcache.cache.store;

/**
 * Die Metadaten-Datenbank konnte nicht geöffnet oder ihr Schema nicht angelegt werden.
 */
public class StoreInitException extends CacheStoreException {

    public StoreInitException(String message, Throwable cause) {
        super(message, cause);
    }
}
