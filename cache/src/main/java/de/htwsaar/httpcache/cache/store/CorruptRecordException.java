package de.htwsaar.httpcache.cache.store;

/**
 * Ein gespeicherter Wert hat einen unerwarteten Typ, dem nicht vertraut werden darf.
 */
public class CorruptRecordException extends CacheStoreException {

    public CorruptRecordException(String message) {
        super(message);
    }
}
