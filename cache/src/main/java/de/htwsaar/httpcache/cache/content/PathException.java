package de.htwsaar.httpcache.cache.content;

import de.htwsaar.httpcache.cache.domain.HttpCacheException;

/**
 * Eine Datei liegt nicht dort, wo sie relativ zur Cache-Root erwartet wird.
 */
public class PathException extends HttpCacheException {

    public PathException(String message) {
        super(message);
    }
}
