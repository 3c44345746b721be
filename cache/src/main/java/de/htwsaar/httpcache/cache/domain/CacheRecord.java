package de.htwsaar.httpcache.cache.domain;

import java.util.Objects;

/**
 * Alles, was der Cache über eine URL weiß.
 *
 * <p>Header-Werte werden unverändert übernommen und nicht geparst.</p>
 *
 * @param path         relativer Pfad der Body-Datei unterhalb der Cache-Root (mit {@code /} getrennt)
 * @param lastModified Wert des {@code Last-Modified}-Headers (optional)
 * @param etag         Wert des {@code ETag}-Headers (optional)
 * @param expires      Wert des {@code Expires}-Headers (optional, derzeit nur gespeichert)
 */
public record CacheRecord(String path, String lastModified, String etag, String expires) {

    public CacheRecord {
        Objects.requireNonNull(path, "path must not be null");
    }

}
