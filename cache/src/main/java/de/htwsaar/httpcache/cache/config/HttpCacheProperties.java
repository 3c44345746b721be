package de.htwsaar.httpcache.cache.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Konfiguration eines Cache-Exemplars.
 *
 * @param root            Cache-Verzeichnis
 * @param connectTimeout  Verbindungs-Timeout zum Origin
 * @param requestTimeout  Timeout pro Anfrage
 * @param followRedirects ob Redirects automatisch verfolgt werden
 */
public record HttpCacheProperties(Path root, Duration connectTimeout, Duration requestTimeout, boolean followRedirects) {

    public HttpCacheProperties {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
        Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
    }
}
