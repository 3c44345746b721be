package de.htwsaar.httpcache.cache.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Ergebnis einer Cache-Anfrage. Enthält keine Transport-Typen.
 *
 * @param file    vollständig geschriebene Body-Datei
 * @param outcome Entscheidung der Revalidierung
 */
public record CacheResult(Path file, CacheOutcome outcome) {

    public CacheResult {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
    }
}
