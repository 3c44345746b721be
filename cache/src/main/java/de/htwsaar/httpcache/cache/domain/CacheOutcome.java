package de.htwsaar.httpcache.cache.domain;

/**
 * Wie eine Anfrage beantwortet wurde.
 */
public enum CacheOutcome {
    /** Kein (lesbarer) Eintrag vorhanden, Antwort wurde neu geladen. */
    MISS,
    /** Origin hat 304 geliefert, vorhandener Inhalt wird ausgeliefert. */
    REVALIDATED,
    /** Origin hat neuen Inhalt geliefert, Eintrag wurde ersetzt. */
    UPDATED,
    /** Revalidierung fehlgeschlagen, vorhandener Inhalt wird ungeprüft ausgeliefert. */
    STALE_FALLBACK
}
