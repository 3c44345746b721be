package de.htwsaar.httpcache.cache;

import de.htwsaar.httpcache.cache.content.ContentStore;
import de.htwsaar.httpcache.cache.domain.CacheRecord;
import de.htwsaar.httpcache.cache.domain.CacheResult;
import de.htwsaar.httpcache.cache.domain.HttpTransport;
import de.htwsaar.httpcache.cache.service.RevalidationEngine;
import de.htwsaar.httpcache.cache.store.CacheMetadataStore;
import de.htwsaar.httpcache.common.logging.TraceScope;
import de.htwsaar.httpcache.common.util.UrlUtil;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lokaler Cache für HTTP-Bodies.
 *
 * <p>Anfragen an unbekannte URLs werden geladen und gespeichert; bekannte URLs werden
 * beim Origin revalidiert und aus dem Cache geliefert, solange sich nichts geändert hat.
 * Ist der Origin nicht erreichbar, wird der vorhandene Inhalt geliefert.</p>
 *
 * <p>Layout unter der Root: {@code cache.db} und {@code content/}. Die Root darf jederzeit
 * gelöscht werden.</p>
 *
 * <pre>{@code
 * try (HttpCache cache = HttpCache.open(root, new JdkHttpTransport(client, timeout));
 *      InputStream in = cache.fetch(URI.create("https://example.com/data.json"))) {
 *     in.transferTo(out);
 * }
 * }</pre>
 */
public final class HttpCache implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpCache.class);

    /** Dateiname der Metadaten-Datenbank unter der Root. */
    public static final String DATABASE_FILE = "cache.db";

    private final Path root;
    private final CacheMetadataStore metadataStore;
    private final RevalidationEngine engine;

    HttpCache(Path root, CacheMetadataStore metadataStore, RevalidationEngine engine) {
        this.root = root;
        this.metadataStore = metadataStore;
        this.engine = engine;
    }

    /**
     * Öffnet den Cache in {@code root}. Existiert das Verzeichnis nicht, wird es angelegt;
     * vorhandene Daten bleiben verfügbar.
     *
     * @param root      Cache-Verzeichnis
     * @param transport Port zum Origin
     * @return geöffneter Cache
     * @throws IOException                                           wenn das Verzeichnis nicht angelegt werden kann
     * @throws de.htwsaar.httpcache.cache.store.StoreInitException wenn die Datenbank nicht geöffnet werden kann
     */
    public static HttpCache open(Path root, HttpTransport transport) throws IOException {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(transport, "transport must not be null");

        Files.createDirectories(root);
        CacheMetadataStore store = CacheMetadataStore.open(root.resolve(DATABASE_FILE));
        ContentStore contentStore = new ContentStore(root);
        log.debug("Opened HTTP cache in {}", contentStore.root());

        return new HttpCache(contentStore.root(), store, new RevalidationEngine(store, contentStore, transport));
    }

    /**
     * Liefert den Inhalt einer URL aus Cache oder Origin.
     *
     * @param url URL, ein Fragment wird ignoriert
     * @return Stream über die vollständig geschriebene Body-Datei, muss geschlossen werden
     * @throws IOException bei Dateisystemfehlern
     * @throws de.htwsaar.httpcache.cache.domain.HttpCacheException wenn weder Cache noch Origin eine Antwort liefern
     */
    public synchronized InputStream fetch(URI url) throws IOException {
        return Files.newInputStream(fetchPath(url).file());
    }

    /**
     * Wie {@link #fetch(URI)}, liefert aber Datei und Entscheidung statt eines Streams.
     *
     * @param url URL, ein Fragment wird ignoriert
     * @return Ergebnis mit Datei und {@link de.htwsaar.httpcache.cache.domain.CacheOutcome}
     * @throws IOException bei Dateisystemfehlern
     */
    public synchronized CacheResult fetchPath(URI url) throws IOException {
        URI clean = UrlUtil.stripFragment(url);
        try (TraceScope ignored = TraceScope.open()) {
            CacheResult result = engine.resolve(clean);
            log.debug("{} resolved as {} -> {}", clean, result.outcome(), result.file());
            return result;
        }
    }

    /**
     * Liest den gespeicherten Eintrag, ohne den Origin zu kontaktieren.
     *
     * @param url URL, ein Fragment wird ignoriert
     * @return Eintrag oder leer
     */
    public synchronized Optional<CacheRecord> lookup(URI url) {
        return metadataStore.lookup(url);
    }

    public Path root() {
        return root;
    }

    @Override
    public synchronized void close() {
        metadataStore.close();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HttpCache other)) return false;
        return metadataStore.equals(other.metadataStore);
    }

    @Override
    public int hashCode() {
        return metadataStore.hashCode();
    }

    @Override
    public String toString() {
        return "HttpCache{root=" + root + "}";
    }
}
