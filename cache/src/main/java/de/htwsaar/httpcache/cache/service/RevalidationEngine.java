package de.htwsaar.httpcache.cache.service;

import de.htwsaar.httpcache.cache.content.ContentStore;
import de.htwsaar.httpcache.cache.content.NewContentFile;
import de.htwsaar.httpcache.cache.domain.CacheOutcome;
import de.htwsaar.httpcache.cache.domain.CacheRecord;
import de.htwsaar.httpcache.cache.domain.CacheResult;
import de.htwsaar.httpcache.cache.domain.HttpStatusException;
import de.htwsaar.httpcache.cache.domain.HttpTransport;
import de.htwsaar.httpcache.cache.domain.TransportException;
import de.htwsaar.httpcache.cache.domain.TransportResponse;
import de.htwsaar.httpcache.cache.store.CacheMetadataStore;
import de.htwsaar.httpcache.cache.store.CorruptRecordException;
import de.htwsaar.httpcache.cache.store.PendingWrite;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entscheidet pro Anfrage, ob vorhandener Inhalt ausgeliefert, neu geladen oder
 * bei Problemen mit dem Origin ungeprüft weiterverwendet wird.
 *
 * <p>Ablauf:</p>
 * <ol>
 *   <li>Eintrag nachschlagen; fehlt er (oder ist sein Pfad unlesbar), wird unbedingt geladen.</li>
 *   <li>Sonst bedingte Anfrage mit {@code If-Modified-Since} / {@code If-None-Match}.</li>
 *   <li>304 → vorhandener Inhalt. 4xx/5xx oder Transportfehler → vorhandener Inhalt (mit Warnung).
 *       Jeder andere Status → neue Antwort wird gespeichert.</li>
 * </ol>
 *
 * <p>Beim Speichern wird der Body immer vollständig geschrieben, bevor die Metadaten
 * committet werden.</p>
 */
public class RevalidationEngine {

    private static final Logger log = LoggerFactory.getLogger(RevalidationEngine.class);

    static final String IF_MODIFIED_SINCE = "If-Modified-Since";
    static final String IF_NONE_MATCH = "If-None-Match";
    static final int NOT_MODIFIED = 304;

    private final CacheMetadataStore metadataStore;
    private final ContentStore contentStore;
    private final HttpTransport transport;

    /**
     * Erstellt die Engine.
     *
     * @param metadataStore Metadaten (darf nicht {@code null} sein)
     * @param contentStore  Body-Ablage (darf nicht {@code null} sein)
     * @param transport     Port zum Origin (darf nicht {@code null} sein)
     */
    public RevalidationEngine(CacheMetadataStore metadataStore, ContentStore contentStore, HttpTransport transport) {
        this.metadataStore = Objects.requireNonNull(metadataStore, "metadataStore must not be null");
        this.contentStore = Objects.requireNonNull(contentStore, "contentStore must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
    }

    /**
     * Löst eine URL zu einer vollständig geschriebenen Datei auf.
     *
     * @param url URL ohne Fragment
     * @return Datei und Entscheidung
     * @throws TransportException  wenn beim ersten Laden keine Antwort zustande kam
     * @throws HttpStatusException wenn beim ersten Laden ein Fehlerstatus kam
     * @throws IOException         bei Dateisystemfehlern oder fehlender Body-Datei eines Eintrags
     */
    public CacheResult resolve(URI url) throws IOException {
        Optional<CacheRecord> existing = lookupExisting(url);

        if (existing.isEmpty()) {
            TransportResponse response = transport.execute(newRequest(url).build()).errorForStatus();
            return storeResponse(url, response, CacheOutcome.MISS);
        }

        CacheRecord record = existing.get();
        TransportResponse response;
        try {
            response = transport.execute(conditionalRequest(url, record)).errorForStatus();
        } catch (TransportException | HttpStatusException e) {
            log.warn("Could not validate cached response for {}: {}", url, e.getMessage());
            return serveExisting(record, CacheOutcome.STALE_FALLBACK);
        }

        if (response.status() == NOT_MODIFIED) {
            response.close();
            log.debug("{} not modified, serving cached content", url);
            return serveExisting(record, CacheOutcome.REVALIDATED);
        }

        return storeResponse(url, response, CacheOutcome.UPDATED);
    }

    /** Ein Eintrag mit unlesbarem Pfad zählt als nicht vorhanden. */
    private Optional<CacheRecord> lookupExisting(URI url) {
        try {
            return metadataStore.lookup(url);
        } catch (CorruptRecordException e) {
            log.warn("Ignoring unusable cache record for {}: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Baut die bedingte Anfrage. Fehlende Validatoren werden weggelassen, nie erfunden.
     */
    static HttpRequest conditionalRequest(URI url, CacheRecord record) {
        HttpRequest.Builder builder = newRequest(url);
        if (record.lastModified() != null) {
            builder.header(IF_MODIFIED_SINCE, record.lastModified());
        }
        if (record.etag() != null) {
            builder.header(IF_NONE_MATCH, record.etag());
        }
        return builder.build();
    }

    private static HttpRequest.Builder newRequest(URI url) {
        return HttpRequest.newBuilder(url).GET();
    }

    private CacheResult serveExisting(CacheRecord record, CacheOutcome outcome) throws IOException {
        Path file = contentStore.resolve(record.path());
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString(), null, "cache record exists but content file is missing");
        }
        return new CacheResult(file, outcome);
    }

    /**
     * Schreibt den Body in eine neue Datei und committet danach den neuen Eintrag.
     * Bricht das Schreiben ab, bleibt der alte Eintrag gültig.
     */
    private CacheResult storeResponse(URI url, TransportResponse response, CacheOutcome outcome) throws IOException {
        Path file;
        try (response; NewContentFile target = contentStore.createNewFile()) {
            long count = response.body().transferTo(target.out());
            log.debug("Downloaded {} bytes from {} into {}", count, url, target.path());
            file = target.path();
        }

        CacheRecord record = new CacheRecord(
                contentStore.relativize(file),
                response.headers().firstValue("Last-Modified").orElse(null),
                response.headers().firstValue("ETag").orElse(null),
                response.headers().firstValue("Expires").orElse(null));

        try (PendingWrite write = metadataStore.beginWrite(url, record)) {
            write.commit();
        }
        return new CacheResult(file, outcome);
    }
}
