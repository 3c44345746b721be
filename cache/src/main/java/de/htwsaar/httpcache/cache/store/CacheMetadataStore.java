package de.htwsaar.httpcache.cache.store;

import de.htwsaar.httpcache.cache.domain.CacheRecord;
import de.htwsaar.httpcache.common.util.UrlUtil;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;
import org.jooq.DSLContext;
import org.jooq.Param;
import org.jooq.Record;
import org.jooq.SQLDialect;
import org.jooq.exception.DataAccessException;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SQLite-Datenbank, die beschreibt, was im Cache liegt.
 *
 * <p>Genau ein Eintrag pro URL (ohne Fragment). Schreibzugriffe laufen ausschließlich
 * über {@link #beginWrite(URI, CacheRecord)} und werden erst mit
 * {@link PendingWrite#commit()} sichtbar.</p>
 *
 * <p>Nicht thread-safe: eine Instanz hält genau eine JDBC-Verbindung.</p>
 */
public final class CacheMetadataStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CacheMetadataStore.class);

    /** Sonderwert für eine rein prozesslokale Datenbank ohne Datei. */
    public static final String IN_MEMORY = ":memory:";

    private static final String SQLITE_TEXT = "text";
    private static final String SQLITE_NULL = "null";

    private final String location;
    private final Connection connection;
    private final DSLContext dsl;

    private CacheMetadataStore(String location, Connection connection) {
        this.location = location;
        this.connection = connection;
        this.dsl = DSL.using(connection, SQLDialect.SQLITE);
    }

    /**
     * Öffnet die Datenbank in der gegebenen Datei und legt Datei und Schema bei Bedarf an.
     *
     * @param file Datenbankdatei; das Elternverzeichnis muss existieren
     * @return geöffneter Store
     * @throws StoreInitException wenn Datei oder Schema nicht angelegt werden können
     */
    public static CacheMetadataStore open(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        return open(file.toString());
    }

    /**
     * Öffnet eine nicht persistente Datenbank, die nur so lange lebt wie die Instanz.
     *
     * @return geöffneter Store
     */
    public static CacheMetadataStore inMemory() {
        return open(IN_MEMORY);
    }

    /**
     * Öffnet die Datenbank am gegebenen Ort.
     *
     * @param location Dateipfad oder {@value #IN_MEMORY}
     * @return geöffneter Store
     * @throws StoreInitException wenn Datei oder Schema nicht angelegt werden können
     */
    public static CacheMetadataStore open(String location) {
        Objects.requireNonNull(location, "location must not be null");
        String canonical = canonicalizeLocation(location);
        log.debug("Opening cache metadata in {}", canonical);

        Connection connection;
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + canonical);
        } catch (SQLException e) {
            throw new StoreInitException("Cannot open cache metadata at " + canonical, e);
        }

        CacheMetadataStore store = new CacheMetadataStore(canonical, connection);
        try {
            store.initializeSchema();
        } catch (DataAccessException e) {
            store.close();
            throw new StoreInitException("Cannot create cache schema in " + canonical, e);
        }
        return store;
    }

    /**
     * Kanonisiert den Pfad, damit zwei Instanzen zuverlässig verglichen werden können.
     * Nur das Elternverzeichnis muss existieren, die Datei selbst nicht.
     */
    private static String canonicalizeLocation(String location) {
        if (IN_MEMORY.equals(location)) {
            return location;
        }

        Path path = Path.of(location);
        Path parent = path.toAbsolutePath().getParent();
        Path fileName = path.getFileName();
        if (parent == null || fileName == null) {
            throw new StoreInitException("Not a usable database file: " + location, null);
        }
        try {
            return parent.toRealPath().resolve(fileName).toString();
        } catch (IOException e) {
            throw new StoreInitException("Parent directory of " + location + " is not usable", e);
        }
    }

    private void initializeSchema() {
        dsl.execute("""
                    CREATE TABLE IF NOT EXISTS urls (
                        url TEXT NOT NULL UNIQUE,
                        path TEXT NOT NULL,
                        last_modified TEXT,
                        etag TEXT,
                        expires TEXT
                    )
                """);
    }

    /**
     * Liefert, was die Datenbank über eine URL weiß.
     *
     * <p>Optionale Spalten mit falschem Typ gelten als nicht gesetzt; eine {@code path}-Spalte
     * mit falschem Typ ist dagegen ein harter Fehler.</p>
     *
     * @param url URL, ein Fragment wird ignoriert
     * @return Eintrag oder leer, wenn die URL unbekannt ist
     * @throws CorruptRecordException wenn {@code path} kein Text ist
     * @throws CacheStoreException    bei Datenbankfehlern
     */
    public Optional<CacheRecord> lookup(URI url) {
        String key = UrlUtil.stripFragment(url).toString();

        Record row;
        try {
            log.debug("Looking up {}", key);
            row = dsl.fetchOne("""
                    SELECT path, typeof(path) AS path_type,
                           last_modified, typeof(last_modified) AS last_modified_type,
                           etag, typeof(etag) AS etag_type,
                           expires, typeof(expires) AS expires_type
                    FROM urls
                    WHERE url = {0}
                    """, text(key));
        } catch (DataAccessException e) {
            throw new CacheStoreException("Failed to look up " + key, e);
        }

        if (row == null) {
            return Optional.empty();
        }

        String pathType = row.get("path_type", String.class);
        if (!SQLITE_TEXT.equals(pathType)) {
            throw new CorruptRecordException("path had wrong type: " + pathType);
        }

        CacheRecord record = new CacheRecord(
                row.get("path", String.class),
                optionalText(row, key, "last_modified"),
                optionalText(row, key, "etag"),
                optionalText(row, key, "expires"));

        log.debug("Cache says {} content is at {}, etag {}, last modified {}",
                key, record.path(), record.etag(), record.lastModified());
        return Optional.of(record);
    }

    private static String optionalText(Record row, String key, String column) {
        String type = row.get(column + "_type", String.class);
        if (SQLITE_TEXT.equals(type)) {
            return row.get(column, String.class);
        }
        if (!SQLITE_NULL.equals(type)) {
            log.warn("{} for {} contained unexpected type {}, ignoring it", column, key, type);
        }
        return null;
    }

    /**
     * Startet eine Transaktion und schreibt (bzw. ersetzt) den Eintrag für die URL.
     *
     * <p>Der Eintrag wird erst mit {@link PendingWrite#commit()} sichtbar. Wird das Handle
     * ohne Commit geschlossen, bleibt die Datenbank unverändert.</p>
     *
     * @param url    URL, ein Fragment wird ignoriert
     * @param record vollständiger neuer Eintrag
     * @return offene Transaktion, muss geschlossen werden
     * @throws CacheStoreException wenn Transaktion oder Schreibzugriff fehlschlagen
     */
    public PendingWrite beginWrite(URI url, CacheRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        String key = UrlUtil.stripFragment(url).toString();

        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            throw new CacheStoreException("Failed to start transaction for " + key, e);
        }

        // Ab hier räumt das Handle die Transaktion auf
        PendingWrite write = new PendingWrite(connection, key);
        try {
            dsl.execute("""
                    INSERT OR REPLACE INTO urls (url, path, last_modified, etag, expires)
                    VALUES ({0}, {1}, {2}, {3}, {4})
                    """,
                    text(key),
                    text(record.path()),
                    text(record.lastModified()),
                    text(record.etag()),
                    text(record.expires()));
        } catch (DataAccessException e) {
            write.close();
            throw new CacheStoreException("Failed to record " + key, e);
        }
        return write;
    }

    private static Param<String> text(String value) {
        return DSL.val(value, SQLDataType.VARCHAR);
    }

    /**
     * Kanonischer Ort der Datenbank oder {@value #IN_MEMORY}.
     *
     * @return Ort als String
     */
    public String location() {
        return location;
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new CacheStoreException("Failed to close cache metadata at " + location, e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheMetadataStore other)) return false;
        return location.equals(other.location);
    }

    @Override
    public int hashCode() {
        return location.hashCode();
    }

    @Override
    public String toString() {
        return "CacheMetadataStore{path=" + location + "}";
    }
}
