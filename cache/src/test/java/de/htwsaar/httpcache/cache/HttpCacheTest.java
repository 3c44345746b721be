package de.htwsaar.httpcache.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.htwsaar.httpcache.cache.domain.CacheOutcome;
import de.htwsaar.httpcache.cache.domain.CacheRecord;
import de.htwsaar.httpcache.cache.domain.CacheResult;
import de.htwsaar.httpcache.cache.domain.HttpStatusException;
import de.htwsaar.httpcache.cache.domain.TransportException;
import de.htwsaar.httpcache.cache.fake.FakeResponse;
import de.htwsaar.httpcache.cache.fake.ScriptedTransport;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.util.Map;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verhalten des Caches gegenüber einem geskripteten Origin.
 */
class HttpCacheTest {

    private static final URI URL = URI.create("http://example.com/data.json");
    private static final String LAST_MODIFIED = "Thu, 01 Jan 1970 00:00:00 GMT";

    @TempDir
    Path root;

    @Test
    void firstFetch_downloadsAndStores() throws IOException {
        ScriptedTransport transport = new ScriptedTransport()
                .expect(URL, Map.of(), FakeResponse.ok(URL, Map.of("Last-Modified", LAST_MODIFIED), "hello"));

        try (HttpCache cache = HttpCache.open(root, transport)) {
            CacheResult result = cache.fetchPath(URL);

            assertEquals(CacheOutcome.MISS, result.outcome());
            assertEquals("hello", Files.readString(result.file()));

            CacheRecord record = cache.lookup(URL).orElseThrow();
            assertTrue(record.path().startsWith("content/"), record.path());
            assertEquals(LAST_MODIFIED, record.lastModified());
            assertNull(record.etag());
            assertEquals(root.toAbsolutePath().normalize().resolve(record.path()), result.file());
        }
        transport.assertAllCalled();
        assertTrue(Files.exists(root.resolve(HttpCache.DATABASE_FILE)));
    }

    @Test
    void fetch_returnsReadableStream() throws IOException {
        ScriptedTransport transport = new ScriptedTransport().expect(URL, Map.of(), FakeResponse.ok(URL, "body"));

        try (HttpCache cache = HttpCache.open(root, transport);
                InputStream in = cache.fetch(URL)) {
            assertEquals("body", new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    @Test
    void firstFetch_closesResponse() throws IOException {
        FakeResponse response = FakeResponse.ok(URL, "hello");
        ScriptedTransport transport = new ScriptedTransport().expect(URL, Map.of(), response);

        try (HttpCache cache = HttpCache.open(root, transport)) {
            cache.fetchPath(URL);
        }
        assertTrue(response.isClosed());
    }

    @Test
    void firstFetch_errorStatusStoresNothing() throws IOException {
        FakeResponse response = FakeResponse.status(URL, 500);
        ScriptedTransport transport = new ScriptedTransport().expect(URL, Map.of(), response);

        try (HttpCache cache = HttpCache.open(root, transport)) {
            HttpStatusException e = assertThrows(HttpStatusException.class, () -> cache.fetchPath(URL));

            assertEquals(500, e.getStatusCode());
            assertEquals(URL, e.getUrl());
            assertTrue(cache.lookup(URL).isEmpty());
        }
        assertTrue(response.isClosed());
    }

    @Test
    void firstFetch_transportFailurePropagates() throws IOException {
        ScriptedTransport transport = new ScriptedTransport().expectFailure(URL, Map.of());

        try (HttpCache cache = HttpCache.open(root, transport)) {
            assertThrows(TransportException.class, () -> cache.fetchPath(URL));
            assertTrue(cache.lookup(URL).isEmpty());
        }
    }

    @Test
    void fragmentIsStrippedBeforeRequest() throws IOException {
        ScriptedTransport transport = new ScriptedTransport().expect(URL, Map.of(), FakeResponse.ok(URL, "hello"));

        try (HttpCache cache = HttpCache.open(root, transport)) {
            cache.fetchPath(URI.create("http://example.com/data.json#section"));

            assertTrue(cache.lookup(URL).isPresent());
        }
        assertEquals(URL, transport.received().get(0).uri());
    }

    @Test
    void secondFetch_notModifiedViaLastModified() throws IOException {
        ScriptedTransport transport = new ScriptedTransport()
                .expect(URL, Map.of(), FakeResponse.ok(URL, Map.of("Last-Modified", LAST_MODIFIED), "hello"))
                .expect(URL, Map.of("If-Modified-Since", LAST_MODIFIED), FakeResponse.status(URL, 304));

        try (HttpCache cache = HttpCache.open(root, transport)) {
            Path first = cache.fetchPath(URL).file();
            CacheResult second = cache.fetchPath(URL);

            assertEquals(CacheOutcome.REVALIDATED, second.outcome());
            assertEquals(first, second.file());
            assertEquals("hello", Files.readString(second.file()));
        }
        transport.assertAllCalled();
    }

    @Test
    void secondFetch_notModifiedViaEtag() throws IOException {
        ScriptedTransport transport = new ScriptedTransport()
                .expect(URL, Map.of(), FakeResponse.ok(URL, Map.of("ETag", "\"abcd\""), "hello"))
                .expect(URL, Map.of("If-None-Match", "\"abcd\""), FakeResponse.status(URL, 304));

        try (HttpCache cache = HttpCache.open(root, transport)) {
            cache.fetchPath(URL);

            assertEquals(CacheOutcome.REVALIDATED, cache.fetchPath(URL).outcome());
        }
        transport.assertAllCalled();
    }

    @Test
    void secondFetch_sendsBothValidators() throws IOException {
        ScriptedTransport transport = new ScriptedTransport()
                .expect(URL, Map.of(), FakeResponse.ok(URL, Map.of("ETag", "\"abcd\"", "Last-Modified", LAST_MODIFIED), "x"))
                .expect(URL, Map.of("If-None-Match", "\"abcd\"", "If-Modified-Since", LAST_MODIFIED),
                        FakeResponse.status(URL, 304));

        try (HttpCache cache = HttpCache.open(root, transport)) {
            cache.fetchPath(URL);
            cache.fetchPath(URL);
        }
        transport.assertAllCalled();
    }

    @Test
    void secondFetch_withoutValidatorsSendsPlainRequest() throws IOException {
        ScriptedTransport transport = new ScriptedTransport()
                .expect(URL, Map.of(), FakeResponse.ok(URL, "one"))
                .expect(URL, Map.of(), FakeResponse.ok(URL, "two"));

        try (HttpCache cache = HttpCache.open(root, transport)) {
            cache.fetchPath(URL);
            CacheResult second = cache.fetchPath(URL);

            assertEquals(CacheOutcome.UPDATED, second.outcome());
            assertEquals("two", Files.readString(second.file()));
        }
        transport.assertAllCalled();
    }

    @Test
    void modifiedResponse_replacesRecordAndContent() throws IOException {
        ScriptedTransport transport = new ScriptedTransport()
                .expect(URL, Map.of(), FakeResponse.ok(URL, Map.of("ETag", "\"abcd\""), "old"))
                .expect(URL, Map.of("If-None-Match", "\"abcd\""),
                        FakeResponse.ok(URL, Map.of("ETag", "\"efgh\""), "new"))
                .expect(URL, Map.of("If-None-Match", "\"efgh\""), FakeResponse.status(URL, 304));

        try (HttpCache cache = HttpCache.open(root, transport)) {
            Path oldFile = cache.fetchPath(URL).file();
            CacheResult updated = cache.fetchPath(URL);

            assertEquals(CacheOutcome.UPDATED, updated.outcome());
            assertNotEquals(oldFile, updated.file());
            assertEquals("new", Files.readString(updated.file()));
            assertEquals("\"efgh\"", cache.lookup(URL).orElseThrow().etag());
            // alte Datei bleibt verwaist liegen
            assertEquals("old", Files.readString(oldFile));

            CacheResult revalidated = cache.fetchPath(URL);
            assertEquals(CacheOutcome.REVALIDATED, revalidated.outcome());
            assertEquals(updated.file(), revalidated.file());
        }
        transport.assertAllCalled();
    }

    @Test
    void originUnreachable_servesStaleContent() throws IOException {
        ScriptedTransport online = new ScriptedTransport()
                .expect(URL, Map.of(), FakeResponse.ok(URL, Map.of("ETag", "\"abcd\""), "hello"));
        try (HttpCache cache = HttpCache.open(root, online)) {
            cache.fetchPath(URL);
        }

        ScriptedTransport offline = new ScriptedTransport().expectFailure(URL, Map.of("If-None-Match", "\"abcd\""));
        try (HttpCache cache = HttpCache.open(root, offline)) {
            CacheResult result = cache.fetchPath(URL);

            assertEquals(CacheOutcome.STALE_FALLBACK, result.outcome());
            assertEquals("hello", Files.readString(result.file()));
        }
        offline.assertAllCalled();
    }

    @Test
    void originErrorStatus_servesStaleContent() throws IOException {
        FakeResponse failure = FakeResponse.status(URL, 503);
        ScriptedTransport transport = new ScriptedTransport()
                .expect(URL, Map.of(), FakeResponse.ok(URL, Map.of("Last-Modified", LAST_MODIFIED), "hello"))
                .expect(URL, Map.of("If-Modified-Since", LAST_MODIFIED), failure);

        try (HttpCache cache = HttpCache.open(root, transport)) {
            Path first = cache.fetchPath(URL).file();
            CacheResult result = cache.fetchPath(URL);

            assertEquals(CacheOutcome.STALE_FALLBACK, result.outcome());
            assertEquals(first, result.file());
            assertEquals(LAST_MODIFIED, cache.lookup(URL).orElseThrow().lastModified());
        }
        assertTrue(failure.isClosed());
    }

    @Test
    void missingContentFile_failsOnNotModified() throws IOException {
        ScriptedTransport transport = new ScriptedTransport()
                .expect(URL, Map.of(), FakeResponse.ok(URL, Map.of("ETag", "\"abcd\""), "hello"))
                .expect(URL, Map.of("If-None-Match", "\"abcd\""), FakeResponse.status(URL, 304));

        try (HttpCache cache = HttpCache.open(root, transport)) {
            Files.delete(cache.fetchPath(URL).file());

            assertThrows(NoSuchFileException.class, () -> cache.fetchPath(URL));
        }
    }

    @Test
    void corruptRecord_isFetchedAgain() throws Exception {
        try (HttpCache ignored = HttpCache.open(root, new ScriptedTransport())) {
            try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + root.resolve(HttpCache.DATABASE_FILE))) {
                DSL.using(conn, SQLDialect.SQLITE).execute(
                        "INSERT INTO urls (url, path) VALUES ('" + URL + "', CAST('abc' AS BLOB))");
            }
        }

        ScriptedTransport transport = new ScriptedTransport().expect(URL, Map.of(), FakeResponse.ok(URL, "fresh"));
        try (HttpCache cache = HttpCache.open(root, transport)) {
            CacheResult result = cache.fetchPath(URL);

            assertEquals(CacheOutcome.MISS, result.outcome());
            assertEquals("fresh", Files.readString(result.file()));
            assertTrue(cache.lookup(URL).orElseThrow().path().startsWith("content/"));
        }
        transport.assertAllCalled();
    }

    @Test
    void openCreatesMissingRoot() throws IOException {
        Path nested = root.resolve("a/b/c");

        try (HttpCache cache = HttpCache.open(nested, new ScriptedTransport())) {
            assertTrue(Files.isDirectory(nested));
            assertEquals(nested.toAbsolutePath().normalize(), cache.root());
        }
    }

    @Test
    void cachesOnSameRootAreEqual() throws IOException {
        try (HttpCache one = HttpCache.open(root, new ScriptedTransport());
                HttpCache two = HttpCache.open(root.resolve("."), new ScriptedTransport());
                HttpCache other = HttpCache.open(root.resolve("other"), new ScriptedTransport())) {
            assertEquals(one, two);
            assertEquals(one.hashCode(), two.hashCode());
            assertNotEquals(one, other);
        }
    }
}
