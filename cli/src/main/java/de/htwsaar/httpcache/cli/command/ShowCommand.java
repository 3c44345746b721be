package de.htwsaar.httpcache.cli.command;

import de.htwsaar.httpcache.cache.HttpCache;
import de.htwsaar.httpcache.cache.domain.CacheRecord;
import de.htwsaar.httpcache.cache.store.CacheMetadataStore;
import de.htwsaar.httpcache.cache.store.CacheStoreException;
import de.htwsaar.httpcache.cache.store.CorruptRecordException;
import de.htwsaar.httpcache.cli.di.CliContext;
import de.htwsaar.httpcache.common.serialization.JacksonCodec;
import de.htwsaar.httpcache.common.util.UrlUtil;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Zeigt den gespeicherten Eintrag einer URL, ohne den Origin zu kontaktieren.
 *
 * <p>Exit-Codes:
 * <ul>
 *   <li>0 = Eintrag gefunden</li>
 *   <li>2 = ungültige URL</li>
 *   <li>3 = kein Eintrag (oder kein Cache im Verzeichnis)</li>
 *   <li>1 = Eintrag beschädigt oder Datenbankfehler</li>
 * </ul>
 */
@Command(
        name = "show",
        description = "Print the stored metadata record for a URL",
        mixinStandardHelpOptions = true,
        footerHeading = "%nBeispiele:%n",
        footer = {
            "  httpcache show ./cache https://example.com/data.json",
            "  httpcache show ./cache https://example.com/data.json --json"
        })
public final class ShowCommand implements Callable<Integer> {

    private static final String ABSENT = "-";

    private final CliContext ctx;

    @Parameters(index = "0", paramLabel = "<cacheDir>", description = "Cache root directory")
    private Path cacheDir;

    @Parameters(index = "1", paramLabel = "<url>", description = "http or https URL")
    private String url;

    @Option(names = {"--json"}, description = "Print the record as JSON")
    private boolean json;

    /**
     * Konstruktor für Constructor Injection via {@code ContextFactory}.
     *
     * @param ctx CLI-Kontext
     */
    public ShowCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public Integer call() {
        Optional<URI> parsed = UrlUtil.parseHttpUrl(url);
        if (parsed.isEmpty()) {
            ctx.err().printf("[SHOW] Invalid URL (must be absolute http/https): %s%n", url);
            ctx.err().flush();
            return 2;
        }
        URI target = parsed.get();

        // kein Cache anlegen, nur um nachzuschauen
        Path database = cacheDir.resolve(HttpCache.DATABASE_FILE);
        if (!Files.isRegularFile(database)) {
            ctx.err().printf("[SHOW] No cache in %s%n", cacheDir);
            ctx.err().flush();
            return 3;
        }

        Optional<CacheRecord> record;
        try (CacheMetadataStore store = CacheMetadataStore.open(database)) {
            record = store.lookup(target);
        } catch (CorruptRecordException e) {
            ctx.err().printf("[SHOW] Stored record for %s is corrupt: %s%n", target, e.getMessage());
            ctx.err().flush();
            return 1;
        } catch (CacheStoreException e) {
            ctx.err().printf("[SHOW] Cannot read cache database %s: %s%n", database, e.getMessage());
            ctx.err().flush();
            return 1;
        }

        if (record.isEmpty()) {
            ctx.err().printf("[SHOW] No record for %s%n", target);
            ctx.err().flush();
            return 3;
        }

        CacheRecord r = record.get();
        if (json) {
            ctx.out().println(JacksonCodec.toPrettyJson(r));
        } else {
            ctx.out().printf("url:           %s%n", UrlUtil.stripFragment(target));
            ctx.out().printf("path:          %s%n", r.path());
            ctx.out().printf("last-modified: %s%n", Objects.toString(r.lastModified(), ABSENT));
            ctx.out().printf("etag:          %s%n", Objects.toString(r.etag(), ABSENT));
            ctx.out().printf("expires:       %s%n", Objects.toString(r.expires(), ABSENT));
        }
        ctx.out().flush();
        return 0;
    }
}
