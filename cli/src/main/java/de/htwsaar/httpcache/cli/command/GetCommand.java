package de.htwsaar.httpcache.cli.command;

import de.htwsaar.httpcache.cache.HttpCache;
import de.htwsaar.httpcache.cache.adapter.http.JdkHttpTransport;
import de.htwsaar.httpcache.cache.domain.CacheResult;
import de.htwsaar.httpcache.cache.domain.HttpCacheException;
import de.htwsaar.httpcache.cache.domain.HttpStatusException;
import de.htwsaar.httpcache.cache.domain.TransportException;
import de.htwsaar.httpcache.cli.di.CliContext;
import de.htwsaar.httpcache.common.util.UrlUtil;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Löst eine URL über den Cache auf und gibt den Body aus.
 *
 * <p>Ohne {@code -o} wird der Body unverändert auf stdout geschrieben, Meldungen gehen
 * dann ausschließlich nach stderr.
 *
 * <p>Exit-Codes:
 * <ul>
 *   <li>0 = OK</li>
 *   <li>2 = ungültige URL (kein Request)</li>
 *   <li>1 = Transport-, HTTP- oder I/O-Fehler</li>
 * </ul>
 */
@Command(
        name = "get",
        description = "Fetch a URL through the cache",
        mixinStandardHelpOptions = true,
        footerHeading = "%nBeispiele:%n",
        footer = {
            "  httpcache get ./cache https://example.com/data.json",
            "  httpcache get ./cache https://example.com/data.json -o ./data.json --timeout 10"
        })
public final class GetCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GetCommand.class);

    private final CliContext ctx;

    @Parameters(index = "0", paramLabel = "<cacheDir>", description = "Cache root directory (created if missing)")
    private Path cacheDir;

    @Parameters(index = "1", paramLabel = "<url>", description = "http or https URL")
    private String url;

    @Option(names = {"-o", "--out"}, paramLabel = "FILE", description = "Write the body to FILE instead of stdout")
    private Path out;

    @Option(
            names = {"--timeout"},
            paramLabel = "SECONDS",
            description = "Request timeout in seconds (default: context default)")
    private Long timeoutSeconds;

    /**
     * Konstruktor für Constructor Injection via {@code ContextFactory}.
     *
     * @param ctx CLI-Kontext
     */
    public GetCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public Integer call() {
        Optional<URI> parsed = UrlUtil.parseHttpUrl(url);
        if (parsed.isEmpty()) {
            ctx.err().printf("[GET] Invalid URL (must be absolute http/https): %s%n", url);
            ctx.err().flush();
            return 2;
        }
        if (timeoutSeconds != null && timeoutSeconds <= 0) {
            ctx.err().println("[GET] --timeout must be positive");
            ctx.err().flush();
            return 2;
        }
        if (out != null && Files.isDirectory(out)) {
            ctx.err().printf("[GET] Output path is a directory: %s%n", out);
            ctx.err().flush();
            return 1;
        }

        Duration timeout = timeoutSeconds == null ? ctx.defaultRequestTimeout() : Duration.ofSeconds(timeoutSeconds);
        URI target = parsed.get();

        try (HttpCache cache = HttpCache.open(cacheDir, new JdkHttpTransport(ctx.httpClient(), timeout))) {
            CacheResult result = cache.fetchPath(target);
            try (InputStream in = Files.newInputStream(result.file())) {
                if (out == null) {
                    in.transferTo(ctx.rawOut());
                    ctx.rawOut().flush();
                } else {
                    Path parent = out.toAbsolutePath().getParent();
                    if (parent != null) {
                        Files.createDirectories(parent);
                    }
                    long bytes = Files.copy(in, out, StandardCopyOption.REPLACE_EXISTING);
                    ctx.out().printf("[GET] %s -> %s (%d bytes, %s)%n", target, out, bytes, result.outcome());
                    ctx.out().flush();
                }
            }
            return 0;
        } catch (HttpStatusException e) {
            ctx.err().printf("[GET] Origin responded with HTTP %d for %s%n", e.getStatusCode(), target);
            ctx.err().flush();
            return 1;
        } catch (TransportException e) {
            log.debug("Transport failure for {}", target, e);
            ctx.err().printf("[GET] Origin unreachable and nothing cached for %s: %s%n", target, e.getMessage());
            ctx.err().flush();
            return 1;
        } catch (HttpCacheException | IOException e) {
            log.debug("Fetching {} failed", target, e);
            ctx.err().printf("[GET] Failed: %s%n", e.getMessage());
            ctx.err().flush();
            return 1;
        }
    }
}
