package de.htwsaar.httpcache.cli.command;

import de.htwsaar.httpcache.cli.app.HttpCacheCliMain;
import de.htwsaar.httpcache.cli.di.CliContext;
import java.io.ByteArrayOutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Führt CLI-Befehle mit abgefangenen Ausgabekanälen aus.
 */
final class CliHarness {

    final StringWriter out = new StringWriter();
    final StringWriter err = new StringWriter();
    final ByteArrayOutputStream raw = new ByteArrayOutputStream();

    private final CliContext ctx = new CliContext(
            new PrintWriter(out, true),
            new PrintWriter(err, true),
            raw,
            HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build(),
            Duration.ofSeconds(5));

    int run(String... args) {
        return HttpCacheCliMain.commandLine(ctx).execute(args);
    }

    String rawText() {
        return raw.toString(StandardCharsets.UTF_8);
    }
}
