package de.htwsaar.httpcache.cli.app;

import de.htwsaar.httpcache.cli.command.HttpCacheCommand;
import de.htwsaar.httpcache.cli.di.CliContext;
import de.htwsaar.httpcache.cli.di.ContextFactory;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import picocli.CommandLine;

/**
 * Einstiegspunkt der CLI.
 *
 * <p>Baut die gemeinsame Infrastruktur (Ausgabekanäle, HTTP-Client, Standard-Timeout),
 * führt genau einen Befehl aus und beendet den Prozess mit dessen Exit-Code.
 */
public final class HttpCacheCliMain {

    static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);
    static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private HttpCacheCliMain() {}

    /**
     * Startet die CLI.
     *
     * @param args Kommandozeilenargumente
     */
    public static void main(String[] args) {
        PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
        PrintWriter err = new PrintWriter(new OutputStreamWriter(System.err, StandardCharsets.UTF_8), true);

        CliContext ctx = new CliContext(
                out,
                err,
                System.out,
                HttpClient.newBuilder()
                        .connectTimeout(CONNECT_TIMEOUT)
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                REQUEST_TIMEOUT);

        int rc = commandLine(ctx).execute(args);
        System.exit(rc);
    }

    /**
     * Baut den Kommandobaum für einen Kontext.
     *
     * @param ctx CLI-Kontext
     * @return konfigurierte {@link CommandLine}
     */
    public static CommandLine commandLine(CliContext ctx) {
        return new CommandLine(HttpCacheCommand.class, new ContextFactory(ctx))
                .setOut(ctx.out())
                .setErr(ctx.err());
    }
}
