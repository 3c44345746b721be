package de.htwsaar.httpcache.cli.di;

import java.io.OutputStream;
import java.io.PrintWriter;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;

/**
 * Gemeinsamer Laufzeit-Kontext für CLI-Commands.
 *
 * <p>Aufgaben:
 * - Bündelt die Ausgabekanäle (Text auf stdout/stderr, Rohbytes auf stdout).
 * - Stellt Shared-Infrastruktur bereit (HTTP-Client, Default-Timeout).
 *
 * <p>Konvention:
 * - Hier gehören nur generische Abhängigkeiten hinein (I/O, HTTP, Timeouts),
 *   keine Cache-Instanzen; jeder Command öffnet seinen Cache selbst.
 */
public final class CliContext {
    private final PrintWriter out;
    private final PrintWriter err;
    private final OutputStream rawOut;
    private final HttpClient httpClient;
    private final Duration defaultRequestTimeout;

    /**
     * Erzeugt einen neuen CLI-Kontext.
     *
     * @param out Writer für normale Ausgaben
     * @param err Writer für Fehlermeldungen
     * @param rawOut Stream für binäre Ausgaben (Body auf stdout)
     * @param httpClient gemeinsamer HTTP-Client für Origin-Zugriffe
     * @param defaultRequestTimeout Standard-Timeout für HTTP-Requests
     */
    public CliContext(
            PrintWriter out,
            PrintWriter err,
            OutputStream rawOut,
            HttpClient httpClient,
            Duration defaultRequestTimeout) {
        this.out = Objects.requireNonNull(out);
        this.err = Objects.requireNonNull(err);
        this.rawOut = Objects.requireNonNull(rawOut);
        this.httpClient = Objects.requireNonNull(httpClient);
        this.defaultRequestTimeout = Objects.requireNonNull(defaultRequestTimeout);
    }

    public PrintWriter out() {
        return out;
    }

    public PrintWriter err() {
        return err;
    }

    public OutputStream rawOut() {
        return rawOut;
    }

    public HttpClient httpClient() {
        return httpClient;
    }

    public Duration defaultRequestTimeout() {
        return defaultRequestTimeout;
    }
}
