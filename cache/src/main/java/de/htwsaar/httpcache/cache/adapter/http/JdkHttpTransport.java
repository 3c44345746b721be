package de.htwsaar.httpcache.cache.adapter.http;

import de.htwsaar.httpcache.cache.domain.HttpTransport;
import de.htwsaar.httpcache.cache.domain.TransportException;
import de.htwsaar.httpcache.cache.domain.TransportResponse;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP-Adapter auf Basis von {@link HttpClient}.
 *
 * <p>Enthält alle Details des JDK-Clients (Body-Handler, Timeouts, Interrupts).
 * Die Revalidierungslogik hängt ausschließlich am {@link HttpTransport}-Port.</p>
 */
public final class JdkHttpTransport implements HttpTransport {

    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    /**
     * Erstellt den HTTP-Adapter.
     *
     * @param httpClient     HTTP-Client (darf nicht {@code null} sein)
     * @param requestTimeout Timeout für Anfragen ohne eigenes Timeout (darf nicht {@code null} sein)
     */
    public JdkHttpTransport(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
    }

    @Override
    public TransportResponse execute(HttpRequest request) {
        HttpRequest effective = request.timeout().isPresent()
                ? request
                : HttpRequest.newBuilder(request, (name, value) -> true).timeout(requestTimeout).build();

        log.debug("{} {} with headers {}", effective.method(), effective.uri(), effective.headers().map());
        try {
            HttpResponse<InputStream> response = httpClient.send(effective, HttpResponse.BodyHandlers.ofInputStream());
            return new JdkTransportResponse(response);
        } catch (IOException e) {
            throw new TransportException("Request to " + effective.uri() + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Request to " + effective.uri() + " interrupted", e);
        }
    }

    private static final class JdkTransportResponse implements TransportResponse {

        private final HttpResponse<InputStream> response;

        private JdkTransportResponse(HttpResponse<InputStream> response) {
            this.response = response;
        }

        @Override
        public URI uri() {
            return response.uri();
        }

        @Override
        public int status() {
            return response.statusCode();
        }

        @Override
        public HttpHeaders headers() {
            return response.headers();
        }

        @Override
        public InputStream body() {
            return response.body();
        }

        @Override
        public void close() {
            try {
                response.body().close();
            } catch (IOException e) {
                log.debug("Ignoring failure while closing response body of {}: {}", response.uri(), e.getMessage());
            }
        }
    }
}
