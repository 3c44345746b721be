package de.htwsaar.httpcache.cache.config;

import de.htwsaar.httpcache.cache.HttpCache;
import de.htwsaar.httpcache.cache.adapter.http.JdkHttpTransport;
import de.htwsaar.httpcache.cache.domain.HttpTransport;
import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring-Verdrahtung für Anwendungen, die den Cache einbetten.
 *
 * <p>Schichtung: Cache-Fassade → Engine → Ports → Adapter</p>
 */
@Configuration
public class HttpCacheBeans {

    /**
     * Liest die Cache-Konfiguration aus den Properties.
     *
     * @param root             Cache-Verzeichnis (Pflicht)
     * @param connectTimeoutMs Verbindungs-Timeout in ms (Standard: 5000)
     * @param requestTimeoutMs Timeout pro Anfrage in ms (Standard: 30000)
     * @param followRedirects  Redirects folgen (Standard: true)
     * @return {@link HttpCacheProperties}
     */
    @Bean
    public HttpCacheProperties httpCacheProperties(
            @Value("${http-cache.root}") String root,
            @Value("${http-cache.connect-timeout-ms:5000}") long connectTimeoutMs,
            @Value("${http-cache.request-timeout-ms:30000}") long requestTimeoutMs,
            @Value("${http-cache.follow-redirects:true}") boolean followRedirects) {

        return new HttpCacheProperties(
                Path.of(root.trim()),
                Duration.ofMillis(connectTimeoutMs),
                Duration.ofMillis(requestTimeoutMs),
                followRedirects);
    }

    /**
     * HTTP-Client für Origin-Zugriffe.
     *
     * @param properties Cache-Konfiguration
     * @return konfigurierter {@link HttpClient}
     */
    @Bean
    public HttpClient httpCacheClient(HttpCacheProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.connectTimeout())
                .followRedirects(properties.followRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .build();
    }

    /**
     * Adapter-Implementierung des {@link HttpTransport}-Ports.
     *
     * @param httpCacheClient HTTP-Client
     * @param properties      Cache-Konfiguration
     * @return {@link JdkHttpTransport}
     */
    @Bean
    public HttpTransport httpTransport(HttpClient httpCacheClient, HttpCacheProperties properties) {
        return new JdkHttpTransport(httpCacheClient, properties.requestTimeout());
    }

    /**
     * Der Cache selbst; wird beim Schließen des Kontexts geschlossen.
     *
     * @param properties Cache-Konfiguration
     * @param transport  Port zum Origin
     * @return geöffneter {@link HttpCache}
     * @throws IOException wenn das Cache-Verzeichnis nicht angelegt werden kann
     */
    @Bean
    public HttpCache httpCache(HttpCacheProperties properties, HttpTransport transport) throws IOException {
        return HttpCache.open(properties.root(), transport);
    }
}
