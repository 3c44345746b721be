package de.htwsaar.httpcache.cache.domain;

import java.net.http.HttpRequest;

/**
 * Port zur Abstraktion der HTTP-Transport-Schicht.
 * Verbindungen, TLS, DNS und Redirects sind Sache der Implementierung;
 * die Revalidierungslogik hängt ausschließlich an diesem Interface.
 */
public interface HttpTransport {

    /**
     * Sendet eine Anfrage.
     *
     * <p>HTTP-Fehlerstatus (4xx/5xx) sind <b>kein</b> Transportfehler, sondern eine normale
     * Antwort; siehe {@link TransportResponse#errorForStatus()}.</p>
     *
     * @param request vollständige Anfrage inkl. Header
     * @return Antwort, deren Body der Aufrufer schließen muss
     * @throws TransportException wenn keine Antwort zustande kam
     */
    TransportResponse execute(HttpRequest request);
}
