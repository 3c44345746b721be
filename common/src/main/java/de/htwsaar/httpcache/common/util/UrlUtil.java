package de.htwsaar.httpcache.common.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;
import java.util.Optional;

/**
 * Kleine Hilfsfunktionen für URLs, die als Cache-Schlüssel dienen.
 * <p>
 * Fragmente ({@code #...}) werden nie an den Server gesendet und sind deshalb
 * für die Identität einer Ressource irrelevant.
 * </p>
 */
public final class UrlUtil {

    private UrlUtil() {
        // Utility-Klasse, keine Instanzen.
    }

    /**
     * Entfernt das Fragment einer URL. Die übrigen Bestandteile bleiben Zeichen für Zeichen erhalten.
     *
     * @param url URL, z. B. {@code http://example.com/a?b=1#top}
     * @return URL ohne Fragment, z. B. {@code http://example.com/a?b=1}
     */
    public static URI stripFragment(URI url) {
        Objects.requireNonNull(url, "url must not be null");
        if (url.getRawFragment() == null) {
            return url;
        }
        String s = url.toString();
        return URI.create(s.substring(0, s.indexOf('#')));
    }

    /**
     * Parst eine absolute http(s)-URL.
     *
     * @param raw Eingabe, darf {@code null} sein
     * @return geparste URL oder leer, wenn die Eingabe keine http(s)-URL mit Host ist
     */
    public static Optional<URI> parseHttpUrl(String raw) {
        if (raw == null) return Optional.empty();
        String trimmed = raw.trim();
        try {
            URI u = new URI(trimmed);
            String scheme = u.getScheme();
            if (scheme == null) return Optional.empty();
            if (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https")) return Optional.empty();
            if (u.getHost() == null) return Optional.empty();
            return Optional.of(u);
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }
}
