package de.htwsaar.httpcache.cache.domain;

import java.io.Closeable;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpHeaders;

/**
 * Transport-agnostische Antwort des Origin-Servers mit streamendem Body.
 */
public interface TransportResponse extends Closeable {

    /** URL, auf die sich die Antwort bezieht. */
    URI uri();

    /** HTTP-Statuscode (z. B. 200, 304, 404). */
    int status();

    /** Antwort-Header, Namen ohne Beachtung der Groß-/Kleinschreibung. */
    HttpHeaders headers();

    /** Lesbarer Body; wird mit {@link #close()} freigegeben. */
    InputStream body();

    /** Gibt den Body frei. Fehler beim Schließen werden nicht weitergereicht. */
    @Override
    void close();

    /**
     * Prüft den Status.
     *
     * @return diese Antwort, wenn der Status kein Fehler ist
     * @throws HttpStatusException bei Status 400–599; der Body ist dann bereits geschlossen
     */
    default TransportResponse errorForStatus() {
        int status = status();
        if (status >= 400 && status <= 599) {
            close();
            throw new HttpStatusException(uri(), status);
        }
        return this;
    }
}
