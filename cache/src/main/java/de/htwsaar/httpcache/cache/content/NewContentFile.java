package de.htwsaar.httpcache.cache.content;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Frisch angelegte, exklusiv geöffnete Body-Datei.
 *
 * @param path absoluter Pfad der Datei
 * @param out  Schreibkanal in die Datei
 */
public record NewContentFile(Path path, OutputStream out) implements Closeable {

    public NewContentFile {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public void close() throws IOException {
        out.close();
    }
}
