package de.htwsaar.httpcache.cache.content;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.SecureRandom;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ablage der Response-Bodies unterhalb von {@code <root>/content}.
 *
 * <p>Jede Datei wird genau einmal geschrieben und danach nie verändert. Dateien ersetzter
 * Einträge bleiben als verwaiste Dateien liegen.</p>
 */
public final class ContentStore {

    private static final Logger log = LoggerFactory.getLogger(ContentStore.class);

    /** Name des Unterverzeichnisses für Body-Dateien. */
    public static final String CONTENT_DIR = "content";

    static final int NAME_LENGTH = 20;
    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    private static final SecureRandom RANDOM = new SecureRandom();

    private final Path root;
    private final Path contentDir;
    private final Supplier<String> nameGenerator;

    /**
     * Erstellt den Store für die gegebene Cache-Root.
     *
     * @param root Cache-Root (muss nicht existieren)
     */
    public ContentStore(Path root) {
        this(root, ContentStore::randomName);
    }

    /**
     * Interner Konstruktor (v. a. für Tests).
     *
     * @param root          Cache-Root
     * @param nameGenerator liefert Kandidaten für neue Dateinamen
     */
    ContentStore(Path root, Supplier<String> nameGenerator) {
        this.root = Objects.requireNonNull(root, "root must not be null").toAbsolutePath().normalize();
        this.contentDir = this.root.resolve(CONTENT_DIR);
        this.nameGenerator = Objects.requireNonNull(nameGenerator, "nameGenerator must not be null");
    }

    /**
     * Legt eine neue, noch nicht existierende Datei exklusiv an.
     *
     * <p>Existiert der gewürfelte Name bereits, wird mit einem neuen Namen erneut versucht;
     * jeder andere I/O-Fehler wird sofort weitergereicht.</p>
     *
     * @return geöffnete Datei, muss geschlossen werden
     * @throws IOException wenn Verzeichnis oder Datei nicht angelegt werden können
     */
    public NewContentFile createNewFile() throws IOException {
        Files.createDirectories(contentDir);

        while (true) {
            Path candidate = contentDir.resolve(nameGenerator.get());
            try {
                OutputStream out = Files.newOutputStream(
                        candidate, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                return new NewContentFile(candidate, out);
            } catch (FileAlreadyExistsException e) {
                log.debug("Content file {} already exists, trying another name", candidate);
            }
        }
    }

    /**
     * Wandelt einen Pfad unterhalb der Root in die relative Form der Metadaten um.
     *
     * @param file Datei unterhalb der Root
     * @return relativer Pfad mit {@code /} als Trenner, z. B. {@code content/AbC...}
     * @throws PathException wenn die Datei nicht unterhalb der Root liegt
     */
    public String relativize(Path file) {
        Path normalized = file.toAbsolutePath().normalize();
        if (!normalized.startsWith(root) || normalized.equals(root)) {
            throw new PathException(file + " is not inside cache root " + root);
        }

        StringJoiner joiner = new StringJoiner("/");
        for (Path part : root.relativize(normalized)) {
            joiner.add(part.toString());
        }
        return joiner.toString();
    }

    /**
     * Löst einen gespeicherten relativen Pfad gegen die Root auf.
     *
     * @param relativePath relativer Pfad aus den Metadaten
     * @return absoluter Pfad (die Datei muss nicht existieren)
     */
    public Path resolve(String relativePath) {
        return root.resolve(relativePath);
    }

    public Path root() {
        return root;
    }

    static String randomName() {
        StringBuilder sb = new StringBuilder(NAME_LENGTH);
        for (int i = 0; i < NAME_LENGTH; i++) {
            sb.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
