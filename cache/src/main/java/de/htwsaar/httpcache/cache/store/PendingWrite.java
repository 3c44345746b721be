package de.htwsaar.httpcache.cache.store;

import java.sql.Connection;
import java.sql.SQLException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offene Schreib-Transaktion der {@link CacheMetadataStore}.
 *
 * <p>Wird das Handle ohne erfolgreichen {@link #commit()} geschlossen, wird die Transaktion
 * zurückgerollt. Vergessene Commits hinterlassen damit nie einen halben Eintrag.</p>
 *
 * <pre>{@code
 * try (PendingWrite write = store.beginWrite(url, record)) {
 *     write.commit();
 * }
 * }</pre>
 */
public final class PendingWrite implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PendingWrite.class);

    private final Connection connection;
    private final String url;
    private boolean finished;

    PendingWrite(Connection connection, String url) {
        this.connection = connection;
        this.url = url;
    }

    /**
     * Macht den Eintrag dauerhaft sichtbar.
     *
     * <p>Schlägt der Commit fehl, wird ein Rollback versucht und in jedem Fall der
     * ursprüngliche Fehler gemeldet.</p>
     *
     * @throws CacheStoreException   wenn der Commit fehlschlägt
     * @throws IllegalStateException wenn die Transaktion bereits beendet ist
     */
    public void commit() {
        if (finished) {
            throw new IllegalStateException("Write for " + url + " already finished");
        }
        finished = true;

        log.debug("Attempting to commit changes for {}", url);
        try {
            connection.commit();
        } catch (SQLException e) {
            log.debug("Failed to commit changes for {}: {}", url, e.getMessage());
            rollback();
            throw new CacheStoreException("Failed to commit cache record for " + url, e);
        } finally {
            restoreAutoCommit();
        }
        log.debug("Commit successful for {}", url);
    }

    /** {@code true}, sobald Commit oder Rollback erfolgt sind. */
    public boolean isFinished() {
        return finished;
    }

    /**
     * Rollt die Transaktion zurück, sofern sie nicht schon committet wurde.
     */
    @Override
    public void close() {
        if (finished) {
            return;
        }
        finished = true;

        log.debug("Attempting to roll back uncommitted changes for {}", url);
        rollback();
        restoreAutoCommit();
    }

    /** Rollback-Fehler werden nur protokolliert, damit sie die eigentliche Ursache nicht verdecken. */
    private void rollback() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.debug("Failed to roll back changes for {}: {}", url, e.getMessage());
        }
    }

    private void restoreAutoCommit() {
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            log.warn("Failed to restore auto-commit after write for {}: {}", url, e.getMessage());
        }
    }
}
