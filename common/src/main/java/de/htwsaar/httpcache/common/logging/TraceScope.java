package de.htwsaar.httpcache.common.logging;

import java.util.UUID;
import org.slf4j.MDC;

/**
 * Verwaltet eine Trace-ID im Logging-Kontext für die Dauer einer Cache-Operation.
 *
 * <p>Ist bereits eine Trace-ID im MDC gesetzt (z. B. durch die einbettende Anwendung),
 * wird sie unverändert weiterverwendet und beim Schließen <b>nicht</b> entfernt.
 * Andernfalls wird eine neue UUID erzeugt und beim Schließen wieder aufgeräumt.</p>
 *
 * <pre>{@code
 * try (TraceScope scope = TraceScope.open()) {
 *     log.debug("läuft unter {}", scope.traceId());
 * }
 * }</pre>
 */
public final class TraceScope implements AutoCloseable {

    /** Schlüsselname der Trace-ID im Logging-Kontext */
    public static final String TRACE_ID_KEY = "traceId";

    private final String traceId;
    private final boolean owner;

    private TraceScope(String traceId, boolean owner) {
        this.traceId = traceId;
        this.owner = owner;
    }

    /**
     * Öffnet einen Scope und legt bei Bedarf eine neue Trace-ID im MDC ab.
     *
     * @return offener Scope, muss geschlossen werden
     */
    public static TraceScope open() {
        String existing = MDC.get(TRACE_ID_KEY);
        if (existing != null && !existing.isBlank()) {
            return new TraceScope(existing, false);
        }

        String traceId = UUID.randomUUID().toString();
        MDC.put(TRACE_ID_KEY, traceId);
        return new TraceScope(traceId, true);
    }

    public String traceId() {
        return traceId;
    }

    @Override
    public void close() {
        // Nur die selbst erzeugte ID entfernen
        if (owner) {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
