package de.htwsaar.httpcache.cli.di;

import java.lang.reflect.Constructor;
import java.util.Objects;
import picocli.CommandLine;

/**
 * Picocli-Factory für Constructor Injection von {@link CliContext}.
 *
 * <p>Commands mit einem öffentlichen Konstruktor {@code (CliContext)} erhalten den aktuellen
 * Kontext. Alle anderen Klassen ({@code HelpCommand}, Converter) erzeugt die
 * Picocli-Default-Factory.
 */
public final class ContextFactory implements CommandLine.IFactory {
    private final CliContext ctx;
    private final CommandLine.IFactory fallback;

    /**
     * Erstellt eine Factory mit Picocli-Default-Factory als Fallback.
     *
     * @param ctx aktueller Kontext
     */
    public ContextFactory(CliContext ctx) {
        this(ctx, CommandLine.defaultFactory());
    }

    ContextFactory(CliContext ctx, CommandLine.IFactory fallback) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    @Override
    public <K> K create(Class<K> cls) throws Exception {
        Constructor<K> constructor;
        try {
            constructor = cls.getConstructor(CliContext.class);
        } catch (NoSuchMethodException e) {
            return fallback.create(cls);
        }
        return constructor.newInstance(ctx);
    }
}
