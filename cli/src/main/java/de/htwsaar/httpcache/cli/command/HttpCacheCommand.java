package de.htwsaar.httpcache.cli.command;

import ch.qos.logback.classic.Level;
import de.htwsaar.httpcache.cli.di.CliContext;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Root-Command des CLI-Kommandobaums.
 *
 * <p>Registriert {@code get} und {@code show}; ohne Subcommand wird die Usage angezeigt.
 */
@Command(
        name = "httpcache",
        description = "Local HTTP cache driver",
        mixinStandardHelpOptions = true,
        subcommands = {GetCommand.class, ShowCommand.class, HelpCommand.class})
public final class HttpCacheCommand implements Runnable {

    private final CliContext ctx;

    @Spec
    private CommandSpec spec;

    /**
     * Konstruktor für Constructor Injection via {@code ContextFactory}.
     *
     * @param ctx CLI-Kontext
     */
    public HttpCacheCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    /**
     * Schaltet das Root-Log-Level auf DEBUG; wird von Picocli beim Parsen aufgerufen.
     */
    @Option(names = {"-v", "--verbose"}, description = "Log debug output to stderr")
    void setVerbose(boolean verbose) {
        if (verbose && LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME) instanceof ch.qos.logback.classic.Logger root) {
            root.setLevel(Level.DEBUG);
        }
    }

    @Override
    public void run() {
        spec.commandLine().usage(ctx.out());
        ctx.out().println();
        ctx.out().println("Tipp: Verwende `httpcache help <command>`.");
        ctx.out().flush();
    }
}
