package com.elementcatalog.cli;

import com.elementcatalog.CatalogException;
import com.elementcatalog.model.ScopeFilter;
import com.elementcatalog.model.TypeFilter;
import com.elementcatalog.service.CatalogManager;
import com.elementcatalog.sync.CatalogCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Runs the {@code catalog} command tree once at startup.
 *
 * Only argument parsing and printing happen here. Results go to stdout,
 * errors and sync warnings to stderr.
 */
@Component
public class CatalogCli implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CatalogCli.class);

    /** Exit code when a lookup finds nothing or a sync leaves a type failed. */
    static final int EXIT_FAILURE = 1;

    private final CatalogManager manager;
    private final CatalogCodec   codec;

    private int exitCode;

    public CatalogCli(CatalogManager manager, CatalogCodec codec) {
        this.manager = manager;
        this.codec   = codec;
    }

    @Command(name = "catalog",
             mixinStandardHelpOptions = true,
             version = "element-catalog 0.1.0",
             description = "List, search and sync skills, commands and agents.")
    static class Root {
    }

    CommandLine commandLine() {
        CommandLine cli = new CommandLine(new Root())
                .addSubcommand(new ListCommand(manager, codec))
                .addSubcommand(new SearchCommand(manager, codec))
                .addSubcommand(new ShowCommand(manager, codec))
                .addSubcommand(new SyncCommand(manager, codec))
                .addSubcommand(new StatsCommand(manager, codec));
        cli.registerConverter(TypeFilter.class, TypeFilter::parse);
        cli.registerConverter(ScopeFilter.class, ScopeFilter::parse);
        cli.setExecutionExceptionHandler((e, commandLine, parseResult) -> {
            if (e instanceof CatalogException) {
                commandLine.getErr().println(e.getMessage());
                log.debug("Command failed", e);
                return EXIT_FAILURE;
            }
            throw e;
        });
        return cli;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine().execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
