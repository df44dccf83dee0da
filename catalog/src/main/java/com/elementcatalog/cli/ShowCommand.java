package com.elementcatalog.cli;

import com.elementcatalog.model.CatalogEntry;
import com.elementcatalog.model.ScopeFilter;
import com.elementcatalog.model.TypeFilter;
import com.elementcatalog.service.CatalogManager;
import com.elementcatalog.sync.CatalogCodec;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "show", mixinStandardHelpOptions = true,
         description = "Show one entry by name.")
class ShowCommand implements Callable<Integer> {

    @Spec CommandSpec spec;

    @Parameters(index = "0", paramLabel = "NAME", description = "Element name; a command's leading '/' is optional.")
    String name;

    @Option(names = {"-t", "--type"}, paramLabel = "TYPE", defaultValue = "all",
            description = "skill, command, agent or all (default: ${DEFAULT-VALUE}).")
    TypeFilter type;

    @Option(names = {"-s", "--scope"}, paramLabel = "SCOPE", defaultValue = "all",
            description = "global, project, local or all (default: ${DEFAULT-VALUE}).")
    ScopeFilter scope;

    @Option(names = {"-f", "--fuzzy"}, description = "Fall back to the best search hit.")
    boolean fuzzy;

    @Option(names = "--json", description = "Print the entry as JSON.")
    boolean json;

    private final CatalogManager manager;
    private final CatalogCodec   codec;

    ShowCommand(CatalogManager manager, CatalogCodec codec) {
        this.manager = manager;
        this.codec   = codec;
    }

    @Override
    public Integer call() throws Exception {
        Optional<CatalogEntry> found = manager.getElement(name, type, scope, fuzzy);
        if (found.isEmpty()) {
            spec.commandLine().getErr().println("No element named '" + name + "'");
            return CatalogCli.EXIT_FAILURE;
        }
        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            out.println(codec.writeValue(found.get()));
        } else {
            EntryTable.printDetail(out, found.get());
        }
        out.flush();
        return 0;
    }
}
