package com.elementcatalog.cli;

import com.elementcatalog.model.CatalogEntry;
import com.elementcatalog.model.ScopeFilter;
import com.elementcatalog.model.TypeFilter;
import com.elementcatalog.service.CatalogManager;
import com.elementcatalog.sync.CatalogCodec;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "list", mixinStandardHelpOptions = true,
         description = "List catalog entries, syncing stale catalogs first.")
class ListCommand implements Callable<Integer> {

    @Spec CommandSpec spec;

    @Option(names = {"-t", "--type"}, paramLabel = "TYPE", defaultValue = "all",
            description = "skill, command, agent or all (default: ${DEFAULT-VALUE}).")
    TypeFilter type;

    @Option(names = {"-s", "--scope"}, paramLabel = "SCOPE", defaultValue = "all",
            description = "global, project, local or all (default: ${DEFAULT-VALUE}).")
    ScopeFilter scope;

    @Option(names = "--no-sync", description = "Read the persisted manifests without scanning.")
    boolean noSync;

    @Option(names = "--json", description = "Print entries as JSON.")
    boolean json;

    private final CatalogManager manager;
    private final CatalogCodec   codec;

    ListCommand(CatalogManager manager, CatalogCodec codec) {
        this.manager = manager;
        this.codec   = codec;
    }

    @Override
    public Integer call() throws Exception {
        List<CatalogEntry> entries = manager.listElements(type, scope, !noSync);
        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            out.println(codec.writeEntries(entries));
        } else {
            EntryTable.print(out, entries);
        }
        out.flush();
        return 0;
    }
}
