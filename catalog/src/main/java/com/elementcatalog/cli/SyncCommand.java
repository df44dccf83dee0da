package com.elementcatalog.cli;

import com.elementcatalog.model.ElementType;
import com.elementcatalog.service.CatalogManager;
import com.elementcatalog.service.SyncResult;
import com.elementcatalog.service.TypeSyncReport;
import com.elementcatalog.sync.CatalogCodec;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

@Command(name = "sync", mixinStandardHelpOptions = true,
         description = "Rescan the scope roots and update the manifests.")
class SyncCommand implements Callable<Integer> {

    @Spec CommandSpec spec;

    @Option(names = {"-t", "--type"}, paramLabel = "TYPE",
            description = "skill, command or agent; repeat for several (default: all).")
    List<String> types = new ArrayList<>();

    @Option(names = "--force", description = "Rescan even when the cached catalog is fresh.")
    boolean force;

    @Option(names = "--json", description = "Print the per-type reports as JSON.")
    boolean json;

    private final CatalogManager manager;
    private final CatalogCodec   codec;

    SyncCommand(CatalogManager manager, CatalogCodec codec) {
        this.manager = manager;
        this.codec   = codec;
    }

    @Override
    public Integer call() throws Exception {
        Set<ElementType> selected = EnumSet.noneOf(ElementType.class);
        for (String t : types) {
            selected.add(ElementType.fromKey(t));
        }
        SyncResult result = manager.syncCatalogs(selected, force);

        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            Map<String, Object> byType = new LinkedHashMap<>();
            result.reports().forEach((type, report) -> byType.put(type.plural(), report));
            Map<String, Object> doc = new LinkedHashMap<>();
            doc.put("reports", byType);
            doc.put("failed", result.failed().stream().map(ElementType::plural).toList());
            doc.put("warnings", result.warnings());
            out.println(codec.writeValue(doc));
        } else {
            out.printf("%-10s %10s %6s %8s %9s %6s%n", "TYPE", "DISCOVERED", "ADDED", "UPDATED", "RETAINED", "TOTAL");
            for (TypeSyncReport r : result.reports().values()) {
                out.printf("%-10s %10s %6d %8d %9d %6d%n", r.type().plural(),
                        r.cached() ? "(cached)" : String.valueOf(r.discovered()),
                        r.added(), r.updated(), r.retained(), r.total());
            }
            for (ElementType failed : result.failed()) {
                out.printf("%-10s %10s%n", failed.plural(), "FAILED");
            }
            PrintWriter err = spec.commandLine().getErr();
            result.warnings().forEach(w -> err.println("warning: " + w));
            err.flush();
        }
        out.flush();
        return result.succeeded() ? 0 : CatalogCli.EXIT_FAILURE;
    }
}
