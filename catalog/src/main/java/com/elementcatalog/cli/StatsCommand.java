package com.elementcatalog.cli;

import com.elementcatalog.model.ElementType;
import com.elementcatalog.model.Scope;
import com.elementcatalog.service.CatalogManager;
import com.elementcatalog.service.CatalogStats;
import com.elementcatalog.sync.CatalogCodec;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "stats", mixinStandardHelpOptions = true,
         description = "Count persisted entries by type and scope.")
class StatsCommand implements Callable<Integer> {

    @Spec CommandSpec spec;

    @Option(names = "--json", description = "Print the counts as JSON.")
    boolean json;

    private final CatalogManager manager;
    private final CatalogCodec   codec;

    StatsCommand(CatalogManager manager, CatalogCodec codec) {
        this.manager = manager;
        this.codec   = codec;
    }

    @Override
    public Integer call() throws Exception {
        CatalogStats stats = manager.stats();
        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            Map<String, Integer> byType = new LinkedHashMap<>();
            stats.byType().forEach((type, n) -> byType.put(type.plural(), n));
            Map<String, Integer> byScope = new LinkedHashMap<>();
            stats.byScope().forEach((scope, n) -> byScope.put(scope.key(), n));
            Map<String, Object> doc = new LinkedHashMap<>();
            doc.put("total", stats.total());
            doc.put("by_type", byType);
            doc.put("by_scope", byScope);
            out.println(codec.writeValue(doc));
        } else {
            out.println("total: " + stats.total());
            for (ElementType type : ElementType.values()) {
                out.printf("  %-9s %d%n", type.plural(), stats.byType().getOrDefault(type, 0));
            }
            for (Scope scope : Scope.values()) {
                out.printf("  %-9s %d%n", scope.key(), stats.byScope().getOrDefault(scope, 0));
            }
        }
        out.flush();
        return 0;
    }
}
