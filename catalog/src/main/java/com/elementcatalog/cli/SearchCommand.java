package com.elementcatalog.cli;

import com.elementcatalog.model.ScopeFilter;
import com.elementcatalog.model.TypeFilter;
import com.elementcatalog.search.ScoredEntry;
import com.elementcatalog.search.SearchQuery;
import com.elementcatalog.service.CatalogManager;
import com.elementcatalog.sync.CatalogCodec;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "search", mixinStandardHelpOptions = true,
         description = "Rank entries by name, description and tag matches.")
class SearchCommand implements Callable<Integer> {

    @Spec CommandSpec spec;

    @Parameters(arity = "0..*", paramLabel = "TEXT",
                description = "Query words; omit to list everything that passes the filters.")
    List<String> words = new ArrayList<>();

    @Option(names = {"-t", "--type"}, paramLabel = "TYPE", defaultValue = "all",
            description = "skill, command, agent or all (default: ${DEFAULT-VALUE}).")
    TypeFilter type;

    @Option(names = {"-s", "--scope"}, paramLabel = "SCOPE", defaultValue = "all",
            description = "global, project, local or all (default: ${DEFAULT-VALUE}).")
    ScopeFilter scope;

    @Option(names = "--tag", paramLabel = "TAG",
            description = "Only entries carrying this tag; repeat to require several.")
    List<String> tags = new ArrayList<>();

    @Option(names = {"-n", "--limit"}, defaultValue = "20",
            description = "Maximum number of results (default: ${DEFAULT-VALUE}).")
    int limit;

    @Option(names = "--json", description = "Print results as JSON.")
    boolean json;

    private final CatalogManager manager;
    private final CatalogCodec   codec;

    SearchCommand(CatalogManager manager, CatalogCodec codec) {
        this.manager = manager;
        this.codec   = codec;
    }

    @Override
    public Integer call() throws Exception {
        SearchQuery query = new SearchQuery(String.join(" ", words), type, scope, tags, limit);
        List<ScoredEntry> hits = manager.searchElements(query);
        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            List<Map<String, Object>> rows = new ArrayList<>(hits.size());
            for (ScoredEntry hit : hits) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("score", hit.score());
                row.put("entry", hit.entry());
                rows.add(row);
            }
            out.println(codec.writeValue(rows));
        } else {
            EntryTable.printScored(out, hits);
        }
        out.flush();
        return 0;
    }
}
