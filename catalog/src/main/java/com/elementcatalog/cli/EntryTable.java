package com.elementcatalog.cli;

import com.elementcatalog.model.AgentEntry;
import com.elementcatalog.model.CatalogEntry;
import com.elementcatalog.model.CommandEntry;
import com.elementcatalog.model.SkillEntry;
import com.elementcatalog.search.ScoredEntry;

import java.io.PrintWriter;
import java.util.List;

/** Plain-text rendering of entries for the terminal. */
final class EntryTable {

    static final int DESCRIPTION_WIDTH = 60;

    private EntryTable() {}

    static void print(PrintWriter out, List<? extends CatalogEntry> entries) {
        if (entries.isEmpty()) {
            out.println("(no entries)");
            return;
        }
        out.printf("%-8s %-8s %-30s %s%n", "TYPE", "SCOPE", "NAME", "DESCRIPTION");
        for (CatalogEntry e : entries) {
            out.printf("%-8s %-8s %-30s %s%n",
                    e.elementType().key(), e.scope().key(), e.name(), abbreviate(e.description()));
        }
    }

    static void printScored(PrintWriter out, List<ScoredEntry> hits) {
        if (hits.isEmpty()) {
            out.println("(no matches)");
            return;
        }
        out.printf("%5s %-8s %-8s %-30s %s%n", "SCORE", "TYPE", "SCOPE", "NAME", "DESCRIPTION");
        for (ScoredEntry hit : hits) {
            CatalogEntry e = hit.entry();
            out.printf("%5d %-8s %-8s %-30s %s%n", hit.score(),
                    e.elementType().key(), e.scope().key(), e.name(), abbreviate(e.description()));
        }
    }

    static void printDetail(PrintWriter out, CatalogEntry e) {
        out.println("name:        " + e.name());
        out.println("type:        " + e.elementType().key());
        out.println("scope:       " + e.scope().key());
        out.println("path:        " + e.path());
        out.println("description: " + e.description());
        switch (e.elementType()) {
            case SKILL -> {
                SkillEntry s = (SkillEntry) e;
                out.println("template:    " + s.template().key());
                out.println("scripts:     " + (s.hasScripts() ? "yes" : "no"));
                out.println("files:       " + s.fileCount());
                printList(out, "tools:       ", s.allowedTools());
            }
            case COMMAND -> {
                CommandEntry c = (CommandEntry) e;
                printList(out, "aliases:     ", c.aliases());
                printList(out, "tools:       ", c.requiresTools());
                printList(out, "tags:        ", c.tags());
            }
            case AGENT -> {
                AgentEntry a = (AgentEntry) e;
                out.println("model:       " + a.model().key());
                out.println("focus:       " + a.specialization());
                printList(out, "skills:      ", a.requiresSkills());
                printList(out, "tags:        ", a.tags());
            }
        }
        out.println("id:          " + e.id());
        out.println("created:     " + e.createdAt());
        out.println("updated:     " + e.updatedAt());
    }

    private static void printList(PrintWriter out, String label, List<String> values) {
        if (!values.isEmpty()) {
            out.println(label + String.join(", ", values));
        }
    }

    static String abbreviate(String text) {
        if (text == null) return "";
        String oneLine = text.replaceAll("\\s+", " ").trim();
        return oneLine.length() <= DESCRIPTION_WIDTH
                ? oneLine
                : oneLine.substring(0, DESCRIPTION_WIDTH - 3) + "...";
    }
}
