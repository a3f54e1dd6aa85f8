package com.aind.metadata.service;

import com.aind.metadata.model.RegistryEntry;
import com.aind.metadata.model.RegistryLookupResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders lookup results as text for the conversation. Every result gets at least one line.
 */
@Component
public class RegistrySummaryFormatter {

    static final int MAX_ENTRIES_PER_RESULT = 4;

    public String format(List<RegistryLookupResult> results) {
        if (results == null || results.isEmpty()) {
            return "";
        }

        List<String> lines = new ArrayList<>();
        lines.add("REGISTRY LOOKUPS:");
        for (RegistryLookupResult result : results) {
            String prefix = "  - " + (result.getRegistry() == null ? "UNKNOWN" : result.getRegistry().displayName())
                    + " '" + nullToEmpty(result.getQuery()) + "': ";

            if (result.isFailed()) {
                lines.add(prefix + "lookup failed (" + result.getError() + ")");
            } else if (result.isFound()) {
                lines.addAll(foundLines(prefix, result));
            } else {
                lines.add(prefix + "NOT FOUND - could not verify in external registry");
            }
        }
        lines.add("");
        lines.add("Share these registry results with the user to confirm the identifiers are correct.");
        return String.join("\n", lines);
    }

    private List<String> foundLines(String prefix, RegistryLookupResult result) {
        List<String> lines = new ArrayList<>();
        List<RegistryEntry> entries = result.getResults() == null ? List.of() : result.getResults();
        for (RegistryEntry entry : entries.subList(0, Math.min(MAX_ENTRIES_PER_RESULT, entries.size()))) {
            if (entry.isGeneShaped()) {
                lines.add(prefix + "FOUND - " + entry.getSymbol() + " (" + nullToEmpty(entry.getDescription()) + ") "
                        + nullToEmpty(entry.getUrl()));
            } else if (entry.isCatalogShaped()) {
                String description = entry.getDescription() == null || entry.getDescription().isEmpty()
                        ? "" : " - " + entry.getDescription();
                lines.add(prefix + "FOUND - #" + entry.getCatalogNumber()
                        + (entry.getName() == null ? "" : " " + entry.getName())
                        + description + " " + nullToEmpty(entry.getUrl()));
            } else if (entry.getGeneId() != null || entry.getUrl() != null) {
                String label = entry.getGeneId() == null ? "" : "ID " + entry.getGeneId() + " ";
                lines.add((prefix + "FOUND - " + label + nullToEmpty(entry.getUrl())).stripTrailing());
            }
        }
        if (lines.isEmpty()) {
            lines.add(result.getUrl() != null ? prefix + "FOUND - " + result.getUrl() : prefix + "FOUND");
        }
        return lines;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
