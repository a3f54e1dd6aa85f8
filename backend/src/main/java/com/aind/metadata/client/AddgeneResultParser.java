package com.aind.metadata.client;

import com.aind.metadata.model.RegistryEntry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scrapes plasmid entries out of an Addgene catalog search page. Handles both the
 * markdown-style rendering and plain HTML anchors.
 */
public class AddgeneResultParser {

    static final int MAX_RESULTS = 5;

    // [plasmid name](/12345/)
    private static final Pattern MARKDOWN_LINK = Pattern.compile("\\[([^\\]]+)\\]\\(/(\\d{4,6})/?\\)");
    private static final Pattern MARKDOWN_PURPOSE = Pattern.compile(
            "#(\\d{4,6})[\\s\\S]*?(?:Purpose|Description)\\s*\\n\\s*([^\\n]{5,200})",
            Pattern.CASE_INSENSITIVE);
    // <a href="/12345/">plasmid name</a>
    private static final Pattern HTML_LINK = Pattern.compile(
            "<a[^>]+href=\"(/(\\d{4,6})/?)\"[^>]*>\\s*([^<]+?)\\s*</a>");
    private static final Pattern HTML_PURPOSE = Pattern.compile(
            ">\\s*#(\\d{4,6})\\s*<.*?(?:Purpose|purpose).*?>\\s*([^<]{5,200})",
            Pattern.DOTALL);
    private static final Pattern TAG = Pattern.compile("<[^>]+>");

    private final String siteUrl;

    public AddgeneResultParser(String siteUrl) {
        this.siteUrl = siteUrl.endsWith("/") ? siteUrl.substring(0, siteUrl.length() - 1) : siteUrl;
    }

    public List<RegistryEntry> parse(String page) {
        Map<String, RegistryEntry> byCatalog = new LinkedHashMap<>();
        if (page == null || page.isEmpty()) {
            return new ArrayList<>();
        }

        Matcher markdown = MARKDOWN_LINK.matcher(page);
        while (markdown.find()) {
            byCatalog.putIfAbsent(markdown.group(2), entry(markdown.group(2), markdown.group(1).trim()));
        }

        if (byCatalog.isEmpty()) {
            Matcher html = HTML_LINK.matcher(page);
            while (html.find()) {
                String name = html.group(3).trim();
                if (!name.isEmpty() && !name.startsWith("#")) {
                    byCatalog.putIfAbsent(html.group(2), entry(html.group(2), name));
                }
            }
        }

        for (Pattern purpose : List.of(MARKDOWN_PURPOSE, HTML_PURPOSE)) {
            Matcher matcher = purpose.matcher(page);
            while (matcher.find()) {
                RegistryEntry entry = byCatalog.get(matcher.group(1));
                if (entry != null && entry.getDescription().isEmpty()) {
                    entry.setDescription(TAG.matcher(matcher.group(2).trim()).replaceAll("").trim());
                }
            }
        }

        List<RegistryEntry> entries = new ArrayList<>(byCatalog.values());
        return entries.size() > MAX_RESULTS ? new ArrayList<>(entries.subList(0, MAX_RESULTS)) : entries;
    }

    public String plasmidUrl(String catalogNumber) {
        return siteUrl + "/" + catalogNumber + "/";
    }

    private RegistryEntry entry(String catalogNumber, String name) {
        return RegistryEntry.builder()
                .catalogNumber(catalogNumber)
                .name(name)
                .description("")
                .url(plasmidUrl(catalogNumber))
                .build();
    }
}
