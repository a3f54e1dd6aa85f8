package com.aind.metadata.service;

import com.aind.metadata.model.JsonDocuments;
import com.aind.metadata.model.RecordType;
import com.aind.metadata.model.Registry;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the substrings of a record's data worth checking against external registries.
 * Queries are de-duplicated per registry and keep first-seen order.
 */
@Component
@Slf4j
public class RegistryQueryExtractor {

    private static final Pattern GENOTYPE_SEPARATOR = Pattern.compile("[;/×]\\s*");
    private static final Pattern PLASMID_NAME = Pattern.compile("(?:pAAV|AAV|pCAG|pEF|pCMV)[-\\w]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern CATALOG_NUMBER = Pattern.compile("\\b\\d{4,6}\\b");

    public Map<Registry, List<String>> extractQueries(RecordType recordType, JsonNode data) {
        Map<Registry, Set<String>> queries = new EnumMap<>(Registry.class);
        if (data == null || !data.isObject()) {
            return Map.of();
        }

        if (recordType == RecordType.SUBJECT) {
            extractSubjectQueries(data, queries);
        } else if (recordType == RecordType.PROCEDURES) {
            extractProcedureQueries(data, queries);
        }

        Map<Registry, List<String>> result = new EnumMap<>(Registry.class);
        queries.forEach((registry, terms) -> result.put(registry, new ArrayList<>(terms)));
        if (!result.isEmpty()) {
            log.debug("Registry queries for {}: {}", recordType.getValue(), result);
        }
        return result;
    }

    private void extractSubjectQueries(JsonNode data, Map<Registry, Set<String>> queries) {
        JsonNode genotype = data.get("genotype");
        if (genotype != null && genotype.isTextual() && genotype.asText().length() > 2) {
            for (String part : GENOTYPE_SEPARATOR.split(genotype.asText())) {
                String token = part.trim();
                if (token.length() > 2) {
                    add(queries, Registry.MGI, token);
                    add(queries, Registry.NCBI_GENE, token);
                }
            }
        }

        JsonNode alleles = data.get("alleles");
        if (alleles != null && alleles.isArray()) {
            for (JsonNode allele : alleles) {
                String name = null;
                if (allele.isObject()) {
                    JsonNode nameNode = allele.get("name");
                    name = nameNode == null || nameNode.isNull() ? null : nameNode.asText();
                } else if (!allele.isNull()) {
                    name = allele.asText();
                }
                if (name != null && name.length() > 2) {
                    add(queries, Registry.MGI, name);
                }
            }
        }
    }

    private void extractProcedureQueries(JsonNode data, Map<Registry, Set<String>> queries) {
        // plasmids can sit at any depth, so scan the serialized document
        String text = JsonDocuments.write(data);

        Matcher plasmids = PLASMID_NAME.matcher(text);
        while (plasmids.find()) {
            add(queries, Registry.ADDGENE, plasmids.group());
        }

        Matcher catalogNumbers = CATALOG_NUMBER.matcher(text);
        while (catalogNumbers.find()) {
            if (Integer.parseInt(catalogNumbers.group()) > 1000) {
                add(queries, Registry.ADDGENE, catalogNumbers.group());
            }
        }
    }

    private static void add(Map<Registry, Set<String>> queries, Registry registry, String term) {
        queries.computeIfAbsent(registry, r -> new LinkedHashSet<>()).add(term);
    }
}
