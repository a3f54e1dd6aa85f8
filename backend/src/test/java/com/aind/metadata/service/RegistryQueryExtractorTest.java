package com.aind.metadata.service;

import com.aind.metadata.model.JsonDocuments;
import com.aind.metadata.model.RecordType;
import com.aind.metadata.model.Registry;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RegistryQueryExtractorTest {

    private final RegistryQueryExtractor extractor = new RegistryQueryExtractor();

    private static JsonNode json(String text) throws Exception {
        return JsonDocuments.MAPPER.readTree(text);
    }

    @Test
    void splitsCompositeGenotypeForBothGeneRegistries() throws Exception {
        Map<Registry, List<String>> queries = extractor.extractQueries(RecordType.SUBJECT,
                json("{\"genotype\": \"Ai14;Slc17a7-Cre\"}"));

        assertThat(queries).containsOnlyKeys(Registry.MGI, Registry.NCBI_GENE);
        assertThat(queries.get(Registry.MGI)).containsExactly("Ai14", "Slc17a7-Cre");
        assertThat(queries.get(Registry.NCBI_GENE)).containsExactly("Ai14", "Slc17a7-Cre");
    }

    @Test
    void dropsShortTokensAndDuplicates() throws Exception {
        Map<Registry, List<String>> queries = extractor.extractQueries(RecordType.SUBJECT,
                json("{\"genotype\": \"Emx1-Cre/wt; Emx1-Cre\", \"alleles\": [{\"name\": \"Ai94\"}, \"Emx1-Cre\", \"xy\"]}"));

        assertThat(queries.get(Registry.MGI)).containsExactly("Emx1-Cre", "Ai94");
        assertThat(queries.get(Registry.NCBI_GENE)).containsExactly("Emx1-Cre");
    }

    @Test
    void findsPlasmidsAndCatalogNumbersAnywhereInProcedures() throws Exception {
        Map<Registry, List<String>> queries = extractor.extractQueries(RecordType.PROCEDURES,
                json("{\"subject_procedures\": [{\"injection_materials\": [{\"name\": \"pAAV-EF1a-DIO-hChR2\", \"addgene_id\": \"26973\"}]}],"
                        + " \"injection_volume\": 500, \"year\": 999}"));

        assertThat(queries).containsOnlyKeys(Registry.ADDGENE);
        assertThat(queries.get(Registry.ADDGENE)).containsExactly("pAAV-EF1a-DIO-hChR2", "26973");
    }

    @Test
    void otherTypesTriggerNothing() throws Exception {
        assertThat(extractor.extractQueries(RecordType.SESSION, json("{\"genotype\": \"Ai14\"}"))).isEmpty();
        assertThat(extractor.extractQueries(RecordType.SUBJECT, json("{\"subject_id\": \"4528\"}"))).isEmpty();
    }
}
