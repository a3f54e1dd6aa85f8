package com.aind.metadata.config;

import com.aind.metadata.model.ControlledVocabulary;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;

/**
 * Loads the controlled vocabulary from controlled-vocabulary.json at startup.
 * Required fields, known-field allowlists and enumerated values live there, not in code.
 */
@Component
@Slf4j
@Getter
public class VocabularyConfigLoader {

    static final String RESOURCE = "/controlled-vocabulary.json";

    private final String resource;
    private ControlledVocabulary vocabulary = new ControlledVocabulary();
    private final ObjectMapper objectMapper = new ObjectMapper();

    public VocabularyConfigLoader() {
        this(RESOURCE);
    }

    VocabularyConfigLoader(String resource) {
        this.resource = resource;
    }

    /** Fails startup when the vocabulary is missing or unreadable. */
    @PostConstruct
    public void load() {
        try (InputStream is = getClass().getResourceAsStream(resource)) {
            if (is == null) {
                log.error("❌ {} not found in classpath resources!", resource);
                throw new IllegalStateException("Controlled vocabulary not found: " + resource);
            }

            vocabulary = objectMapper.readValue(is, ControlledVocabulary.class);

            log.info("✅ Loaded controlled vocabulary: {} required-field lists, {} allowlists, {} modalities, {} species",
                    vocabulary.getRequiredFields().size(),
                    vocabulary.getKnownFields().size(),
                    vocabulary.getModalities().size(),
                    vocabulary.getSpecies().size());
            log.debug("Vocabulary: {}", vocabulary);

        } catch (IOException e) {
            log.error("❌ Error loading {}: {}", resource, e.getMessage(), e);
            throw new IllegalStateException("Controlled vocabulary is unreadable: " + resource, e);
        }
    }

    public boolean isLoaded() {
        return !vocabulary.getRequiredFields().isEmpty();
    }
}
