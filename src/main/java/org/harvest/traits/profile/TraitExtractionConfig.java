package org.harvest.traits.profile;

import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for the trait extraction subsystem.
 *
 * <p>Loaded from application.properties with the "trait-extraction" prefix.
 *
 * <p>Example configuration:
 * <pre>
 * trait-extraction.local-mode=true
 * trait-extraction.api-key=${TRAIT_EXTRACTION_API_KEY:}
 * trait-extraction.profiles.spacy_bio.name=spaCy Biological NER
 * trait-extraction.profiles.spacy_bio.backend=spacy
 * trait-extraction.profiles.spacy_bio.params.model-name=en_core_web_sm
 * </pre>
 */
@ConfigMapping(prefix = "trait-extraction")
public interface TraitExtractionConfig {

    /**
     * Whether extraction runs in-process (true) or on the remote peer (false).
     *
     * @return true for local mode
     */
    @WithName("local-mode")
    @WithDefault("true")
    boolean localMode();

    /**
     * Shared bearer key for the peer API. Authentication is disabled when absent.
     *
     * @return the API key, if configured
     */
    @WithName("api-key")
    Optional<String> apiKey();

    /**
     * Triples below this confidence are hidden from triple listings by default.
     *
     * @return minimum confidence (0.0 - 1.0)
     */
    @WithName("min-confidence")
    @WithDefault("0.5")
    double minConfidence();

    Training training();

    Worker worker();

    Storage storage();

    /**
     * Model profiles keyed by profile id.
     *
     * @return configured profiles
     */
    Map<String, Profile> profiles();

    interface Training {

        @WithDefault("true")
        boolean enabled();

        @WithName("batch-size")
        @WithDefault("4")
        int batchSize();

        @WithDefault("3")
        int epochs();
    }

    interface Worker {

        /**
         * Number of jobs executed concurrently by the background worker.
         *
         * @return pool size
         */
        @WithName("pool-size")
        @WithDefault("1")
        int poolSize();
    }

    interface Storage {

        /**
         * Storage backend: "sqlite" or "memory".
         *
         * @return backend name
         */
        @WithDefault("sqlite")
        String backend();

        @WithName("sqlite-path")
        @WithDefault("data/trait_extraction.db")
        String sqlitePath();
    }

    interface Profile {

        String name();

        @WithDefault("")
        String description();

        /**
         * Backend tag: spacy, huggingface, lasuie or allennlp.
         *
         * @return backend tag
         */
        String backend();

        /**
         * Backend-specific parameters; empty when none are configured.
         *
         * @return parameters keyed by name
         */
        Map<String, String> params();
    }
}
