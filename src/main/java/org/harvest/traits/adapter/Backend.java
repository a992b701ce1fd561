package org.harvest.traits.adapter;

import java.util.Arrays;
import java.util.Locale;

import org.harvest.exception.ConfigurationException;

/**
 * Closed set of supported NLP backends.
 */
public enum Backend {
    SPACY("spacy"),
    HUGGINGFACE("huggingface"),
    LASUIE("lasuie"),
    ALLENNLP("allennlp");

    private final String tag;

    Backend(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Resolves a backend from its configuration tag.
     *
     * @param tag backend tag, case insensitive
     * @return the backend
     * @throws ConfigurationException if the tag is unknown
     */
    public static Backend fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new ConfigurationException("Backend tag is required");
        }
        final String normalized = tag.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(backend -> backend.tag.equals(normalized))
            .findFirst()
            .orElseThrow(() -> new ConfigurationException("Unknown backend: " + tag));
    }
}
