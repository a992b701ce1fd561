package org.harvest.traits.adapter.allennlp;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * SRL output: one frame per verb, with BIO tags aligned to {@code words}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SrlPrediction(List<VerbFrame> verbs, List<String> words) {

    public SrlPrediction {
        verbs = verbs == null ? List.of() : verbs;
        words = words == null ? List.of() : words;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record VerbFrame(String verb, String description, List<String> tags) {

        public VerbFrame {
            tags = tags == null ? List.of() : tags;
        }
    }
}
