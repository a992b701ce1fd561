package org.harvest.traits.adapter.spacy;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Parsed document: sentences with their named entities and tokens.
 * Offsets are character offsets into the submitted text.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpacyParseResponse(List<Sentence> sentences) {

    public SpacyParseResponse {
        sentences = sentences == null ? List.of() : sentences;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Sentence(String text, int start, int end, List<Entity> ents, List<Token> tokens) {

        public Sentence {
            ents = ents == null ? List.of() : ents;
            tokens = tokens == null ? List.of() : tokens;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entity(String text, String label, int start, int end) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Token(String text, String lemma, String pos, int start, int end) {}
}
