package org.harvest.traits.adapter;

import java.util.List;

/**
 * Annotated sentence used for fine-tuning.
 *
 * @param text sentence text
 * @param triples triples annotated in the sentence, in canonical vocabulary
 */
public record TrainingExample(String text, List<NormalizedTriple> triples) {

    public TrainingExample {
        triples = triples == null ? List.of() : List.copyOf(triples);
    }
}
