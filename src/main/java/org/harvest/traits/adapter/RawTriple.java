package org.harvest.traits.adapter;

import org.jetbrains.annotations.Nullable;

/**
 * Triple as produced by a backend, still in the backend's own vocabulary.
 *
 * @param sourceEntityName subject text
 * @param sourceEntityType backend entity label of the subject
 * @param relation backend relation label
 * @param sinkEntityName object text
 * @param sinkEntityType backend entity label of the object
 * @param confidence backend score, may fall outside [0, 1]
 * @param sentence sentence the triple was found in, if known
 */
public record RawTriple(
    String sourceEntityName,
    @Nullable String sourceEntityType,
    @Nullable String relation,
    String sinkEntityName,
    @Nullable String sinkEntityType,
    double confidence,
    @Nullable String sentence,
    @Nullable String traitName,
    @Nullable String traitValue,
    @Nullable String unit
) {

    public static RawTriple of(String source, String sourceType, String relation,
            String sink, String sinkType, double confidence, String sentence) {
        return new RawTriple(source, sourceType, relation, sink, sinkType, confidence, sentence, null, null, null);
    }
}
