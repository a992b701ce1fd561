package org.harvest.traits.adapter;

import java.util.List;

import org.harvest.traits.profile.ModelProfile;

/**
 * Uniform contract over an NLP backend.
 *
 * <p>Implementations load lazily: calling {@link #extract} or {@link #train}
 * before {@link #load} triggers the load.
 */
public interface ExtractionAdapter {

    /**
     * Loads the model. Idempotent.
     *
     * @throws org.harvest.exception.ModelLoadException if the backend runtime or artifact is missing
     */
    void load();

    /**
     * Extracts triples from each text.
     *
     * @param texts input texts, not modified
     * @return one list per input text, in input order, empty when nothing was found
     */
    List<List<RawTriple>> extract(List<String> texts);

    TrainingResult train(List<TrainingExample> examples, TrainingOptions options);

    /**
     * Maps a raw triple onto canonical entity types and relation names.
     *
     * @param raw backend triple
     * @return canonical triple with confidence clamped to [0, 1]
     */
    NormalizedTriple normalize(RawTriple raw);

    void unload();

    boolean isLoaded();

    ModelProfile profile();
}
