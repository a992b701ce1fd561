package org.harvest.traits.adapter;

import org.jetbrains.annotations.Nullable;

/**
 * @param outputDir directory receiving the trained artifact, backend default when null
 * @param epochs number of training epochs
 * @param batchSize training batch size
 */
public record TrainingOptions(@Nullable String outputDir, int epochs, int batchSize) {

    public TrainingOptions {
        if (epochs < 1) {
            throw new IllegalArgumentException("epochs must be positive");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
    }
}
