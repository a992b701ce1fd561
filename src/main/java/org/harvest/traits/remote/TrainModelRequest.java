package org.harvest.traits.remote;

import java.util.List;

import org.harvest.traits.adapter.TrainingExample;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record TrainModelRequest(
    @JsonProperty("model_profile") @NotBlank String modelProfile,
    @JsonProperty("training_data") @NotNull List<TrainingExample> trainingData,
    @JsonProperty("output_dir") String outputDir,
    @JsonProperty("num_epochs") @Min(1) Integer numEpochs,
    @JsonProperty("batch_size") @Min(1) Integer batchSize
) {

    public int epochsOr(int fallback) {
        return numEpochs != null ? numEpochs : fallback;
    }

    public int batchSizeOr(int fallback) {
        return batchSize != null ? batchSize : fallback;
    }
}
