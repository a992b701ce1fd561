package org.harvest.traits.remote;

import java.util.Map;

import org.harvest.traits.adapter.TrainingResult;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TrainModelResponse(
    @JsonProperty("status") String status,
    @JsonProperty("model_path") String modelPath,
    @JsonProperty("metrics") Map<String, Object> metrics,
    @JsonProperty("error") String error
) {

    public static TrainModelResponse from(TrainingResult result) {
        return new TrainModelResponse(result.status(), result.artifactPath(), result.metrics(), result.error());
    }
}
