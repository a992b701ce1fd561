package org.harvest.traits.adapter;

import java.util.Map;

import org.jetbrains.annotations.Nullable;

/**
 * Outcome of a training run.
 *
 * @param status one of {@code success}, {@code failed} or {@code not_implemented}
 * @param artifactPath where the trained model was written
 * @param metrics backend reported metrics
 * @param error failure or explanation message
 */
public record TrainingResult(
    String status,
    @Nullable String artifactPath,
    Map<String, Object> metrics,
    @Nullable String error
) {

    public static final String SUCCESS = "success";
    public static final String FAILED = "failed";
    public static final String NOT_IMPLEMENTED = "not_implemented";

    public TrainingResult {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    public static TrainingResult success(String artifactPath, Map<String, Object> metrics) {
        return new TrainingResult(SUCCESS, artifactPath, metrics, null);
    }

    public static TrainingResult failed(String error) {
        return new TrainingResult(FAILED, null, Map.of(), error);
    }

    public static TrainingResult notImplemented(String message) {
        return new TrainingResult(NOT_IMPLEMENTED, null, Map.of(), message);
    }
}
