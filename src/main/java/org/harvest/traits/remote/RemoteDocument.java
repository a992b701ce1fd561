package org.harvest.traits.remote;

import java.util.Map;

import jakarta.validation.constraints.NotNull;

public record RemoteDocument(
    @NotNull Long id,
    @NotNull String text,
    Map<String, Object> metadata
) {

    public RemoteDocument {
        metadata = metadata == null ? Map.of() : metadata;
    }
}
