package org.harvest.traits.profile;

public record ModelProfileSummary(
    String id,
    String name,
    String description,
    String backend
) {}
