package org.harvest.traits.adapter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Canonical entity types shared by every backend.
 */
public enum EntityType {
    GENE("Gene"),
    PROTEIN("Protein"),
    TRAIT("Trait"),
    METABOLITE("Metabolite"),
    ENZYME("Enzyme"),
    FACTOR("Factor");

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<EntityType> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(type -> type.label.equalsIgnoreCase(label.trim()))
            .findFirst();
    }
}
