package org.harvest.traits.adapter.lasuie;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One document in the LasUIE inference input and output files.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LasUIERecord(String id, String text, List<Object> entities, List<Relation> relations) {

    public LasUIERecord {
        entities = entities == null ? List.of() : entities;
        relations = relations == null ? List.of() : relations;
    }

    public static LasUIERecord input(String id, String text) {
        return new LasUIERecord(id, text, List.of(), List.of());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Relation(Span head, Span tail, String type, Double score) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Span(String text, String type) {}
}
