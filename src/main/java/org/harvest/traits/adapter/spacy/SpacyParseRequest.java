package org.harvest.traits.adapter.spacy;

public record SpacyParseRequest(String text, String model) {}
