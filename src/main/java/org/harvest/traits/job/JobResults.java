package org.harvest.traits.job;

import com.fasterxml.jackson.annotation.JsonProperty;

public record JobResults(@JsonProperty("total_triples") int totalTriples) {}
