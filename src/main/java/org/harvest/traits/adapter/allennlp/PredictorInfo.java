package org.harvest.traits.adapter.allennlp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PredictorInfo(@JsonProperty("model_name") String modelName) {}
