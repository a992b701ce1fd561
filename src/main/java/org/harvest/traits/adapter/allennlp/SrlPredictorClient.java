package org.harvest.traits.adapter.allennlp;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * REST client for an AllenNLP semantic role labelling predictor server.
 */
@Path("/")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public interface SrlPredictorClient {

    @GET
    @Path("/info")
    PredictorInfo info();

    @POST
    @Path("/predict")
    SrlPrediction predict(SrlRequest request);

    record SrlRequest(String sentence) {}
}
