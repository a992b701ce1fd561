package org.harvest.traits.adapter.huggingface;

import java.util.List;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * Hugging Face Inference API, token classification task.
 */
@Path("/")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public interface HuggingFaceInferenceClient {

    @POST
    @Path("/models/{model}")
    List<EntitySpan> classify(@PathParam("model") String model,
                              @HeaderParam("Authorization") String authorization,
                              TokenClassificationRequest request);
}
