package org.harvest.traits.adapter.spacy;

import java.util.List;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * REST client for a spaCy model server. Built per profile by the adapter factory.
 */
@Path("/")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public interface SpacyNlpClient {

    /**
     * Lists the spaCy pipelines installed on the server.
     */
    @GET
    @Path("/models")
    List<String> models();

    @POST
    @Path("/parse")
    SpacyParseResponse parse(SpacyParseRequest request);
}
