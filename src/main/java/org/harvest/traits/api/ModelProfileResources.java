package org.harvest.traits.api;

import java.util.List;

import org.harvest.traits.TraitExtractionService;
import org.harvest.traits.profile.ModelProfileSummary;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

@Path("/model-profiles")
public class ModelProfileResources {

    @Inject
    TraitExtractionService extractionService;

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    public List<ModelProfileSummary> list() {
        return extractionService.listModelProfiles();
    }
}
