package org.harvest.traits.api;

import org.harvest.exception.ResourceNotFoundException;
import org.harvest.traits.TraitExtractionService;
import org.harvest.traits.profile.TraitExtractionConfig;
import org.harvest.traits.storage.Page;
import org.harvest.traits.storage.TripleRepositoryPort;
import org.harvest.traits.triple.ExtractedTriple;
import org.harvest.traits.triple.TripleQuery;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

@Path("/triples")
@Produces(MediaType.APPLICATION_JSON)
public class TripleResources {

    @Inject
    TraitExtractionService extractionService;

    @Inject
    TripleRepositoryPort tripleRepository;

    @Inject
    TraitExtractionConfig config;

    @GET
    public Page<ExtractedTriple> list(
            @QueryParam("job_id") final Long jobId,
            @QueryParam("document_id") final Long documentId,
            @QueryParam("project_id") final Long projectId,
            @QueryParam("status") final String status,
            @QueryParam("min_confidence") final Double minConfidence,
            @QueryParam("page") @DefaultValue(QueryParams.DEFAULT_PAGE) final int page,
            @QueryParam("per_page") @DefaultValue(QueryParams.DEFAULT_PER_PAGE) final int perPage) {
        return extractionService.listTriples(new TripleQuery(
            jobId,
            documentId,
            projectId,
            QueryParams.tripleStatus(status),
            minConfidence != null ? minConfidence : config.minConfidence(),
            page,
            perPage));
    }

    @GET
    @Path("/{id}")
    public ExtractedTriple getById(@PathParam("id") final long id) {
        return tripleRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Triple not found: " + id));
    }

    @PATCH
    @Path("/{id}")
    @Consumes(MediaType.APPLICATION_JSON)
    public ExtractedTriple review(@PathParam("id") final long id, @Valid @NotNull final TripleReviewRequest request) {
        return extractionService.reviewTriple(id, request.status(), request.edits());
    }
}
