package org.harvest.traits.api;

import java.net.URI;

import org.harvest.exception.ResourceNotFoundException;
import org.harvest.traits.TraitExtractionService;
import org.harvest.traits.job.ExtractionJob;
import org.harvest.traits.profile.TraitExtractionConfig;
import org.harvest.traits.storage.Page;
import org.harvest.traits.triple.ExtractedTriple;
import org.harvest.traits.triple.TripleQuery;
import org.jboss.logging.Logger;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

@Path("/extraction-jobs")
@Produces(MediaType.APPLICATION_JSON)
public class ExtractionJobResources {

    private static final Logger LOG = Logger.getLogger(ExtractionJobResources.class);

    @Inject
    TraitExtractionService extractionService;

    @Inject
    TraitExtractionConfig config;

    /**
     * Queues an extraction job. The job is returned while still pending; poll
     * {@code GET /extraction-jobs/{id}} for progress.
     */
    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    public Response submit(@Valid @NotNull final ExtractionJobRequest request) {
        final ExtractionJob job = extractionService.submitExtraction(
            request.documentIds(),
            request.modelProfile(),
            request.projectId(),
            request.createdBy(),
            request.mode());
        LOG.infof("Accepted extraction job %d", job.id());
        return Response.accepted(job)
            .location(URI.create("/extraction-jobs/" + job.id()))
            .build();
    }

    @GET
    @Path("/{id}")
    public ExtractionJob getById(@PathParam("id") final long id) {
        return extractionService.getJobStatus(id)
            .orElseThrow(() -> new ResourceNotFoundException("Extraction job not found: " + id));
    }

    @GET
    public Page<ExtractionJob> list(
            @QueryParam("project_id") final Long projectId,
            @QueryParam("status") final String status,
            @QueryParam("page") @DefaultValue(QueryParams.DEFAULT_PAGE) final int page,
            @QueryParam("per_page") @DefaultValue(QueryParams.DEFAULT_PER_PAGE) final int perPage) {
        return extractionService.listJobs(projectId, QueryParams.jobStatus(status), page, perPage);
    }

    @POST
    @Path("/{id}/cancel")
    public ExtractionJob cancel(@PathParam("id") final long id) {
        return extractionService.cancelJob(id);
    }

    @GET
    @Path("/{id}/triples")
    public Page<ExtractedTriple> triples(
            @PathParam("id") final long id,
            @QueryParam("status") final String status,
            @QueryParam("min_confidence") final Double minConfidence,
            @QueryParam("page") @DefaultValue(QueryParams.DEFAULT_PAGE) final int page,
            @QueryParam("per_page") @DefaultValue(QueryParams.DEFAULT_PER_PAGE) final int perPage) {
        getById(id);
        return extractionService.listTriples(new TripleQuery(
            id,
            null,
            null,
            QueryParams.tripleStatus(status),
            minConfidence != null ? minConfidence : config.minConfidence(),
            page,
            perPage));
    }
}
