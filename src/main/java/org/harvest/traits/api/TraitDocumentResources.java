package org.harvest.traits.api;

import java.net.URI;

import org.harvest.exception.ResourceNotFoundException;
import org.harvest.traits.document.TraitDocument;
import org.harvest.traits.storage.DocumentRepositoryPort;
import org.harvest.traits.storage.Page;

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

/**
 * Registers the text documents that extraction jobs read.
 */
@Path("/trait-documents")
@Produces(MediaType.APPLICATION_JSON)
public class TraitDocumentResources {

    @Inject
    DocumentRepositoryPort documentRepository;

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    public Response create(@Valid @NotNull final TraitDocumentRequest request) {
        final TraitDocument created = documentRepository.save(new TraitDocument(
            request.projectId(),
            request.filePath(),
            request.textContent(),
            request.doi()));
        return Response.created(URI.create("/trait-documents/" + created.getId()))
            .entity(created)
            .build();
    }

    @GET
    @Path("/{id}")
    public TraitDocument getById(@PathParam("id") final long id) {
        return documentRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Trait document not found: " + id));
    }

    @GET
    public Page<TraitDocument> list(
            @QueryParam("project_id") final Long projectId,
            @QueryParam("status") final String status,
            @QueryParam("page") @DefaultValue(QueryParams.DEFAULT_PAGE) final int page,
            @QueryParam("per_page") @DefaultValue(QueryParams.DEFAULT_PER_PAGE) final int perPage) {
        return documentRepository.findAll(projectId, status, page, perPage);
    }
}
