package org.harvest.traits.server;

import java.util.List;

import org.harvest.traits.profile.ModelProfileSummary;
import org.harvest.traits.remote.ExtractTriplesRequest;
import org.harvest.traits.remote.ExtractTriplesResponse;
import org.harvest.traits.remote.HealthResponse;
import org.harvest.traits.remote.StatusMessage;
import org.harvest.traits.remote.TrainModelRequest;
import org.harvest.traits.remote.TrainModelResponse;
import org.harvest.traits.remote.UnloadModelRequest;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * Peer extraction API consumed by {@link org.harvest.traits.remote.RemoteExtractionClient}.
 */
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
public class ExtractionServerResources {

    @Inject
    PeerExtractionService peerService;

    @GET
    public ServerInfo root() {
        return ServerInfo.running();
    }

    @GET
    @Path("/health")
    public HealthResponse health() {
        return peerService.health();
    }

    @GET
    @Path("/models")
    @ApiKeyProtected
    public List<ModelProfileSummary> models() {
        return peerService.models();
    }

    @POST
    @Path("/extract_triples")
    @Consumes(MediaType.APPLICATION_JSON)
    @ApiKeyProtected
    public ExtractTriplesResponse extractTriples(@Valid @NotNull ExtractTriplesRequest request) {
        return peerService.extract(request);
    }

    @POST
    @Path("/train_model")
    @Consumes(MediaType.APPLICATION_JSON)
    @ApiKeyProtected
    public TrainModelResponse trainModel(@Valid @NotNull TrainModelRequest request) {
        return peerService.train(request);
    }

    @POST
    @Path("/unload_model")
    @Consumes(MediaType.APPLICATION_JSON)
    @ApiKeyProtected
    public StatusMessage unloadModel(@Valid @NotNull UnloadModelRequest request) {
        return peerService.unload(request.modelProfile());
    }

    @POST
    @Path("/unload_all")
    @ApiKeyProtected
    public StatusMessage unloadAll() {
        return peerService.unloadAll();
    }
}
