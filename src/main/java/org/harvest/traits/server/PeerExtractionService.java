package org.harvest.traits.server;

import java.util.ArrayList;
import java.util.List;

import org.harvest.exception.ConfigurationException;
import org.harvest.traits.adapter.AdapterRegistry;
import org.harvest.traits.adapter.ExtractionAdapter;
import org.harvest.traits.adapter.RawTriple;
import org.harvest.traits.adapter.TrainingOptions;
import org.harvest.traits.adapter.TrainingResult;
import org.harvest.traits.profile.ModelProfile;
import org.harvest.traits.profile.ModelProfileRegistry;
import org.harvest.traits.profile.ModelProfileSummary;
import org.harvest.traits.profile.TraitExtractionConfig;
import org.harvest.traits.remote.ExtractTriplesRequest;
import org.harvest.traits.remote.ExtractTriplesResponse;
import org.harvest.traits.remote.HealthResponse;
import org.harvest.traits.remote.RemoteDocument;
import org.harvest.traits.remote.RemoteTriple;
import org.harvest.traits.remote.StatusMessage;
import org.harvest.traits.remote.TrainModelRequest;
import org.harvest.traits.remote.TrainModelResponse;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Server side of the peer extraction API. Runs extraction and training on this
 * host's adapters on behalf of a remote caller.
 */
@ApplicationScoped
public class PeerExtractionService {

    private static final Logger LOG = Logger.getLogger(PeerExtractionService.class);

    static final String STATUS_COMPLETED = "completed";
    static final String STATUS_HEALTHY = "healthy";

    private final ModelProfileRegistry profiles;
    private final AdapterRegistry adapters;
    private final TraitExtractionConfig.Training training;

    /**
     * Default constructor for CDI proxy.
     */
    public PeerExtractionService() {
        this.profiles = null;
        this.adapters = null;
        this.training = null;
    }

    @Inject
    public PeerExtractionService(ModelProfileRegistry profiles, AdapterRegistry adapters, TraitExtractionConfig config) {
        this(profiles, adapters, config.training());
    }

    public PeerExtractionService(ModelProfileRegistry profiles, AdapterRegistry adapters,
            TraitExtractionConfig.Training training) {
        this.profiles = profiles;
        this.adapters = adapters;
        this.training = training;
    }

    public HealthResponse health() {
        return new HealthResponse(STATUS_HEALTHY, adapters.listLoaded());
    }

    public List<ModelProfileSummary> models() {
        return profiles.list();
    }

    /**
     * Extracts and normalizes triples for every document of the request.
     *
     * @throws ConfigurationException if the profile is unknown
     * @throws org.harvest.exception.ModelLoadException if the backend cannot be loaded
     * @throws org.harvest.exception.ExtractionRuntimeException if the backend fails
     */
    public ExtractTriplesResponse extract(ExtractTriplesRequest request) {
        LOG.infof("Extraction request for %d document(s) using %s",
            request.documents().size(), request.modelProfile());
        final ModelProfile profile = profiles.require(request.modelProfile());
        final ExtractionAdapter adapter = adapters.get(profile.id(), profile);
        if (!adapter.isLoaded()) {
            LOG.infof("Loading model for profile %s", profile.id());
            adapter.load();
        }

        final List<RemoteDocument> documents = request.documents();
        final List<List<RawTriple>> perDocument = adapter.extract(
            documents.stream().map(RemoteDocument::text).toList());

        final List<RemoteTriple> triples = new ArrayList<>();
        for (int i = 0; i < documents.size(); i++) {
            final RemoteDocument document = documents.get(i);
            for (RawTriple raw : perDocument.get(i)) {
                triples.add(RemoteTriple.of(adapter.normalize(raw), document, profile.id(), request.jobId(),
                    raw.sentence() == null ? "" : raw.sentence()));
            }
        }

        LOG.infof("Extraction complete: %d triple(s) extracted", triples.size());
        return new ExtractTriplesResponse(request.jobId(), STATUS_COMPLETED, documents.size(), triples.size(), triples);
    }

    /**
     * Trains the profile's model. Failures during training are reported in the
     * response rather than thrown.
     *
     * @throws ConfigurationException if training is disabled or the profile is unknown
     */
    public TrainModelResponse train(TrainModelRequest request) {
        LOG.infof("Training request for %s with %d example(s)",
            request.modelProfile(), request.trainingData().size());
        if (!training.enabled()) {
            throw new ConfigurationException("Training is disabled");
        }
        final ModelProfile profile = profiles.require(request.modelProfile());
        try {
            final ExtractionAdapter adapter = adapters.get(profile.id(), profile);
            final TrainingResult result = adapter.train(request.trainingData(), new TrainingOptions(
                request.outputDir(),
                request.epochsOr(training.epochs()),
                request.batchSizeOr(training.batchSize())));
            LOG.infof("Training for %s finished with status %s", profile.id(), result.status());
            return TrainModelResponse.from(result);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Training failed for profile %s", profile.id());
            return TrainModelResponse.from(TrainingResult.failed(e.getMessage()));
        }
    }

    public StatusMessage unload(String modelProfile) {
        adapters.unload(modelProfile);
        return StatusMessage.success("Model " + modelProfile + " unloaded");
    }

    public StatusMessage unloadAll() {
        adapters.unloadAll();
        return StatusMessage.success("All models unloaded");
    }
}
