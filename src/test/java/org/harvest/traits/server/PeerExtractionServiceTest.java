package org.harvest.traits.server;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.harvest.exception.ConfigurationException;
import org.harvest.exception.ExtractionRuntimeException;
import org.harvest.traits.adapter.AdapterRegistry;
import org.harvest.traits.adapter.NormalizedTriple;
import org.harvest.traits.adapter.StubAdapterFactory;
import org.harvest.traits.adapter.StubExtractionAdapter;
import org.harvest.traits.adapter.TrainingExample;
import org.harvest.traits.adapter.TrainingResult;
import org.harvest.traits.profile.ModelProfile;
import org.harvest.traits.profile.ModelProfileRegistry;
import org.harvest.traits.profile.TraitExtractionConfig;
import org.harvest.traits.remote.ExtractTriplesRequest;
import org.harvest.traits.remote.ExtractTriplesResponse;
import org.harvest.traits.remote.RemoteDocument;
import org.harvest.traits.remote.RemoteTriple;
import org.harvest.traits.remote.TrainModelRequest;
import org.harvest.traits.remote.TrainModelResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PeerExtractionServiceTest {

    private StubAdapterFactory factory;
    private AdapterRegistry adapters;
    private PeerExtractionService service;

    private static TraitExtractionConfig.Training training(boolean enabled) {
        return new TraitExtractionConfig.Training() {
            @Override
            public boolean enabled() {
                return enabled;
            }

            @Override
            public int batchSize() {
                return 4;
            }

            @Override
            public int epochs() {
                return 3;
            }
        };
    }

    private PeerExtractionService service(boolean trainingEnabled) {
        final ModelProfileRegistry profiles = new ModelProfileRegistry(List.of(
            ModelProfile.of("spacy_bio", "spacy", Map.of()),
            ModelProfile.of("allennlp_srl", "allennlp", Map.of())));
        return new PeerExtractionService(profiles, adapters, training(trainingEnabled));
    }

    @BeforeEach
    void setUp() {
        factory = new StubAdapterFactory();
        adapters = new AdapterRegistry(factory);
        service = service(true);
    }

    @Test
    void testExtractAnnotatesTriplesWithDocumentMetadata() {
        final ExtractTriplesRequest request = new ExtractTriplesRequest(List.of(
            new RemoteDocument(11L, "FLC delays flowering.", Map.of("project_id", 7, "doi", "10.1000/abc")),
            new RemoteDocument(12L, "   ", Map.of()),
            new RemoteDocument(13L, "GA20ox increases height.", null)),
            "spacy_bio", 42L);

        final ExtractTriplesResponse response = service.extract(request);

        assertEquals(42L, response.jobId());
        assertEquals("completed", response.status());
        assertEquals(3, response.totalDocuments());
        assertEquals(2, response.totalTriples());

        final RemoteTriple first = response.triples().get(0);
        assertEquals(11L, first.documentId());
        assertEquals(7L, first.projectId());
        assertEquals("10.1000/abc", first.doi());
        assertEquals("spacy_bio", first.modelProfile());
        assertEquals(42L, first.jobId());
        assertEquals("Gene", first.sourceEntityAttr());
        assertEquals("FLC delays flowering.", first.sentence());

        final RemoteTriple second = response.triples().get(1);
        assertEquals(13L, second.documentId());
        assertNull(second.projectId());
    }

    @Test
    void testExtractLoadsAdapterOnce() {
        final ExtractTriplesRequest request = new ExtractTriplesRequest(
            List.of(new RemoteDocument(1L, "text", Map.of())), "spacy_bio", null);

        service.extract(request);
        service.extract(request);

        assertEquals(1, factory.created.size());
        assertEquals(1, factory.created.get(0).loadCount.get());
        assertEquals(List.of("spacy_bio"), service.health().loadedAdapters());
        assertEquals("healthy", service.health().status());
    }

    @Test
    void testExtractUnknownProfile() {
        final ExtractTriplesRequest request = new ExtractTriplesRequest(
            List.of(new RemoteDocument(1L, "text", Map.of())), "flair_ner", null);

        final ConfigurationException error = assertThrows(ConfigurationException.class, () -> service.extract(request));

        assertEquals("Unknown model profile: flair_ner", error.getMessage());
        assertTrue(factory.created.isEmpty());
    }

    @Test
    void testExtractBackendFailurePropagates() {
        final ExtractTriplesRequest request = new ExtractTriplesRequest(
            List.of(new RemoteDocument(1L, "boom " + StubExtractionAdapter.FAIL_MARKER, Map.of())), "spacy_bio", 1L);

        assertThrows(ExtractionRuntimeException.class, () -> service.extract(request));
    }

    @Test
    void testTrainUsesConfiguredDefaults() {
        final TrainingExample example = new TrainingExample("FLC delays flowering.", List.of(
            new NormalizedTriple("FLC", "Gene", "regulates", "flowering", "Trait", 1.0, null, null, null)));

        final TrainModelResponse response = service.train(
            new TrainModelRequest("spacy_bio", List.of(example), "/tmp/out", null, 8));

        assertEquals(TrainingResult.SUCCESS, response.status());
        assertEquals("models/spacy_bio", response.modelPath());
        assertEquals(1, response.metrics().get("examples"));
        final StubExtractionAdapter adapter = factory.created.get(0);
        assertEquals(3, adapter.lastTrainingOptions.epochs());
        assertEquals(8, adapter.lastTrainingOptions.batchSize());
        assertEquals("/tmp/out", adapter.lastTrainingOptions.outputDir());
    }

    @Test
    void testTrainFailureIsReportedInResponse() {
        final TrainModelResponse response = service.train(
            new TrainModelRequest("spacy_bio", List.of(), null, null, null));

        assertEquals(TrainingResult.FAILED, response.status());
        assertEquals("no training examples", response.error());
    }

    @Test
    void testTrainRejectedWhenDisabledOrUnknown() {
        final PeerExtractionService disabled = service(false);

        assertThrows(ConfigurationException.class,
            () -> disabled.train(new TrainModelRequest("spacy_bio", List.of(), null, null, null)));
        assertThrows(ConfigurationException.class,
            () -> service.train(new TrainModelRequest("flair_ner", List.of(), null, null, null)));
        assertTrue(factory.created.isEmpty());
    }

    @Test
    void testUnload() {
        service.extract(new ExtractTriplesRequest(List.of(new RemoteDocument(1L, "a", Map.of())), "spacy_bio", null));
        service.extract(new ExtractTriplesRequest(List.of(new RemoteDocument(1L, "a", Map.of())), "allennlp_srl", null));

        assertEquals("Model spacy_bio unloaded", service.unload("spacy_bio").message());
        assertEquals(1, factory.created.get(0).unloadCount.get());
        assertEquals(List.of("allennlp_srl"), service.health().loadedAdapters());

        assertEquals("success", service.unloadAll().status());
        assertFalse(factory.created.get(1).isLoaded());
        assertTrue(service.health().loadedAdapters().isEmpty());
    }
}
