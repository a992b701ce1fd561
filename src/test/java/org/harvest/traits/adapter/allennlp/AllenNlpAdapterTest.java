package org.harvest.traits.adapter.allennlp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.harvest.exception.ModelLoadException;
import org.harvest.traits.adapter.RawTriple;
import org.harvest.traits.adapter.TrainingOptions;
import org.harvest.traits.adapter.TrainingResult;
import org.harvest.traits.adapter.allennlp.SrlPrediction.VerbFrame;
import org.harvest.traits.profile.ModelProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AllenNlpAdapterTest {

    private static final List<String> WORDS = List.of("The", "FLC", "gene", "regulates", "flowering", "time");

    private SrlPredictorClient client;
    private AllenNlpAdapter adapter;

    @BeforeEach
    void setUp() {
        client = mock(SrlPredictorClient.class);
        when(client.info()).thenReturn(new PredictorInfo("structured-prediction-srl-bert"));
        adapter = new AllenNlpAdapter(ModelProfile.of("allennlp_srl", "allennlp", Map.of()), client);
    }

    @Test
    void testParseFrameBuildsArgumentSpans() {
        final VerbFrame frame = new VerbFrame("regulates", "",
            List.of("B-ARG0", "I-ARG0", "I-ARG0", "B-V", "B-ARG1", "I-ARG1"));

        final Optional<RawTriple> triple = AllenNlpAdapter.parseFrame(frame, WORDS, "sentence");

        assertTrue(triple.isPresent());
        assertEquals("The FLC gene", triple.get().sourceEntityName());
        assertEquals("flowering time", triple.get().sinkEntityName());
        assertEquals("regulates", triple.get().relation());
        assertEquals(0.8, triple.get().confidence());
    }

    @Test
    void testFrameWithoutPatientIsIgnored() {
        final VerbFrame frame = new VerbFrame("regulates", "", List.of("B-ARG0", "I-ARG0", "I-ARG0", "B-V", "O", "O"));

        assertTrue(AllenNlpAdapter.parseFrame(frame, WORDS, "sentence").isEmpty());
    }

    @Test
    void testUnknownVerbFallsBackToDefaultRelation() {
        final VerbFrame frame = new VerbFrame("shapes", "", List.of("B-ARG0", "O", "O", "B-V", "B-ARG1", "O"));

        assertEquals("is_related_to", AllenNlpAdapter.parseFrame(frame, WORDS, "s").orElseThrow().relation());
    }

    @Test
    void testExtractUsesPredictorWords() {
        when(client.predict(any())).thenReturn(new SrlPrediction(List.of(
            new VerbFrame("regulates", "", List.of("B-ARG0", "I-ARG0", "I-ARG0", "B-V", "B-ARG1", "I-ARG1"))),
            WORDS));

        final List<List<RawTriple>> result = adapter.extract(List.of("The FLC gene regulates flowering time"));

        assertEquals(1, result.get(0).size());
        assertEquals("Factor", adapter.normalize(result.get(0).get(0)).sourceEntityAttr());
    }

    @Test
    void testSilentPredictorFailsLoad() {
        when(client.info()).thenReturn(null);

        assertThrows(ModelLoadException.class, adapter::load);
    }

    @Test
    void testTrainingNotImplemented() {
        final TrainingResult result = adapter.train(List.of(), new TrainingOptions(null, 1, 1));

        assertEquals(TrainingResult.NOT_IMPLEMENTED, result.status());
    }
}
