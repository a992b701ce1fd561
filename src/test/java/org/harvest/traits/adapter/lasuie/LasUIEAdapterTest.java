package org.harvest.traits.adapter.lasuie;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.harvest.exception.ExtractionRuntimeException;
import org.harvest.exception.ModelLoadException;
import org.harvest.traits.adapter.ExternalProcessRunner;
import org.harvest.traits.adapter.NormalizedTriple;
import org.harvest.traits.adapter.ProcessResult;
import org.harvest.traits.adapter.RawTriple;
import org.harvest.traits.adapter.TrainingExample;
import org.harvest.traits.adapter.TrainingOptions;
import org.harvest.traits.adapter.TrainingResult;
import org.harvest.traits.profile.ModelProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;

class LasUIEAdapterTest {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path lasuieDir;

    private FakeRunner runner;

    /**
     * Answers inference runs with a canned output file instead of starting Python.
     */
    static class FakeRunner extends ExternalProcessRunner {

        final List<List<String>> commands = new ArrayList<>();
        List<LasUIERecord> output = List.of();
        int exitCode = 0;

        @Override
        public ProcessResult run(List<String> command, Path workingDir, Duration timeout) {
            commands.add(command);
            final int outputIndex = command.indexOf("--output");
            if (outputIndex >= 0 && exitCode == 0) {
                try {
                    objectMapper.writeValue(Path.of(command.get(outputIndex + 1)).toFile(), output);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
            return new ProcessResult(exitCode, exitCode == 0 ? "" : "Traceback: CUDA error");
        }
    }

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(lasuieDir.resolve("run_inference.py"), "# inference");
        runner = new FakeRunner();
    }

    private LasUIEAdapter adapter() {
        return new LasUIEAdapter(ModelProfile.of("lasuie", "lasuie",
            Map.of("lasuie-path", lasuieDir.toString(), "device", "cpu")), runner);
    }

    @Test
    void testRelationsAreAlignedToInputs() {
        runner.output = List.of(
            new LasUIERecord("doc_1", "OsSPL14 increases grain yield.", List.of(), List.of(
                new LasUIERecord.Relation(new LasUIERecord.Span("OsSPL14", "gene"),
                    new LasUIERecord.Span("grain yield", "phenotype"), "increase", 0.93))),
            new LasUIERecord("doc_0", "FLC regulates flowering.", List.of(), List.of(
                new LasUIERecord.Relation(new LasUIERecord.Span("FLC", "gene"),
                    new LasUIERecord.Span("flowering", "trait"), "regulate", null))));
        final LasUIEAdapter adapter = adapter();

        final List<List<RawTriple>> result = adapter.extract(List.of(
            "FLC regulates flowering.", "OsSPL14 increases grain yield.", "nothing here"));

        assertEquals(3, result.size());
        assertEquals("FLC", result.get(0).get(0).sourceEntityName());
        assertEquals(0.8, result.get(0).get(0).confidence());
        assertEquals("OsSPL14", result.get(1).get(0).sourceEntityName());
        assertEquals(0.93, result.get(1).get(0).confidence());
        assertTrue(result.get(2).isEmpty());

        final NormalizedTriple normalized = adapter.normalize(result.get(1).get(0));
        assertEquals("Gene", normalized.sourceEntityAttr());
        assertEquals("Trait", normalized.sinkEntityAttr());
        assertEquals("increases", normalized.relationType());

        final List<String> command = runner.commands.get(0);
        assertEquals("run_inference.py", command.get(1));
        assertTrue(command.containsAll(List.of("--device", "cpu", "--config", "default")));
    }

    @Test
    void testUnknownTypesBecomeFactor() {
        final NormalizedTriple normalized = adapter().normalize(
            RawTriple.of("heat", "stress", "affects", "yield", "trait", 0.5, null));

        assertEquals("Factor", normalized.sourceEntityAttr());
        assertEquals("affects", normalized.relationType());
    }

    @Test
    void testFailedInferenceThrows() {
        runner.exitCode = 1;

        final ExtractionRuntimeException error = assertThrows(ExtractionRuntimeException.class,
            () -> adapter().extract(List.of("text")));
        assertTrue(error.getMessage().contains("exit code 1"));
    }

    @Test
    void testMissingCheckoutFailsLoad() {
        final LasUIEAdapter adapter = new LasUIEAdapter(ModelProfile.of("lasuie", "lasuie",
            Map.of("lasuie-path", lasuieDir.resolve("missing").toString())), runner);

        assertThrows(ModelLoadException.class, adapter::load);
    }

    @Test
    void testTrainingRunsFinetuneScript() {
        final TrainingResult result = adapter().train(
            List.of(new TrainingExample("FLC regulates flowering.", List.of())),
            new TrainingOptions(null, 2, 8));

        assertEquals(TrainingResult.SUCCESS, result.status());
        assertEquals("./tmp/lasuie_finetuned", result.artifactPath());
        final List<String> command = runner.commands.get(0);
        assertEquals("run_finetune.py", command.get(1));
        assertEquals("2", command.get(command.indexOf("--num_epochs") + 1));
        assertEquals("8", command.get(command.indexOf("--batch_size") + 1));
    }
}
