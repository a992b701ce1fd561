package org.harvest.traits.adapter.lasuie;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.harvest.exception.ExtractionRuntimeException;
import org.harvest.exception.ModelLoadException;
import org.harvest.traits.adapter.AbstractExtractionAdapter;
import org.harvest.traits.adapter.EntityType;
import org.harvest.traits.adapter.ExternalProcessRunner;
import org.harvest.traits.adapter.ProcessResult;
import org.harvest.traits.adapter.RawTriple;
import org.harvest.traits.adapter.ScriptTrainer;
import org.harvest.traits.adapter.TrainingExample;
import org.harvest.traits.adapter.TrainingOptions;
import org.harvest.traits.adapter.TrainingResult;
import org.harvest.traits.profile.ModelProfile;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * LasUIE backend, driven through its Python scripts in a local checkout.
 *
 * <p>Inference exchanges JSON files with {@code run_inference.py}; training
 * runs {@code run_finetune.py}.
 */
public class LasUIEAdapter extends AbstractExtractionAdapter {

    private static final Logger LOG = Logger.getLogger(LasUIEAdapter.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    static final String INFERENCE_SCRIPT = "run_inference.py";
    static final String FINETUNE_SCRIPT = "run_finetune.py";
    static final Duration INFERENCE_TIMEOUT = Duration.ofMinutes(5);
    static final double DEFAULT_SCORE = 0.8;

    private static final Map<String, EntityType> TYPES = Map.of(
        "gene", EntityType.GENE,
        "protein", EntityType.PROTEIN,
        "trait", EntityType.TRAIT,
        "phenotype", EntityType.TRAIT,
        "metabolite", EntityType.METABOLITE,
        "enzyme", EntityType.ENZYME);

    private static final Map<String, String> RELATIONS = Map.of(
        "encode", "encodes",
        "regulate", "regulates",
        "increase", "increases",
        "decrease", "decreases");

    private final ExternalProcessRunner processRunner;
    private final ScriptTrainer trainer;
    private final Path lasuiePath;
    private final String python;
    private final String device;
    private final String configName;

    public LasUIEAdapter(ModelProfile profile, ExternalProcessRunner processRunner) {
        super(profile);
        this.processRunner = processRunner;
        this.trainer = new ScriptTrainer(processRunner);
        this.lasuiePath = Paths.get(profile.param("lasuie-path", "./LasUIE"));
        this.python = profile.param("python", "python");
        this.device = profile.param("device", "cpu");
        this.configName = profile.param("config-name", "default");
    }

    @Override
    protected void doLoad() {
        if (!Files.isDirectory(lasuiePath)) {
            throw new ModelLoadException("LasUIE checkout not found at " + lasuiePath.toAbsolutePath());
        }
        if (!Files.isRegularFile(lasuiePath.resolve(INFERENCE_SCRIPT))) {
            throw new ModelLoadException("LasUIE inference script not found: " + lasuiePath.resolve(INFERENCE_SCRIPT));
        }
        LOG.infof("LasUIE ready at %s (device=%s, config=%s)", lasuiePath, device, configName);
    }

    @Override
    protected List<List<RawTriple>> doExtract(List<String> texts) {
        Path input = null;
        Path output = null;
        try {
            input = Files.createTempFile("lasuie-input-", ".json");
            output = Files.createTempFile("lasuie-output-", ".json");

            final List<LasUIERecord> records = new ArrayList<>(texts.size());
            for (int i = 0; i < texts.size(); i++) {
                records.add(LasUIERecord.input(recordId(i), texts.get(i)));
            }
            objectMapper.writeValue(input.toFile(), records);

            final List<String> command = List.of(
                python, INFERENCE_SCRIPT,
                "--input", input.toString(),
                "--output", output.toString(),
                "--device", device,
                "--config", configName);
            final ProcessResult result = processRunner.run(command, lasuiePath, INFERENCE_TIMEOUT);
            if (!result.succeeded()) {
                throw new ExtractionRuntimeException("LasUIE inference failed with exit code " + result.exitCode());
            }

            final List<LasUIERecord> outputs = objectMapper.readValue(output.toFile(),
                new TypeReference<List<LasUIERecord>>() {});
            return alignToInput(texts.size(), outputs);
        } catch (IOException e) {
            throw new ExtractionRuntimeException("LasUIE inference I/O error: " + e.getMessage(), e);
        } finally {
            deleteQuietly(input);
            deleteQuietly(output);
        }
    }

    private List<List<RawTriple>> alignToInput(int size, List<LasUIERecord> outputs) {
        final Map<String, LasUIERecord> byId = new HashMap<>();
        for (LasUIERecord record : outputs) {
            if (record.id() != null) {
                byId.put(record.id(), record);
            }
        }
        final List<List<RawTriple>> result = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            final LasUIERecord record = byId.get(recordId(i));
            result.add(record == null ? List.of() : toTriples(record));
        }
        return result;
    }

    private static List<RawTriple> toTriples(LasUIERecord record) {
        final List<RawTriple> triples = new ArrayList<>();
        for (LasUIERecord.Relation relation : record.relations()) {
            final LasUIERecord.Span head = relation.head() != null ? relation.head() : new LasUIERecord.Span("", "");
            final LasUIERecord.Span tail = relation.tail() != null ? relation.tail() : new LasUIERecord.Span("", "");
            triples.add(RawTriple.of(
                head.text(), head.type(),
                relation.type() != null ? relation.type() : DEFAULT_RELATION,
                tail.text(), tail.type(),
                relation.score() != null ? relation.score() : DEFAULT_SCORE,
                record.text()));
        }
        return triples;
    }

    @Override
    protected EntityType mapEntityType(String nativeType) {
        if (nativeType == null) {
            return EntityType.FACTOR;
        }
        return TYPES.getOrDefault(nativeType.toLowerCase(Locale.ROOT), EntityType.FACTOR);
    }

    @Override
    protected String mapRelation(String nativeRelation) {
        if (nativeRelation == null || nativeRelation.isBlank()) {
            return DEFAULT_RELATION;
        }
        return RELATIONS.getOrDefault(nativeRelation.toLowerCase(Locale.ROOT), nativeRelation);
    }

    @Override
    protected TrainingResult doTrain(List<TrainingExample> examples, TrainingOptions options) {
        final TrainingOptions withDefaultDir = options.outputDir() != null
            ? options
            : new TrainingOptions("./tmp/lasuie_finetuned", options.epochs(), options.batchSize());
        return trainer.train(profile, List.of(python, FINETUNE_SCRIPT, "--device", device),
            lasuiePath, examples, withDefaultDir);
    }

    private static String recordId(int index) {
        return "doc_" + index;
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.debugf("Could not delete %s: %s", path, e.getMessage());
        }
    }
}
