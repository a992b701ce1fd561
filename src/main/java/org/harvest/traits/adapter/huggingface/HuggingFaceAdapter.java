package org.harvest.traits.adapter.huggingface;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.harvest.exception.ModelLoadException;
import org.harvest.traits.adapter.AbstractExtractionAdapter;
import org.harvest.traits.adapter.RawTriple;
import org.harvest.traits.adapter.ScriptTrainer;
import org.harvest.traits.adapter.TrainingExample;
import org.harvest.traits.adapter.TrainingOptions;
import org.harvest.traits.adapter.TrainingResult;
import org.harvest.traits.profile.ModelProfile;
import org.jboss.logging.Logger;

/**
 * Hugging Face token classification backend.
 *
 * <p>Consecutive entity spans become triples. The relation is derived from
 * the pair of entity groups and the confidence is the mean of both scores.
 */
public class HuggingFaceAdapter extends AbstractExtractionAdapter {

    private static final Logger LOG = Logger.getLogger(HuggingFaceAdapter.class);

    static final int CONTEXT_WINDOW = 50;
    private static final String WARMUP_TEXT = "HARVEST";

    private final HuggingFaceInferenceClient client;
    private final ScriptTrainer trainer;
    private final String modelName;
    private final String authorization;

    public HuggingFaceAdapter(ModelProfile profile, HuggingFaceInferenceClient client, ScriptTrainer trainer) {
        super(profile);
        this.client = client;
        this.trainer = trainer;
        this.modelName = profile.param("model-name", "dbmdz/bert-large-cased-finetuned-conll03-english");
        final String token = profile.param("api-token");
        this.authorization = token != null ? "Bearer " + token : null;
    }

    /**
     * Sends a short warm-up input to the model. The Inference API answers 404 for
     * unknown models and 503 while a model is still being loaded.
     */
    @Override
    protected void doLoad() {
        final String task = profile.param("task", "ner");
        if (!"ner".equals(task) && !"token-classification".equals(task)) {
            throw new ModelLoadException("Unsupported Hugging Face task for triple extraction: " + task);
        }
        final List<EntitySpan> warmup = client.classify(modelName, authorization,
            TokenClassificationRequest.aggregated(WARMUP_TEXT));
        if (warmup == null) {
            throw new ModelLoadException("Hugging Face model did not answer: " + modelName);
        }
        LOG.infof("Hugging Face model %s ready", modelName);
    }

    @Override
    protected List<List<RawTriple>> doExtract(List<String> texts) {
        final List<List<RawTriple>> result = new ArrayList<>(texts.size());
        for (String text : texts) {
            final List<EntitySpan> spans = client.classify(modelName, authorization,
                TokenClassificationRequest.aggregated(text));
            result.add(pairTriples(text, spans == null ? List.of() : spans));
        }
        return result;
    }

    private List<RawTriple> pairTriples(String text, List<EntitySpan> spans) {
        final List<RawTriple> triples = new ArrayList<>();
        for (int i = 0; i < spans.size() - 1; i++) {
            final EntitySpan source = spans.get(i);
            final EntitySpan target = spans.get(i + 1);
            triples.add(RawTriple.of(
                source.word(), source.entityGroup(),
                relationFor(source.entityGroup(), target.entityGroup()),
                target.word(), target.entityGroup(),
                (source.score() + target.score()) / 2.0,
                context(text, source.start(), target.end())));
        }
        return triples;
    }

    static String relationFor(String sourceGroup, String targetGroup) {
        if ("PER".equals(sourceGroup) && "ORG".equals(targetGroup)) {
            return "associated_with";
        }
        if ("ORG".equals(sourceGroup) && "LOC".equals(targetGroup)) {
            return "localizes_to";
        }
        return DEFAULT_RELATION;
    }

    static String context(String text, int start, int end) {
        final int from = Math.max(0, Math.min(text.length(), start - CONTEXT_WINDOW));
        final int to = Math.min(text.length(), Math.max(from, end + CONTEXT_WINDOW));
        return text.substring(from, to);
    }

    @Override
    protected TrainingResult doTrain(List<TrainingExample> examples, TrainingOptions options) {
        final String command = profile.param("train-command");
        if (command == null) {
            return TrainingResult.notImplemented("No train-command configured for profile " + profile.id());
        }
        final Path workingDir = Paths.get(profile.param("working-dir", "."));
        return trainer.train(profile, ScriptTrainer.parseCommand(command), workingDir, examples, options);
    }
}
