package org.harvest.traits.adapter.allennlp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.harvest.exception.ModelLoadException;
import org.harvest.traits.adapter.AbstractExtractionAdapter;
import org.harvest.traits.adapter.EntityType;
import org.harvest.traits.adapter.RawTriple;
import org.harvest.traits.adapter.TrainingExample;
import org.harvest.traits.adapter.TrainingOptions;
import org.harvest.traits.adapter.TrainingResult;
import org.harvest.traits.adapter.allennlp.SrlPrediction.VerbFrame;
import org.harvest.traits.profile.ModelProfile;
import org.jboss.logging.Logger;

/**
 * AllenNLP semantic role labelling backend. Each verb frame with both an
 * ARG0 (agent) and an ARG1 (patient) yields one triple.
 */
public class AllenNlpAdapter extends AbstractExtractionAdapter {

    private static final Logger LOG = Logger.getLogger(AllenNlpAdapter.class);

    static final double FRAME_CONFIDENCE = 0.8;

    private static final Map<String, String> VERB_RELATIONS = Map.ofEntries(
        Map.entry("encode", "encodes"),
        Map.entry("encodes", "encodes"),
        Map.entry("regulate", "regulates"),
        Map.entry("regulates", "regulates"),
        Map.entry("activate", "activates"),
        Map.entry("activates", "activates"),
        Map.entry("inhibit", "inhibits"),
        Map.entry("inhibits", "inhibits"),
        Map.entry("increase", "increases"),
        Map.entry("increases", "increases"),
        Map.entry("decrease", "decreases"),
        Map.entry("decreases", "decreases"),
        Map.entry("affect", "influences"),
        Map.entry("affects", "influences"),
        Map.entry("influence", "influences"),
        Map.entry("influences", "influences"));

    private final SrlPredictorClient client;
    private final String modelName;

    public AllenNlpAdapter(ModelProfile profile, SrlPredictorClient client) {
        super(profile);
        this.client = client;
        this.modelName = profile.param("model-name", "structured-prediction-srl-bert");
    }

    @Override
    protected void doLoad() {
        final PredictorInfo info = client.info();
        if (info == null) {
            throw new ModelLoadException("AllenNLP predictor did not answer for model " + modelName);
        }
        if (info.modelName() != null && !modelName.equals(info.modelName())) {
            LOG.warnf("AllenNLP predictor serves %s, profile %s expects %s",
                info.modelName(), profile.id(), modelName);
        }
    }

    @Override
    protected List<List<RawTriple>> doExtract(List<String> texts) {
        final List<List<RawTriple>> result = new ArrayList<>(texts.size());
        for (String text : texts) {
            final SrlPrediction prediction = client.predict(new SrlPredictorClient.SrlRequest(text));
            final List<String> words = prediction.words().isEmpty()
                ? Arrays.asList(text.trim().split("\\s+"))
                : prediction.words();
            final List<RawTriple> triples = new ArrayList<>();
            for (VerbFrame frame : prediction.verbs()) {
                parseFrame(frame, words, text).ifPresent(triples::add);
            }
            result.add(triples);
        }
        return result;
    }

    static Optional<RawTriple> parseFrame(VerbFrame frame, List<String> words, String sentence) {
        final List<String> arg0 = new ArrayList<>();
        final List<String> arg1 = new ArrayList<>();
        String current = null;

        final int length = Math.min(frame.tags().size(), words.size());
        for (int i = 0; i < length; i++) {
            final String tag = frame.tags().get(i);
            if (tag.startsWith("B-ARG0")) {
                current = "ARG0";
                arg0.add(words.get(i));
            } else if (tag.startsWith("I-ARG0")) {
                if ("ARG0".equals(current)) {
                    arg0.add(words.get(i));
                }
            } else if (tag.startsWith("B-ARG1")) {
                current = "ARG1";
                arg1.add(words.get(i));
            } else if (tag.startsWith("I-ARG1")) {
                if ("ARG1".equals(current)) {
                    arg1.add(words.get(i));
                }
            } else if ("O".equals(tag)) {
                current = null;
            }
        }

        if (arg0.isEmpty() || arg1.isEmpty() || frame.verb() == null || frame.verb().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(RawTriple.of(
            String.join(" ", arg0), EntityType.FACTOR.label(),
            VERB_RELATIONS.getOrDefault(frame.verb().toLowerCase(Locale.ROOT), DEFAULT_RELATION),
            String.join(" ", arg1), EntityType.FACTOR.label(),
            FRAME_CONFIDENCE, sentence));
    }

    @Override
    protected TrainingResult doTrain(List<TrainingExample> examples, TrainingOptions options) {
        LOG.warn("Training not implemented for AllenNLP adapter");
        return TrainingResult.notImplemented("AllenNLP training requires custom configuration files");
    }
}
