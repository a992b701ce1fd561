package org.harvest.traits.adapter.spacy;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.harvest.exception.ModelLoadException;
import org.harvest.traits.adapter.AbstractExtractionAdapter;
import org.harvest.traits.adapter.EntityType;
import org.harvest.traits.adapter.RawTriple;
import org.harvest.traits.adapter.ScriptTrainer;
import org.harvest.traits.adapter.TrainingExample;
import org.harvest.traits.adapter.TrainingOptions;
import org.harvest.traits.adapter.TrainingResult;
import org.harvest.traits.adapter.spacy.SpacyParseResponse.Entity;
import org.harvest.traits.adapter.spacy.SpacyParseResponse.Sentence;
import org.harvest.traits.adapter.spacy.SpacyParseResponse.Token;
import org.harvest.traits.profile.ModelProfile;
import org.jboss.logging.Logger;

/**
 * spaCy backend. Consecutive entities within a sentence become a triple whose
 * relation is inferred from the first recognised verb lemma of the sentence.
 *
 * <p>Profile parameters: {@code model-name}, {@code custom-rules},
 * {@code confidence-threshold}, {@code train-command}.
 */
public class SpacyAdapter extends AbstractExtractionAdapter {

    private static final Logger LOG = Logger.getLogger(SpacyAdapter.class);

    private static final Map<String, String> VERB_RELATIONS = Map.ofEntries(
        Map.entry("encode", "encodes"),
        Map.entry("encodes", "encodes"),
        Map.entry("regulate", "regulates"),
        Map.entry("regulates", "regulates"),
        Map.entry("control", "regulates"),
        Map.entry("controls", "regulates"),
        Map.entry("increase", "increases"),
        Map.entry("increases", "increases"),
        Map.entry("enhance", "increases"),
        Map.entry("enhances", "increases"),
        Map.entry("decrease", "decreases"),
        Map.entry("decreases", "decreases"),
        Map.entry("reduce", "decreases"),
        Map.entry("reduces", "decreases"),
        Map.entry("affect", "influences"),
        Map.entry("affects", "influences"),
        Map.entry("influence", "influences"),
        Map.entry("influences", "influences"),
        Map.entry("associate", "associated_with"),
        Map.entry("associates", "associated_with"),
        Map.entry("correlate", "associated_with"),
        Map.entry("correlates", "associated_with"));

    private static final Map<String, EntityType> LABELS = Map.of(
        "GENE", EntityType.GENE,
        "PROTEIN", EntityType.PROTEIN,
        "TRAIT", EntityType.TRAIT,
        "METABOLITE", EntityType.METABOLITE);

    private final SpacyNlpClient client;
    private final ScriptTrainer trainer;
    private final String modelName;
    private final boolean customRules;
    private final double confidenceThreshold;

    public SpacyAdapter(ModelProfile profile, SpacyNlpClient client, ScriptTrainer trainer) {
        super(profile);
        this.client = client;
        this.trainer = trainer;
        this.modelName = profile.param("model-name", "en_core_web_sm");
        this.customRules = profile.booleanParam("custom-rules", false);
        this.confidenceThreshold = profile.doubleParam("confidence-threshold", 0.7);
    }

    @Override
    protected void doLoad() {
        final List<String> available = client.models();
        if (available == null || !available.contains(modelName)) {
            throw new ModelLoadException("spaCy model not installed on server: " + modelName);
        }
        LOG.infof("spaCy model %s available (custom rules: %s)", modelName, customRules);
    }

    @Override
    protected List<List<RawTriple>> doExtract(List<String> texts) {
        final List<List<RawTriple>> result = new ArrayList<>(texts.size());
        for (String text : texts) {
            final SpacyParseResponse parsed = client.parse(new SpacyParseRequest(text, modelName));
            final List<RawTriple> triples = new ArrayList<>();
            for (Sentence sentence : parsed.sentences()) {
                triples.addAll(sentenceTriples(sentence));
            }
            result.add(triples);
        }
        return result;
    }

    private List<RawTriple> sentenceTriples(Sentence sentence) {
        final List<Entity> entities = customRules ? BiologicalEntityRuler.apply(sentence) : sentence.ents();
        if (entities.size() < 2) {
            return List.of();
        }
        final String relation = inferRelation(sentence);
        final List<RawTriple> triples = new ArrayList<>();
        for (int i = 0; i < entities.size() - 1; i++) {
            final Entity source = entities.get(i);
            final Entity target = entities.get(i + 1);
            triples.add(RawTriple.of(
                source.text(), source.label(), relation,
                target.text(), target.label(), confidenceThreshold, sentence.text()));
        }
        return triples;
    }

    static String inferRelation(Sentence sentence) {
        for (Token token : sentence.tokens()) {
            if (!"VERB".equals(token.pos()) || token.lemma() == null) {
                continue;
            }
            final String relation = VERB_RELATIONS.get(token.lemma().toLowerCase(Locale.ROOT));
            if (relation != null) {
                return relation;
            }
        }
        return DEFAULT_RELATION;
    }

    @Override
    protected EntityType mapEntityType(String nativeType) {
        if (nativeType == null) {
            return EntityType.FACTOR;
        }
        return LABELS.getOrDefault(nativeType.toUpperCase(Locale.ROOT), EntityType.FACTOR);
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
