package org.harvest.traits.adapter.spacy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import org.harvest.traits.adapter.spacy.SpacyParseResponse.Entity;
import org.harvest.traits.adapter.spacy.SpacyParseResponse.Sentence;
import org.harvest.traits.adapter.spacy.SpacyParseResponse.Token;

/**
 * Token-level rules tagging genes, proteins, traits and metabolites.
 *
 * <p>Rule entities take precedence: a statistical entity overlapping a rule
 * entity is dropped.
 */
final class BiologicalEntityRuler {

    private static final Pattern GENE = Pattern.compile("^[A-Z][A-Z0-9]+[a-z]?$");
    private static final Pattern PROTEIN = Pattern.compile("^[A-Z][A-Za-z0-9\\-]+$");
    private static final Set<String> TRAITS = Set.of("yield", "height", "weight", "resistance", "tolerance");
    private static final Set<String> METABOLITES = Set.of("glucose", "sucrose", "starch", "cellulose", "lignin");

    private BiologicalEntityRuler() {
    }

    static List<Entity> apply(Sentence sentence) {
        final List<Entity> ruled = new ArrayList<>();
        for (Token token : sentence.tokens()) {
            label(token.text()).ifPresent(label ->
                ruled.add(new Entity(token.text(), label, token.start(), token.end())));
        }

        final List<Entity> merged = new ArrayList<>(ruled);
        for (Entity entity : sentence.ents()) {
            if (ruled.stream().noneMatch(rule -> overlaps(rule, entity))) {
                merged.add(entity);
            }
        }
        merged.sort(Comparator.comparingInt(Entity::start));
        return merged;
    }

    static Optional<String> label(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        final String lower = text.toLowerCase(Locale.ROOT);
        if (TRAITS.contains(lower)) {
            return Optional.of("TRAIT");
        }
        if (METABOLITES.contains(lower)) {
            return Optional.of("METABOLITE");
        }
        if (GENE.matcher(text).matches()) {
            return Optional.of("GENE");
        }
        if (PROTEIN.matcher(text).matches()) {
            return Optional.of("PROTEIN");
        }
        return Optional.empty();
    }

    private static boolean overlaps(Entity a, Entity b) {
        return a.start() < b.end() && b.start() < a.end();
    }
}
