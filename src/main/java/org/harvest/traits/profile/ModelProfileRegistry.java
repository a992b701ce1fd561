package org.harvest.traits.profile;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.harvest.exception.ConfigurationException;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Resolves model profiles from configuration.
 */
@ApplicationScoped
public class ModelProfileRegistry {

    private static final Logger LOG = Logger.getLogger(ModelProfileRegistry.class);

    private final Map<String, ModelProfile> profiles;

    /**
     * Default constructor for CDI proxy.
     */
    public ModelProfileRegistry() {
        this.profiles = Map.of();
    }

    @Inject
    public ModelProfileRegistry(TraitExtractionConfig config) {
        this(fromConfig(config.profiles()));
        LOG.infof("Loaded %d model profiles: %s", profiles.size(), profiles.keySet());
    }

    public ModelProfileRegistry(List<ModelProfile> profiles) {
        final Map<String, ModelProfile> byId = new LinkedHashMap<>();
        profiles.stream()
            .sorted(Comparator.comparing(ModelProfile::id))
            .forEach(profile -> byId.put(profile.id(), profile));
        this.profiles = byId;
    }

    public Optional<ModelProfile> find(String profileId) {
        return profileId == null ? Optional.empty() : Optional.ofNullable(profiles.get(profileId));
    }

    /**
     * Returns the profile or fails with a ConfigurationException.
     *
     * @param profileId profile identifier
     * @return the resolved profile
     */
    public ModelProfile require(String profileId) {
        return find(profileId)
            .orElseThrow(() -> new ConfigurationException("Unknown model profile: " + profileId));
    }

    public List<ModelProfileSummary> list() {
        return profiles.values().stream()
            .map(ModelProfile::summary)
            .toList();
    }

    private static List<ModelProfile> fromConfig(Map<String, TraitExtractionConfig.Profile> configured) {
        return configured.entrySet().stream()
            .map(entry -> new ModelProfile(
                entry.getKey(),
                entry.getValue().name(),
                entry.getValue().description(),
                entry.getValue().backend(),
                entry.getValue().params()))
            .toList();
    }
}
