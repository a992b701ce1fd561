package org.harvest.traits.adapter;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

import org.harvest.traits.profile.ModelProfile;
import org.jboss.logging.Logger;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Caches one adapter per profile name for the lifetime of the process.
 */
@ApplicationScoped
public class AdapterRegistry {

    private static final Logger LOG = Logger.getLogger(AdapterRegistry.class);

    private final ConcurrentHashMap<String, ExtractionAdapter> adapters = new ConcurrentHashMap<>();
    private final AdapterFactory factory;

    /**
     * Default constructor for CDI proxy.
     */
    public AdapterRegistry() {
        this.factory = null;
    }

    @Inject
    public AdapterRegistry(AdapterFactory factory) {
        this.factory = factory;
    }

    /**
     * Returns the cached adapter for the profile, creating it on first use.
     * Repeated calls with the same name return the same instance.
     *
     * @param profileName cache key
     * @param profile profile used when the adapter must be created
     * @return the adapter, not necessarily loaded
     */
    public ExtractionAdapter get(String profileName, ModelProfile profile) {
        return adapters.computeIfAbsent(profileName, name -> {
            LOG.infof("Creating adapter for profile %s (backend %s)", name, profile.backend());
            return factory.create(profile.backend(), profile);
        });
    }

    /**
     * Unloads and evicts one adapter. No-op if the profile has no adapter.
     */
    public void unload(String profileName) {
        final ExtractionAdapter adapter = adapters.remove(profileName);
        if (adapter != null) {
            adapter.unload();
            LOG.infof("Evicted adapter for profile %s", profileName);
        }
    }

    @PreDestroy
    public void unloadAll() {
        for (String profileName : List.copyOf(adapters.keySet())) {
            unload(profileName);
        }
    }

    public List<String> listLoaded() {
        return adapters.keySet().stream().sorted().toList();
    }
}
