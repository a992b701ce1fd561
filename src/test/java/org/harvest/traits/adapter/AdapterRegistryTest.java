package org.harvest.traits.adapter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.harvest.traits.profile.ModelProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AdapterRegistryTest {

    private final ModelProfile spacyBio = ModelProfile.of("spacy_bio", "spacy", Map.of("model-name", "en_core_web_sm"));
    private final ModelProfile lasuie = ModelProfile.of("lasuie", "lasuie", Map.of());

    private StubAdapterFactory factory;
    private AdapterRegistry registry;

    @BeforeEach
    void setUp() {
        factory = new StubAdapterFactory();
        registry = new AdapterRegistry(factory);
    }

    @Test
    void testSameProfileReturnsSameInstance() {
        final ExtractionAdapter first = registry.get("spacy_bio", spacyBio);
        final ExtractionAdapter second = registry.get("spacy_bio", spacyBio);

        assertSame(first, second);
        assertEquals(List.of("spacy_bio"), registry.listLoaded());
        assertEquals(1, factory.created.size());
    }

    @Test
    void testDifferentProfilesReturnDifferentInstances() {
        final ExtractionAdapter first = registry.get("spacy_bio", spacyBio);
        final ExtractionAdapter second = registry.get("lasuie", lasuie);

        assertNotSame(first, second);
        assertEquals(List.of("lasuie", "spacy_bio"), registry.listLoaded());
    }

    @Test
    void testIsolatedRegistriesDoNotShareAdapters() {
        final AdapterRegistry other = new AdapterRegistry(new StubAdapterFactory());

        assertNotSame(registry.get("spacy_bio", spacyBio), other.get("spacy_bio", spacyBio));
    }

    @Test
    void testUnloadEvictsAndUnloads() {
        final ExtractionAdapter adapter = registry.get("spacy_bio", spacyBio);
        adapter.load();
        assertTrue(adapter.isLoaded());

        registry.unload("spacy_bio");

        assertFalse(adapter.isLoaded());
        assertEquals(1, factory.created.get(0).unloadCount.get());
        assertTrue(registry.listLoaded().isEmpty());
        assertNotSame(adapter, registry.get("spacy_bio", spacyBio));
    }

    @Test
    void testUnloadUnknownProfileIsNoOp() {
        registry.unload("missing");

        assertTrue(registry.listLoaded().isEmpty());
    }

    @Test
    void testUnloadAll() {
        registry.get("spacy_bio", spacyBio).load();
        registry.get("lasuie", lasuie).load();

        registry.unloadAll();

        assertTrue(registry.listLoaded().isEmpty());
        assertTrue(factory.created.stream().allMatch(adapter -> adapter.unloadCount.get() == 1));
    }
}
