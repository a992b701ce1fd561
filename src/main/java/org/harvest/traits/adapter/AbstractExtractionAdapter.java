package org.harvest.traits.adapter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import org.harvest.exception.ExtractionRuntimeException;
import org.harvest.exception.ModelLoadException;
import org.harvest.traits.profile.ModelProfile;
import org.jboss.logging.Logger;

/**
 * Base adapter handling the load lifecycle, per-adapter serialization and
 * default normalization.
 *
 * <p>{@code load}, {@code extract}, {@code train} and {@code unload} run under a
 * single lock, so a backend never sees concurrent calls.
 */
public abstract class AbstractExtractionAdapter implements ExtractionAdapter {

    private static final Logger LOG = Logger.getLogger(AbstractExtractionAdapter.class);

    protected static final String DEFAULT_RELATION = "is_related_to";

    protected final ModelProfile profile;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile boolean loaded = false;

    protected AbstractExtractionAdapter(ModelProfile profile) {
        this.profile = profile;
    }

    @Override
    public final void load() {
        lock.lock();
        try {
            loadIfNeeded();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public final List<List<RawTriple>> extract(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        lock.lock();
        try {
            loadIfNeeded();
            final List<List<RawTriple>> perText;
            try {
                perText = doExtract(Collections.unmodifiableList(new ArrayList<>(texts)));
            } catch (ExtractionRuntimeException | ModelLoadException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ExtractionRuntimeException(
                    "Extraction failed for profile " + profile.id() + ": " + e.getMessage(), e);
            }
            if (perText.size() != texts.size()) {
                throw new ExtractionRuntimeException(String.format(
                    "Backend %s returned %d results for %d texts",
                    profile.backend(), perText.size(), texts.size()));
            }
            return perText.stream().map(List::copyOf).toList();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public final TrainingResult train(List<TrainingExample> examples, TrainingOptions options) {
        lock.lock();
        try {
            loadIfNeeded();
            LOG.infof("Training profile %s on %d examples (epochs=%d, batchSize=%d)",
                profile.id(), examples.size(), options.epochs(), options.batchSize());
            return doTrain(List.copyOf(examples), options);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public NormalizedTriple normalize(RawTriple raw) {
        return new NormalizedTriple(
            raw.sourceEntityName(),
            mapEntityType(raw.sourceEntityType()).label(),
            mapRelation(raw.relation()),
            raw.sinkEntityName(),
            mapEntityType(raw.sinkEntityType()).label(),
            clampConfidence(raw.confidence()),
            raw.traitName(),
            raw.traitValue(),
            raw.unit());
    }

    @Override
    public final void unload() {
        lock.lock();
        try {
            if (loaded) {
                doUnload();
                LOG.infof("Unloaded adapter for profile %s", profile.id());
            }
            loaded = false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isLoaded() {
        return loaded;
    }

    @Override
    public ModelProfile profile() {
        return profile;
    }

    protected abstract void doLoad();

    protected abstract List<List<RawTriple>> doExtract(List<String> texts);

    protected TrainingResult doTrain(List<TrainingExample> examples, TrainingOptions options) {
        return TrainingResult.notImplemented("Training not supported for backend " + profile.backend());
    }

    protected void doUnload() {
    }

    /**
     * Maps a backend entity label to a canonical type. Labels that already are
     * canonical pass through; anything else becomes Factor.
     */
    protected EntityType mapEntityType(String nativeType) {
        return EntityType.fromLabel(nativeType).orElse(EntityType.FACTOR);
    }

    protected String mapRelation(String nativeRelation) {
        if (nativeRelation == null || nativeRelation.isBlank()) {
            return DEFAULT_RELATION;
        }
        return nativeRelation.trim();
    }

    protected static double clampConfidence(double confidence) {
        if (Double.isNaN(confidence)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    private void loadIfNeeded() {
        if (loaded) {
            return;
        }
        LOG.infof("Loading %s adapter for profile %s", profile.backend(), profile.id());
        try {
            doLoad();
        } catch (ModelLoadException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ModelLoadException("Failed to load model for profile " + profile.id() + ": " + e.getMessage(), e);
        }
        loaded = true;
    }
}
