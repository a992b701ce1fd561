package org.harvest.traits.adapter;

import java.util.ArrayList;
import java.util.List;

import org.harvest.traits.profile.ModelProfile;

/**
 * Factory producing {@link StubExtractionAdapter}s for every backend tag.
 */
public class StubAdapterFactory extends AdapterFactory {

    public final List<StubExtractionAdapter> created = new ArrayList<>();

    @Override
    public ExtractionAdapter create(String backendTag, ModelProfile profile) {
        Backend.fromTag(backendTag);
        final StubExtractionAdapter adapter = new StubExtractionAdapter(profile);
        created.add(adapter);
        return adapter;
    }
}
