package org.harvest.traits.adapter;

import java.net.URI;
import java.util.concurrent.TimeUnit;

import org.eclipse.microprofile.rest.client.RestClientBuilder;
import org.harvest.exception.ConfigurationException;
import org.harvest.traits.adapter.allennlp.AllenNlpAdapter;
import org.harvest.traits.adapter.allennlp.SrlPredictorClient;
import org.harvest.traits.adapter.huggingface.HuggingFaceAdapter;
import org.harvest.traits.adapter.huggingface.HuggingFaceInferenceClient;
import org.harvest.traits.adapter.lasuie.LasUIEAdapter;
import org.harvest.traits.adapter.spacy.SpacyAdapter;
import org.harvest.traits.adapter.spacy.SpacyNlpClient;
import org.harvest.traits.profile.ModelProfile;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Creates adapters for a backend tag.
 *
 * <p>HTTP backed adapters get a REST client built from the profile's
 * {@code server-url}, {@code connect-timeout-ms} and {@code read-timeout-ms}
 * parameters:
 * <pre>
 * trait-extraction.profiles.spacy_bio.backend=spacy
 * trait-extraction.profiles.spacy_bio.params.server-url=http://localhost:8010
 * </pre>
 */
@ApplicationScoped
public class AdapterFactory {

    private static final Logger LOG = Logger.getLogger(AdapterFactory.class);

    static final String DEFAULT_SPACY_URL = "http://localhost:8010";
    static final String DEFAULT_HUGGINGFACE_URL = "https://api-inference.huggingface.co";
    static final String DEFAULT_ALLENNLP_URL = "http://localhost:8020";

    private final ExternalProcessRunner processRunner = new ExternalProcessRunner();

    /**
     * Creates a new, unloaded adapter.
     *
     * @param backendTag backend tag from the profile
     * @param profile profile the adapter serves
     * @return the adapter
     * @throws ConfigurationException if the tag names no known backend
     */
    public ExtractionAdapter create(String backendTag, ModelProfile profile) {
        final Backend backend = Backend.fromTag(backendTag);
        LOG.debugf("Creating %s adapter for profile %s", backend.tag(), profile.id());

        return switch (backend) {
            case SPACY -> new SpacyAdapter(profile,
                restClient(SpacyNlpClient.class, profile, DEFAULT_SPACY_URL),
                new ScriptTrainer(processRunner));
            case HUGGINGFACE -> new HuggingFaceAdapter(profile,
                restClient(HuggingFaceInferenceClient.class, profile, DEFAULT_HUGGINGFACE_URL),
                new ScriptTrainer(processRunner));
            case LASUIE -> new LasUIEAdapter(profile, processRunner);
            case ALLENNLP -> new AllenNlpAdapter(profile,
                restClient(SrlPredictorClient.class, profile, DEFAULT_ALLENNLP_URL));
        };
    }

    private static <T> T restClient(Class<T> clientType, ModelProfile profile, String defaultUrl) {
        final String url = profile.param("server-url", defaultUrl);
        try {
            return RestClientBuilder.newBuilder()
                .baseUri(URI.create(url))
                .connectTimeout(profile.intParam("connect-timeout-ms", 30_000), TimeUnit.MILLISECONDS)
                .readTimeout(profile.intParam("read-timeout-ms", 300_000), TimeUnit.MILLISECONDS)
                .build(clientType);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid server-url for profile " + profile.id() + ": " + url, e);
        }
    }
}
