package org.harvest.traits.remote;

import org.eclipse.microprofile.config.ConfigProvider;
import org.eclipse.microprofile.rest.client.annotation.ClientHeaderParam;
import org.eclipse.microprofile.rest.client.annotation.RegisterProvider;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;

/**
 * Client for the triple extraction endpoint of a peer server.
 *
 * <pre>
 * quarkus.rest-client."trait-extraction".url=http://localhost:8000
 * quarkus.rest-client."trait-extraction".connect-timeout=30000
 * quarkus.rest-client."trait-extraction".read-timeout=300000
 * </pre>
 */
@RegisterRestClient(configKey = "trait-extraction")
@RegisterProvider(RemoteExtractionClientExceptionMapper.class)
@ClientHeaderParam(name = "Authorization", value = "{lookupAuth}")
public interface RemoteExtractionClient {

    @POST
    @Path("/extract_triples")
    ExtractTriplesResponse extractTriples(ExtractTriplesRequest request);

    default String lookupAuth() {
        return ConfigProvider.getConfig()
            .getOptionalValue("trait-extraction.api-key", String.class)
            .filter(key -> !key.isBlank())
            .map(key -> "Bearer " + key)
            .orElse(null);
    }
}
