package org.harvest.traits.profile;

import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable description of an extraction model: which backend runs it and
 * with which parameters.
 *
 * @param id profile identifier used by callers and the registry
 * @param name human readable name
 * @param description free text description
 * @param backend backend tag resolved by the adapter factory
 * @param params backend specific parameters
 */
public record ModelProfile(
    @NotNull String id,
    @NotNull String name,
    @NotNull String description,
    @NotNull String backend,
    @NotNull Map<String, String> params
) {

    public ModelProfile {
        params = Map.copyOf(params);
    }

    public static ModelProfile of(String id, String backend, Map<String, String> params) {
        return new ModelProfile(id, id, "", backend, params);
    }

    @Nullable
    public String param(String key) {
        final String value = params.get(key);
        return value == null || value.isBlank() ? null : value;
    }

    public String param(String key, String defaultValue) {
        final String value = param(key);
        return value != null ? value : defaultValue;
    }

    public int intParam(String key, int defaultValue) {
        final String value = param(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "Profile '" + id + "' parameter '" + key + "' is not an integer: " + value, e);
        }
    }

    public double doubleParam(String key, double defaultValue) {
        final String value = param(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "Profile '" + id + "' parameter '" + key + "' is not a number: " + value, e);
        }
    }

    public boolean booleanParam(String key, boolean defaultValue) {
        final String value = param(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }

    public ModelProfileSummary summary() {
        return new ModelProfileSummary(id, name, description, backend);
    }
}
