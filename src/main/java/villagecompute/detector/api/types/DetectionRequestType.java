/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.api.types;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Size;

/**
 * Inbound single-item detection request.
 *
 * <p>
 * At least one of {@code title}/{@code description} must carry text. {@code model} and {@code apiKey} form a paired
 * override of the process-wide model configuration: both must be supplied together or both omitted. The request is
 * immutable and discarded once the response has been produced.
 *
 * @param title
 *            optional product title
 * @param description
 *            optional product description (may contain HTML)
 * @param model
 *            optional model identifier overriding the configured default
 * @param apiKey
 *            optional credential paired with {@code model}
 */
public record DetectionRequestType(@JsonProperty("title") @Size(
        max = 20000) String title,
        @JsonProperty("description") @Size(
                max = 50000) String description,
        @JsonProperty("model") String model, @JsonProperty("api_key") String apiKey) {

    /**
     * Convenience constructor for description-only requests using the default model.
     */
    public static DetectionRequestType ofDescription(String description) {
        return new DetectionRequestType(null, description, null, null);
    }

    @JsonIgnore
    public boolean hasModel() {
        return model != null && !model.isBlank();
    }

    @JsonIgnore
    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    @JsonIgnore
    public boolean hasOverride() {
        return hasModel() && hasApiKey();
    }

    @Override
    public String toString() {
        // api key deliberately omitted
        return "DetectionRequestType[title=" + title + ", description=" + description + ", model=" + model + "]";
    }
}
