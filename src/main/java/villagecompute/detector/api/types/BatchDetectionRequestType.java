/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.api.types;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound batch detection request.
 *
 * <p>
 * Accepts either structured {@code items} or the plain {@code descriptions} list; when both are present the structured
 * items come first. The optional {@code model}/{@code apiKey} override is shared by every item.
 *
 * @param items
 *            title/description pairs
 * @param descriptions
 *            description-only entries
 * @param model
 *            optional shared model override
 * @param apiKey
 *            optional shared credential paired with {@code model}
 */
public record BatchDetectionRequestType(@JsonProperty("items") List<BatchItemType> items,
        @JsonProperty("descriptions") List<String> descriptions, @JsonProperty("model") String model,
        @JsonProperty("api_key") String apiKey) {

    /**
     * Builds a batch of description-only items using the default model.
     */
    public static BatchDetectionRequestType ofDescriptions(List<String> descriptions) {
        return new BatchDetectionRequestType(null, descriptions, null, null);
    }

    /**
     * Flattens {@code items} and {@code descriptions} into per-item detection requests, in input order, each carrying
     * the shared override.
     */
    public List<DetectionRequestType> toRequests() {
        List<DetectionRequestType> requests = new ArrayList<>();
        if (items != null) {
            for (BatchItemType item : items) {
                requests.add(item == null ? new DetectionRequestType(null, null, model, apiKey)
                        : new DetectionRequestType(item.title(), item.description(), model, apiKey));
            }
        }
        if (descriptions != null) {
            for (String description : descriptions) {
                requests.add(new DetectionRequestType(null, description, model, apiKey));
            }
        }
        return requests;
    }

    @Override
    public String toString() {
        return "BatchDetectionRequestType[items=" + (items == null ? 0 : items.size()) + ", descriptions="
                + (descriptions == null ? 0 : descriptions.size()) + ", model=" + model + "]";
    }
}
