/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.api.types;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one batch slot: either attributes or an error, never both.
 *
 * @param index
 *            position of the item in the request
 * @param attributes
 *            extracted attributes, null on error
 * @param cache
 *            true when served from the result cache
 * @param source
 *            where the attributes came from, null on error
 * @param error
 *            error envelope, null on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchItemResultType(@JsonProperty("index") int index, @JsonProperty("attributes") AttributeSet attributes,
        @JsonProperty("cache") boolean cache, @JsonProperty("source") ResultSource source,
        @JsonProperty("error") ErrorEnvelopeType error) {

    public static BatchItemResultType success(int index, DetectionResultType result) {
        return new BatchItemResultType(index, result.attributes(), result.cache(), result.source(), null);
    }

    public static BatchItemResultType failure(int index, ErrorEnvelopeType error) {
        return new BatchItemResultType(index, null, false, null, error);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }
}
