/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response envelope shared by all detection endpoints: {@code {"result": "OK"|"PARTIAL"|"Failed", "data": ...,
 * "errors": [...]}}.
 *
 * @param result
 *            overall outcome marker
 * @param data
 *            payload, absent on failure
 * @param errors
 *            error list, absent on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponseType(@JsonProperty("result") String result, @JsonProperty("data") Object data,
        @JsonProperty("errors") List<ErrorEnvelopeType> errors) {

    public static final String OK = "OK";
    public static final String PARTIAL = "PARTIAL";
    public static final String FAILED = "Failed";

    public static ApiResponseType ok(Object data) {
        return new ApiResponseType(OK, data, null);
    }

    public static ApiResponseType failed(ErrorEnvelopeType error) {
        return new ApiResponseType(FAILED, null, List.of(error));
    }

    public static ApiResponseType failed(ErrorCode code, String message) {
        return failed(new ErrorEnvelopeType(code, message));
    }

    /**
     * Wraps a batch outcome, mapping its status onto the envelope marker.
     */
    public static ApiResponseType batch(BatchResultType batch) {
        String marker = switch (batch.status()) {
            case COMPLETE -> OK;
            case PARTIAL -> PARTIAL;
            case FAILED -> FAILED;
        };
        return new ApiResponseType(marker, batch, null);
    }
}
