/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.integration.ai;

/**
 * Model identifier and credential for one detection call.
 *
 * @param model
 *            model identifier
 * @param apiKey
 *            credential used for the call
 * @param custom
 *            true when supplied by the caller rather than the process configuration
 */
public record ModelSelection(String model, String apiKey, boolean custom) {

    @Override
    public String toString() {
        return "ModelSelection[model=" + model + ", custom=" + custom + "]";
    }
}
