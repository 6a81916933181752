/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.integration.ai;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;

import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.exception.RateLimitException;

import villagecompute.detector.exceptions.ModelCallException;
import villagecompute.detector.exceptions.ModelFailureKind;

/**
 * Maps exceptions raised by the LangChain4j Anthropic client onto {@link ModelFailureKind}.
 *
 * <p>
 * <b>Classification order</b> (first match along the cause chain wins):
 * <ol>
 * <li>{@link ModelCallException}: its own kind</li>
 * <li>LangChain4j typed exceptions: authentication → AUTH, rate limit → QUOTA, model not found →
 * MODEL_NOT_FOUND</li>
 * <li>{@link HttpException} status: 401/403 → AUTH, 429 → QUOTA, 404 → MODEL_NOT_FOUND</li>
 * <li>Anthropic error types in the message ({@code authentication_error}, {@code rate_limit_error},
 * {@code not_found_error}, credit balance exhaustion)</li>
 * </ol>
 * Anything else (timeouts, I/O errors, 5xx, open circuits, unknown failures) is TRANSIENT.
 */
public final class ModelFailureClassifier {

    private static final int MAX_CAUSE_DEPTH = 10;

    private ModelFailureClassifier() {
    }

    /**
     * Classifies a failure.
     *
     * @param failure
     *            exception thrown by the model call
     * @return failure kind, never null
     */
    public static ModelFailureKind classify(Throwable failure) {
        Throwable current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            ModelFailureKind kind = classifyOne(current);
            if (kind != null) {
                return kind;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return ModelFailureKind.TRANSIENT;
    }

    /**
     * Wraps a failure into a {@link ModelCallException}, keeping an existing one unchanged.
     *
     * @param failure
     *            exception thrown by the model call
     * @param model
     *            model identifier, used in the message
     * @return classified exception
     */
    public static ModelCallException toModelCallException(Throwable failure, String model) {
        if (failure instanceof ModelCallException modelCallException) {
            return modelCallException;
        }
        ModelFailureKind kind = classify(failure);
        return new ModelCallException(kind, describe(kind, failure, model), failure);
    }

    private static ModelFailureKind classifyOne(Throwable t) {
        if (t instanceof ModelCallException modelCallException) {
            return modelCallException.getKind();
        }
        if (t instanceof AuthenticationException) {
            return ModelFailureKind.AUTH;
        }
        if (t instanceof RateLimitException) {
            return ModelFailureKind.QUOTA;
        }
        if (t instanceof ModelNotFoundException) {
            return ModelFailureKind.MODEL_NOT_FOUND;
        }
        if (t instanceof HttpException httpException) {
            ModelFailureKind kind = fromStatus(httpException.statusCode());
            if (kind != null) {
                return kind;
            }
        }
        if (t instanceof IOException || t instanceof UncheckedIOException) {
            return ModelFailureKind.TRANSIENT;
        }
        return fromMessage(t.getMessage());
    }

    static ModelFailureKind fromStatus(int status) {
        return switch (status) {
            case 401, 403 -> ModelFailureKind.AUTH;
            case 429 -> ModelFailureKind.QUOTA;
            case 404 -> ModelFailureKind.MODEL_NOT_FOUND;
            default -> null;
        };
    }

    private static ModelFailureKind fromMessage(String message) {
        if (message == null) {
            return null;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("authentication_error") || lower.contains("permission_error")
                || lower.contains("invalid x-api-key")) {
            return ModelFailureKind.AUTH;
        }
        if (lower.contains("rate_limit_error") || lower.contains("credit balance is too low")) {
            return ModelFailureKind.QUOTA;
        }
        if (lower.contains("not_found_error") && lower.contains("model")) {
            return ModelFailureKind.MODEL_NOT_FOUND;
        }
        return null;
    }

    private static String describe(ModelFailureKind kind, Throwable failure, String model) {
        return switch (kind) {
            case AUTH -> "Invalid credentials or insufficient permissions for model '" + model + "'.";
            case QUOTA -> "Quota or rate limit exceeded for model '" + model + "'. Please retry later.";
            case MODEL_NOT_FOUND -> "Model '" + model + "' not found or not available.";
            case PARSE -> "Model response could not be parsed";
            case TRANSIENT -> "Model call failed: " + failure.getClass().getSimpleName();
        };
    }
}
