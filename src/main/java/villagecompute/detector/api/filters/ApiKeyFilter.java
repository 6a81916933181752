package villagecompute.detector.api.filters;

import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;
import villagecompute.detector.api.types.ApiResponseType;
import villagecompute.detector.api.types.ErrorCode;
import villagecompute.detector.config.DetectorConfig;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

/**
 * JAX-RS filter checking the {@code X-API-Key} header on {@code @ApiKeyRequired} endpoints.
 *
 * <p>
 * <b>Execution Flow:</b>
 * <ol>
 * <li>Read the expected key from {@code detector.security.api-key}; if unset, let the request through</li>
 * <li>Compare the header against it in constant time</li>
 * <li>On mismatch or missing header: abort with 401 and an {@code AUTH_ERROR} envelope</li>
 * </ol>
 *
 * <p>
 * <b>Priority:</b> Runs at {@code Priorities.AUTHENTICATION} (1000), before any request body is processed.
 *
 * @see ApiKeyRequired annotation for usage examples
 */
@Provider
@ApiKeyRequired
@Priority(Priorities.AUTHENTICATION)
public class ApiKeyFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(ApiKeyFilter.class);

    public static final String API_KEY_HEADER = "X-API-Key";

    @Inject
    DetectorConfig detectorConfig;

    @Override
    public void filter(ContainerRequestContext requestContext) {
        Optional<String> expected = detectorConfig.securityApiKey();
        if (expected.isEmpty()) {
            return;
        }

        String provided = requestContext.getHeaderString(API_KEY_HEADER);
        if (provided == null || provided.isBlank()) {
            reject(requestContext, "Missing " + API_KEY_HEADER + " header");
            return;
        }

        if (!MessageDigest.isEqual(provided.trim().getBytes(StandardCharsets.UTF_8),
                expected.get().getBytes(StandardCharsets.UTF_8))) {
            reject(requestContext, "Invalid API key");
        }
    }

    private void reject(ContainerRequestContext requestContext, String message) {
        LOG.infof("Rejected request: path=%s reason=%s", requestContext.getUriInfo().getPath(), message);
        Response response = Response.status(Response.Status.UNAUTHORIZED).type(MediaType.APPLICATION_JSON)
                .entity(ApiResponseType.failed(ErrorCode.AUTH_ERROR, message)).build();
        requestContext.abortWith(response);
    }
}
