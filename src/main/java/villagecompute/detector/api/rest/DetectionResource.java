package villagecompute.detector.api.rest;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.detector.api.filters.ApiKeyRequired;
import villagecompute.detector.api.types.ApiResponseType;
import villagecompute.detector.api.types.BatchDetectionRequestType;
import villagecompute.detector.api.types.BatchResultType;
import villagecompute.detector.api.types.DetectionRequestType;
import villagecompute.detector.api.types.DetectionResultType;
import villagecompute.detector.api.types.ErrorCode;
import villagecompute.detector.exceptions.DetectionException;
import villagecompute.detector.services.BatchDetectionService;
import villagecompute.detector.services.DetectionService;

/**
 * REST endpoints for single and batch attribute detection.
 *
 * <p>
 * Successful calls return {@code {"result":"OK","data":{...}}}. Failures return
 * {@code {"result":"Failed","errors":[{"code":...,"message":...}]}} with the HTTP status of the error code:
 * <ul>
 * <li>{@code VALIDATION_ERROR}: 400</li>
 * <li>{@code AUTH_ERROR}: 401</li>
 * <li>{@code MODEL_NOT_FOUND}: 404</li>
 * <li>{@code QUOTA_ERROR}: 429</li>
 * <li>{@code INIT_ERROR}, {@code INTERNAL_ERROR}: 500</li>
 * </ul>
 * Batches that pass batch-level validation always answer 200; the envelope marker is {@code OK}, {@code PARTIAL} or
 * {@code Failed} and failing items carry their own error.
 */
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApiKeyRequired
@Tag(
        name = "Detection",
        description = "Product attribute detection operations")
public class DetectionResource {

    private static final Logger LOG = Logger.getLogger(DetectionResource.class);

    @Inject
    DetectionService detectionService;

    @Inject
    BatchDetectionService batchDetectionService;

    /**
     * Detects attributes for one product.
     *
     * @param request
     *            title and/or description, optional model override
     * @return envelope with the detection result
     */
    @POST
    @Path("/detect-country")
    @Operation(
            summary = "Detect product attributes",
            description = "Extract country of origin, size, material, brand and other attributes from a product title and description")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Attributes detected",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = DetectionResultType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid request",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON)),
                    @APIResponse(
                            responseCode = "401",
                            description = "Missing or invalid credentials",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON)),
                    @APIResponse(
                            responseCode = "404",
                            description = "Requested model not found",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON)),
                    @APIResponse(
                            responseCode = "429",
                            description = "Model quota or rate limit exceeded",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON)),
                    @APIResponse(
                            responseCode = "500",
                            description = "Server error",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON))})
    public Response detect(DetectionRequestType request) {
        try {
            DetectionResultType result = detectionService.detect(request);
            return Response.ok(ApiResponseType.ok(result)).build();
        } catch (DetectionException e) {
            return errorResponse(e);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Unexpected error during detection");
            return errorResponse(
                    new DetectionException(ErrorCode.INTERNAL_ERROR, "Unexpected error during detection", e));
        }
    }

    /**
     * Detects attributes for a batch of products.
     *
     * @param request
     *            {@code items} and/or {@code descriptions}, optional shared model override
     * @return envelope with ordered per-item results and aggregate counters
     */
    @POST
    @Path("/batch-detect")
    @Operation(
            summary = "Detect product attributes in batch",
            description = "Run detection for many products concurrently; results keep input order")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Batch processed (check result marker and per-item errors)",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = BatchResultType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid batch",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON)),
                    @APIResponse(
                            responseCode = "401",
                            description = "Missing or invalid credentials",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON)),
                    @APIResponse(
                            responseCode = "500",
                            description = "Server error",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON))})
    public Response batchDetect(BatchDetectionRequestType request) {
        try {
            BatchResultType result = batchDetectionService.detectBatch(request);
            return Response.ok(ApiResponseType.batch(result)).build();
        } catch (DetectionException e) {
            return errorResponse(e);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Unexpected error during batch detection");
            return errorResponse(
                    new DetectionException(ErrorCode.INTERNAL_ERROR, "Unexpected error during batch detection", e));
        }
    }

    static Response errorResponse(DetectionException e) {
        return Response.status(statusFor(e.getCode())).entity(ApiResponseType.failed(e.toEnvelope())).build();
    }

    static Response.Status statusFor(ErrorCode code) {
        return switch (code) {
            case VALIDATION_ERROR -> Response.Status.BAD_REQUEST;
            case AUTH_ERROR -> Response.Status.UNAUTHORIZED;
            case MODEL_NOT_FOUND -> Response.Status.NOT_FOUND;
            case QUOTA_ERROR -> Response.Status.TOO_MANY_REQUESTS;
            case INIT_ERROR, INTERNAL_ERROR -> Response.Status.INTERNAL_SERVER_ERROR;
        };
    }
}
