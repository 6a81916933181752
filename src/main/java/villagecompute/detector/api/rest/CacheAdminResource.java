package villagecompute.detector.api.rest;

import java.util.Map;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import villagecompute.detector.api.filters.ApiKeyRequired;
import villagecompute.detector.api.types.ApiResponseType;
import villagecompute.detector.api.types.CacheStatsType;
import villagecompute.detector.services.ResultCache;

/**
 * Administration of the in-memory result cache.
 */
@Path("/cache")
@Produces(MediaType.APPLICATION_JSON)
@ApiKeyRequired
@Tag(
        name = "Cache",
        description = "Result cache administration")
public class CacheAdminResource {

    private static final Logger LOG = Logger.getLogger(CacheAdminResource.class);

    @Inject
    ResultCache resultCache;

    @DELETE
    @Operation(
            summary = "Clear cache",
            description = "Remove every cached detection result and report how many were removed")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Cache cleared",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON)),
                    @APIResponse(
                            responseCode = "401",
                            description = "Missing or invalid credentials",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON))})
    public ApiResponseType clear() {
        int cleared = resultCache.clear();
        LOG.infof("Result cache cleared: %d entries removed", cleared);
        return ApiResponseType.ok(Map.of("cleared", cleared));
    }

    @GET
    @Path("/stats")
    @Operation(
            summary = "Cache statistics",
            description = "Current size, bound, hit and miss counts of the result cache")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Statistics returned",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = CacheStatsType.class))),
                    @APIResponse(
                            responseCode = "401",
                            description = "Missing or invalid credentials",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON))})
    public ApiResponseType stats() {
        return ApiResponseType.ok(resultCache.stats());
    }
}
