package villagecompute.detector.api.rest;

import java.util.List;
import java.util.Map;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.detector.api.types.ApiResponseType;
import villagecompute.detector.api.types.ErrorCode;
import villagecompute.detector.api.types.HsCodeItemType;
import villagecompute.detector.api.types.HsCodeValidationType;
import villagecompute.detector.services.HsCodeCatalog;

/**
 * Lookup endpoints over the bundled HS code catalogue.
 */
@Path("/hscode")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "HS Codes",
        description = "Harmonized System code search and validation")
public class HsCodeResource {

    static final int MAX_LIMIT = 100;

    @Inject
    HsCodeCatalog hsCodeCatalog;

    @GET
    @Path("/search")
    @Operation(
            summary = "Search HS codes",
            description = "Find catalogue entries whose code or description contains the keyword")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Matching entries",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON)),
                    @APIResponse(
                            responseCode = "400",
                            description = "Missing keyword or invalid limit",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON))})
    public Response search(@QueryParam("q") String keyword, @QueryParam("limit") @DefaultValue("10") int limit) {
        if (keyword == null || keyword.isBlank()) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ApiResponseType.failed(ErrorCode.VALIDATION_ERROR, "Query parameter 'q' is required"))
                    .build();
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            return Response.status(Response.Status.BAD_REQUEST).entity(ApiResponseType
                    .failed(ErrorCode.VALIDATION_ERROR, "Parameter 'limit' must be between 1 and " + MAX_LIMIT))
                    .build();
        }
        List<HsCodeItemType> items = hsCodeCatalog.search(keyword, limit);
        return Response.ok(ApiResponseType.ok(Map.of("items", items, "total", items.size()))).build();
    }

    @GET
    @Path("/{code}/validate")
    @Operation(
            summary = "Validate HS code",
            description = "Check a code against the catalogue and suggest codes under the same heading")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Validation outcome",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = HsCodeValidationType.class)))})
    public ApiResponseType validate(@PathParam("code") String code) {
        return ApiResponseType.ok(hsCodeCatalog.validate(code));
    }
}
