package com.face.attendance.rest;

import com.face.attendance.api.AttendanceEngine;
import com.face.attendance.api.EnrollmentRequest;
import com.face.attendance.api.EnrollmentResult;
import com.face.attendance.api.ErrorCode;
import com.face.attendance.rest.dto.EnrollmentResponse;
import com.face.attendance.rest.dto.ErrorResponse;
import com.face.attendance.registry.RegistryUnavailableException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REST resource for enrolling and removing face signatures.
 */
@Path("/api/v1/identities/{identityId}/signature")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Enrollment", description = "Enroll, replace and remove face signatures")
public class EnrollmentResource {
    private static final Logger log = LoggerFactory.getLogger(EnrollmentResource.class);

    private final AttendanceEngine engine;

    @Inject
    public EnrollmentResource(AttendanceEngine engine) {
        this.engine = engine;
    }

    /**
     * PUT /api/v1/identities/{identityId}/signature
     */
    @PUT
    @Consumes(MediaType.APPLICATION_OCTET_STREAM)
    @Operation(summary = "Enroll a face signature",
            description = "Detects the largest face in the portrait and stores its signature, replacing any previous one.")
    @APIResponse(responseCode = "200", description = "Signature stored")
    @APIResponse(responseCode = "400", description = "Invalid image or no face found")
    @APIResponse(responseCode = "503", description = "Detector or registry unavailable; retry later")
    public Response enroll(
            @Parameter(description = "Identity identifier") @PathParam("identityId") String identityId,
            @HeaderParam("X-Actor-Id") String actorId,
            byte[] image) {
        String path = "/api/v1/identities/" + identityId + "/signature";
        try {
            EnrollmentResult result = engine.enroll(new EnrollmentRequest(identityId, image, actorId));
            if (result.success()) {
                return Response.ok(EnrollmentResponse.from(result)).build();
            }
            return AttendanceResource.failure(result.errorCode(), result.message(), path);
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (Exception e) {
            log.error("enroll.failed identityId={} error={}", identityId, e.getMessage(), e);
            return AttendanceResource.internalError(path);
        }
    }

    /**
     * DELETE /api/v1/identities/{identityId}/signature
     */
    @DELETE
    @Operation(summary = "Remove a face signature")
    @APIResponse(responseCode = "204", description = "Signature removed")
    @APIResponse(responseCode = "404", description = "No signature enrolled for this identity")
    public Response remove(
            @Parameter(description = "Identity identifier") @PathParam("identityId") String identityId,
            @HeaderParam("X-Actor-Id") String actorId) {
        String path = "/api/v1/identities/" + identityId + "/signature";
        try {
            if (engine.removeEnrollment(identityId, actorId)) {
                return Response.noContent().build();
            }
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(ErrorResponse.notFound("No signature enrolled for " + identityId, path))
                    .build();
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (RegistryUnavailableException e) {
            return AttendanceResource.failure(ErrorCode.REGISTRY_UNAVAILABLE, e.getMessage(), path);
        } catch (Exception e) {
            log.error("removeEnrollment.failed identityId={} error={}", identityId, e.getMessage(), e);
            return AttendanceResource.internalError(path);
        }
    }
}
