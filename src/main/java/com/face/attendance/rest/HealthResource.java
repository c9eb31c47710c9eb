package com.face.attendance.rest;

import com.face.attendance.api.AttendanceEngine;
import com.face.attendance.health.HealthStatus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * Aggregated health of the engine and its backends. DOWN maps to 503.
 */
@Path("/api/v1/health")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Health")
public class HealthResource {

    private final AttendanceEngine engine;

    @Inject
    public HealthResource(AttendanceEngine engine) {
        this.engine = engine;
    }

    @GET
    @Operation(summary = "Engine health")
    @APIResponse(responseCode = "200", description = "UP or DEGRADED")
    @APIResponse(responseCode = "503", description = "DOWN")
    public Response health() {
        HealthStatus status = engine.health();
        Response.Status code = status.isDown() ? Response.Status.SERVICE_UNAVAILABLE : Response.Status.OK;
        return Response.status(code).entity(status).build();
    }
}
