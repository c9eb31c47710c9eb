package com.face.attendance.rest;

import com.face.attendance.graph.InputSanitizer;
import com.face.attendance.rest.dto.ErrorResponse;
import com.face.attendance.rest.dto.RosterRequest;
import com.face.attendance.roster.CachingRosterProvider;
import com.face.attendance.roster.InMemoryRosterProvider;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.Set;
import java.util.TreeSet;

/**
 * Maintains the in-process class rosters used to restrict matching.
 */
@Path("/api/v1/classes/{classId}/roster")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Roster", description = "Manage which identities belong to a class")
public class RosterResource {

    private final InMemoryRosterProvider source;
    private final CachingRosterProvider cache;

    @Inject
    public RosterResource(InMemoryRosterProvider source, CachingRosterProvider cache) {
        this.source = source;
        this.cache = cache;
    }

    @GET
    @Operation(summary = "List the roster of a class")
    public Response get(@PathParam("classId") String classId) {
        try {
            InputSanitizer.validateIdentifier("classId", classId);
            Set<String> roster = new TreeSet<>(cache.rosterFor(classId));
            return Response.ok(roster).build();
        } catch (IllegalArgumentException e) {
            return badRequest(e, classId);
        }
    }

    @POST
    @Operation(summary = "Add identities to the roster of a class")
    public Response add(@PathParam("classId") String classId, RosterRequest request) {
        try {
            InputSanitizer.validateIdentifier("classId", classId);
            request.identityIds().forEach(id -> InputSanitizer.validateIdentifier("identityId", id));
            source.enrollAll(classId, request.identityIds());
            cache.invalidate(classId);
            return Response.ok(new TreeSet<>(cache.rosterFor(classId))).build();
        } catch (IllegalArgumentException e) {
            return badRequest(e, classId);
        }
    }

    @DELETE
    @Path("/{identityId}")
    @Operation(summary = "Remove an identity from the roster of a class")
    public Response remove(@PathParam("classId") String classId, @PathParam("identityId") String identityId) {
        try {
            InputSanitizer.validateIdentifier("classId", classId);
            InputSanitizer.validateIdentifier("identityId", identityId);
            boolean removed = source.unenroll(classId, identityId);
            cache.invalidate(classId);
            return removed ? Response.noContent().build()
                    : Response.status(Response.Status.NOT_FOUND)
                    .entity(ErrorResponse.notFound(identityId + " is not on the roster of " + classId,
                            "/api/v1/classes/" + classId + "/roster/" + identityId))
                    .build();
        } catch (IllegalArgumentException e) {
            return badRequest(e, classId);
        }
    }

    private static Response badRequest(IllegalArgumentException e, String classId) {
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(ErrorResponse.badRequest(e.getMessage(), "/api/v1/classes/" + classId + "/roster"))
                .build();
    }
}
