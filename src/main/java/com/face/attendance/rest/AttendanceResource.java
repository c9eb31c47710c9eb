package com.face.attendance.rest;

import com.face.attendance.api.AttendanceEngine;
import com.face.attendance.api.AttendanceSummary;
import com.face.attendance.api.ErrorCode;
import com.face.attendance.api.SubmissionRequest;
import com.face.attendance.api.SubmissionResult;
import com.face.attendance.core.model.AttendanceRecord;
import com.face.attendance.rest.dto.AttendanceRecordResponse;
import com.face.attendance.rest.dto.ErrorResponse;
import com.face.attendance.rest.dto.SubmissionResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * REST resource for marking and reading class attendance.
 */
@Path("/api/v1/classes/{classId}/attendance")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Attendance", description = "Mark attendance from group photos and read attendance rows")
public class AttendanceResource {
    private static final Logger log = LoggerFactory.getLogger(AttendanceResource.class);
    static final String RETRY_AFTER_SECONDS = "5";

    private final AttendanceEngine engine;

    @Inject
    public AttendanceResource(AttendanceEngine engine) {
        this.engine = engine;
    }

    /**
     * Marks attendance from one group photo.
     *
     * POST /api/v1/classes/{classId}/attendance/face
     */
    @POST
    @Path("/face")
    @Consumes(MediaType.APPLICATION_OCTET_STREAM)
    @Operation(summary = "Mark attendance from a group photo",
            description = "Detects every face in the photo, matches each against enrolled signatures and " +
                    "marks the matched students present. Rostered students not matched are marked absent.")
    @APIResponse(responseCode = "200", description = "Photo processed (zero recognitions is still a success)")
    @APIResponse(responseCode = "400", description = "Invalid image, date or threshold")
    @APIResponse(responseCode = "503", description = "Detector or signature registry unavailable; retry later")
    public Response submit(
            @Parameter(description = "Class identifier") @PathParam("classId") String classId,
            @Parameter(description = "Session date (ISO-8601), defaults to today") @QueryParam("date") String date,
            @Parameter(description = "Similarity threshold override in [0,1]") @QueryParam("threshold") Double threshold,
            @HeaderParam("X-Actor-Id") String actorId,
            byte[] image) {
        String path = "/api/v1/classes/" + classId + "/attendance/face";
        try {
            SubmissionRequest request = new SubmissionRequest(classId, parseDate(date), image, threshold, actorId);
            SubmissionResult result = engine.submit(request);

            if (result.isSuccess()) {
                return Response.ok(SubmissionResponse.from(result)).build();
            }
            return failure(result.getErrorCode(), result.getMessage(), path);

        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (Exception e) {
            log.error("submit.failed classId={} error={}", classId, e.getMessage(), e);
            return internalError(path);
        }
    }

    /**
     * Lists attendance rows of a class, optionally for one date.
     *
     * GET /api/v1/classes/{classId}/attendance?date=
     */
    @GET
    @Operation(summary = "Get attendance rows", description = "Returns the rows of one session, or of all sessions when no date is given.")
    @APIResponse(responseCode = "200", description = "Rows returned")
    @APIResponse(responseCode = "400", description = "Invalid class id or date")
    public Response getAttendance(
            @Parameter(description = "Class identifier") @PathParam("classId") String classId,
            @Parameter(description = "Session date (ISO-8601)") @QueryParam("date") String date) {
        String path = "/api/v1/classes/" + classId + "/attendance";
        try {
            List<AttendanceRecord> rows = date == null || date.isBlank()
                    ? engine.getAttendance(classId)
                    : engine.getAttendance(classId, parseDate(date));
            return Response.ok(rows.stream().map(AttendanceRecordResponse::from).toList()).build();
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (Exception e) {
            log.error("getAttendance.failed classId={} error={}", classId, e.getMessage(), e);
            return internalError(path);
        }
    }

    /**
     * GET /api/v1/classes/{classId}/attendance/summary
     */
    @GET
    @Path("/summary")
    @Operation(summary = "Summarize attendance", description = "Totals of a class across all recorded sessions.")
    @APIResponse(responseCode = "200", description = "Summary returned")
    public Response summary(@Parameter(description = "Class identifier") @PathParam("classId") String classId) {
        String path = "/api/v1/classes/" + classId + "/attendance/summary";
        try {
            AttendanceSummary summary = engine.summarize(classId);
            return Response.ok(summary).build();
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (Exception e) {
            log.error("summary.failed classId={} error={}", classId, e.getMessage(), e);
            return internalError(path);
        }
    }

    static LocalDate parseDate(String date) {
        if (date == null || date.isBlank()) {
            return LocalDate.now();
        }
        try {
            return LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date '" + date + "', expected yyyy-MM-dd", e);
        }
    }

    static Response failure(ErrorCode errorCode, String message, String path) {
        ErrorResponse error = ErrorResponse.failure(errorCode, message, path);
        Response.ResponseBuilder response = Response.status(error.status()).entity(error);
        if (error.retryable()) {
            response.header("Retry-After", RETRY_AFTER_SECONDS);
        }
        return response.build();
    }

    static Response internalError(String path) {
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(ErrorResponse.internalError("An internal error occurred. Check server logs for details.", path))
                .build();
    }
}
