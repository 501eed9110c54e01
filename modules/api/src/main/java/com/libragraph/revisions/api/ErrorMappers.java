package com.libragraph.revisions.api;

import com.libragraph.revisions.api.model.ErrorResponse;
import com.libragraph.revisions.core.error.ConsistencyException;
import com.libragraph.revisions.core.error.ResourceConflictException;
import com.libragraph.revisions.core.error.ResourceNotFoundException;
import com.libragraph.revisions.core.error.ValidationException;
import com.libragraph.revisions.core.storage.BlobNotFoundException;
import com.libragraph.revisions.core.storage.StorageException;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

/**
 * Maps the error taxonomy onto HTTP statuses with a JSON body.
 */
public class ErrorMappers {

    private static final Logger log = Logger.getLogger(ErrorMappers.class);

    @ServerExceptionMapper
    public Response notFound(ResourceNotFoundException e) {
        return error(Response.Status.NOT_FOUND, new ErrorResponse("not_found", e.getMessage()));
    }

    @ServerExceptionMapper
    public Response blobNotFound(BlobNotFoundException e) {
        return error(Response.Status.NOT_FOUND, new ErrorResponse("not_found", e.getMessage()));
    }

    @ServerExceptionMapper
    public Response conflict(ResourceConflictException e) {
        return error(Response.Status.CONFLICT, new ErrorResponse("conflict", e.getMessage()));
    }

    @ServerExceptionMapper
    public Response validation(ValidationException e) {
        return error(422, new ErrorResponse("validation_error", e.getMessage(), e.violations()));
    }

    @ServerExceptionMapper
    public Response badRequest(BadRequestException e) {
        return error(Response.Status.BAD_REQUEST, new ErrorResponse("bad_request", e.getMessage()));
    }

    @ServerExceptionMapper
    public Response storage(StorageException e) {
        log.warnf("Storage unavailable: %s", e.getMessage());
        return error(Response.Status.SERVICE_UNAVAILABLE,
                new ErrorResponse("storage_unavailable", "Storage backend unavailable, retry later"));
    }

    @ServerExceptionMapper
    public Response consistency(ConsistencyException e) {
        // Already logged with document/version/key where it was raised
        return error(Response.Status.INTERNAL_SERVER_ERROR,
                new ErrorResponse("consistency_error", e.getMessage()));
    }

    private static Response error(Response.Status status, ErrorResponse body) {
        return error(status.getStatusCode(), body);
    }

    private static Response error(int status, ErrorResponse body) {
        return Response.status(status).type(MediaType.APPLICATION_JSON).entity(body).build();
    }
}
