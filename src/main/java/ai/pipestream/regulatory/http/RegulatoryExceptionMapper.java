package ai.pipestream.regulatory.http;

import ai.pipestream.regulatory.exception.EntityNotFoundException;
import ai.pipestream.regulatory.exception.IllegalStatusTransitionException;
import ai.pipestream.regulatory.exception.IntegrityException;
import ai.pipestream.regulatory.exception.RegulatoryException;
import ai.pipestream.regulatory.exception.ReleaseException;
import ai.pipestream.regulatory.exception.StaleVersionException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Maps pipeline errors to HTTP statuses by error code.
 */
@Provider
public class RegulatoryExceptionMapper implements ExceptionMapper<RegulatoryException> {

    private static final Logger LOG = Logger.getLogger(RegulatoryExceptionMapper.class);

    @Override
    public Response toResponse(RegulatoryException e) {
        int status = statusFor(e.getErrorCode());
        if (status >= 500) {
            LOG.errorf(e, "Request failed: %s", e.getMessage());
        } else {
            LOG.debugf("Request rejected: %s", e.getMessage());
        }
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(e.getErrorCode(), e.getOperation(), e.getMessage()))
                .build();
    }

    static int statusFor(String errorCode) {
        if (errorCode == null) {
            return 500;
        }
        return switch (errorCode) {
            case EntityNotFoundException.CODE -> 404;
            case IllegalStatusTransitionException.CODE, StaleVersionException.CODE, ReleaseException.CODE -> 409;
            case IntegrityException.CODE -> 503;
            default -> 500;
        };
    }
}
