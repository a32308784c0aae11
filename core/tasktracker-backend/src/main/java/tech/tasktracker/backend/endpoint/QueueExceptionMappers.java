package tech.tasktracker.backend.endpoint;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;
import tech.tasktracker.queue.QueueTransportException;
import tech.tasktracker.queue.QueueUnavailableException;

/**
 * Maps queue client failures to HTTP responses.
 */
public final class QueueExceptionMappers {

    private static final Logger LOG = Logger.getLogger(QueueExceptionMappers.class);

    private QueueExceptionMappers() {
    }

    @Provider
    public static class UnavailableMapper implements ExceptionMapper<QueueUnavailableException> {

        @Override
        public Response toResponse(QueueUnavailableException exception) {
            return Response
                .status(Response.Status.SERVICE_UNAVAILABLE)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(exception.getMessage()))
                .build();
        }
    }

    @Provider
    public static class TransportMapper implements ExceptionMapper<QueueTransportException> {

        @Override
        public Response toResponse(QueueTransportException exception) {
            LOG.warnf("Queue transport failure for queue [%s]: %s", exception.getQueueName(), exception.getMessage());
            return Response
                .status(Response.Status.BAD_GATEWAY)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(exception.getMessage()))
                .build();
        }
    }
}
