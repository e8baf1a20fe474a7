package com.libragraph.cadence.api;

import com.libragraph.cadence.core.credential.MissingCredentialsException;
import com.libragraph.cadence.core.error.ConfigurationException;
import com.libragraph.cadence.core.error.ResourceNotFoundException;
import com.libragraph.cadence.core.error.ValidationException;
import com.libragraph.cadence.core.oauth.ExpiredCredentialsException;
import com.libragraph.cadence.core.oauth.InvalidGrantException;
import com.libragraph.cadence.core.oauth.InvalidStateException;
import com.libragraph.cadence.core.oauth.TokenExchangeException;
import com.libragraph.cadence.core.scheduler.JobConflictException;
import com.libragraph.cadence.core.scheduler.UnknownWorkFunctionException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Single translation point from domain exceptions to HTTP. Caller mistakes and
 * authorization problems get their message back; anything else is logged and
 * answered with a generic 500.
 */
@Provider
public class ApiExceptionMapper implements ExceptionMapper<RuntimeException> {

    private static final Logger log = Logger.getLogger(ApiExceptionMapper.class);

    static final String GENERIC_MESSAGE = "Internal error; see server log";

    @Override
    public Response toResponse(RuntimeException e) {
        if (e instanceof WebApplicationException wae) {
            return wae.getResponse();
        }
        int status = statusFor(e);
        if (status >= 500) {
            log.errorf(e, "Request failed: %s", e.getMessage());
        } else {
            log.debugf("Request rejected (%d): %s", status, e.getMessage());
        }
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(toBody(e, status))
                .build();
    }

    static int statusFor(Throwable e) {
        if (e instanceof ValidationException) return 400;
        if (e instanceof InvalidStateException) return 400;
        if (e instanceof MissingCredentialsException) return 400;
        if (e instanceof ConfigurationException) return 500;
        if (e instanceof InvalidGrantException) return 401;
        if (e instanceof ExpiredCredentialsException) return 401;
        if (e instanceof TokenExchangeException) return 502;
        if (e instanceof ResourceNotFoundException) return 404;
        if (e instanceof JobConflictException) return 409;
        if (e instanceof UnknownWorkFunctionException) return 400;
        // DecryptionException and anything unexpected
        return 500;
    }

    static ErrorResponse toBody(Throwable e, int status) {
        List<String> fields = e instanceof ValidationException ve ? ve.fields() : List.of();
        String message = status >= 500 && !(e instanceof TokenExchangeException) ? GENERIC_MESSAGE : e.getMessage();
        return new ErrorResponse(errorCode(e), message, fields);
    }

    private static String errorCode(Throwable e) {
        String name = e.getClass().getSimpleName();
        return name.endsWith("Exception") ? name.substring(0, name.length() - "Exception".length()) : name;
    }
}
