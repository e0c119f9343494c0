package io.github.casevault.security;

import io.github.casevault.api.Credentials;
import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.ext.Provider;
import java.io.IOException;
import org.jboss.logging.Logger;

@Provider
@Priority(Priorities.AUTHENTICATION - 1)
public class RequestLoggingFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(RequestLoggingFilter.class);

    @Override
    public void filter(ContainerRequestContext requestContext) throws IOException {
        String method = requestContext.getMethod();
        String path = requestContext.getUriInfo().getPath();
        boolean hasCredential = Credentials.fromRequest(requestContext) != null;

        // Never log the credential itself.
        LOG.debugf("Incoming request: %s %s, credential present: %b", method, path, hasCredential);
    }
}
