package linkguard.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import linkguard.core.model.link.InvalidLinkException;
import linkguard.core.model.link.LinkLookupException;
import linkguard.core.model.link.ShortCodeExhaustedException;

/**
 * Maps domain exceptions to problem responses.
 */
@ApplicationScoped
public class LinkExceptionMappers {

    private static final Logger LOG = Logger.getLogger(LinkExceptionMappers.class);

    @ServerExceptionMapper
    public Response mapInvalidLink(InvalidLinkException e) {
        LOG.debugv("Invalid link: {0}", e.getMessage());
        return LinkProblem.toResponse(LinkProblem.badRequest(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapLinkLookup(LinkLookupException e) {
        LOG.errorv(e, "Link store failure for {0}", e.getShortCode());
        return LinkProblem.toResponse(LinkProblem.serviceUnavailable("Link storage is unavailable, retry later"));
    }

    @ServerExceptionMapper
    public Response mapShortCodeExhausted(ShortCodeExhaustedException e) {
        LOG.error(e.getMessage());
        return LinkProblem.toResponse(LinkProblem.serviceUnavailable("Could not allocate a short code, retry later"));
    }
}
