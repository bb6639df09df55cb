package linkguard.adapter.in.rest;

import java.net.URI;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;

import linkguard.adapter.in.http.CallerAddressResolver;
import linkguard.adapter.in.problem.LinkProblem;
import linkguard.core.service.link.ShortLinkService;

/**
 * Follows short links.
 *
 * <p>Unknown, expired and disabled codes all answer 404 with the same body.
 */
@Path("/")
public class RedirectResource {

    private final ShortLinkService linkService;
    private final CallerAddressResolver callerAddresses;

    @Inject
    public RedirectResource(ShortLinkService linkService, CallerAddressResolver callerAddresses) {
        this.linkService = linkService;
        this.callerAddresses = callerAddresses;
    }

    @GET
    @Path("{shortCode}")
    public Uni<Response> redirect(
            @PathParam("shortCode") String shortCode,
            @HeaderParam(HttpHeaders.USER_AGENT) String userAgent,
            @HeaderParam("Forwarded") String forwarded,
            @HeaderParam("X-Forwarded-For") String xForwardedFor,
            @Context HttpServerRequest request) {
        final var remote = request != null && request.remoteAddress() != null
                ? request.remoteAddress().hostAddress()
                : null;
        final var callerAddress = callerAddresses.resolve(forwarded, xForwardedFor, remote);

        return linkService.resolve(shortCode, callerAddress, userAgent).map(url -> url.map(
                        target -> Response.status(Response.Status.FOUND)
                                .location(URI.create(target))
                                .build())
                .orElseThrow(() -> LinkProblem.linkNotFound("Short link not found or expired")));
    }
}
