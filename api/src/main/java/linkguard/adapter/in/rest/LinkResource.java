package linkguard.adapter.in.rest;

import java.net.URI;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import linkguard.adapter.in.problem.LinkProblem;
import linkguard.adapter.in.rest.dto.LinkInfoResponse;
import linkguard.adapter.in.rest.dto.ShortenRequest;
import linkguard.adapter.in.rest.dto.ShortenResponse;
import linkguard.config.LinkConfig;
import linkguard.core.service.link.ShortLinkService;

/**
 * REST API for creating and inspecting short links.
 */
@Path("/api/v1")
@Produces(MediaType.APPLICATION_JSON)
public class LinkResource {

    private final ShortLinkService linkService;
    private final LinkConfig linkConfig;

    @Inject
    public LinkResource(ShortLinkService linkService, LinkConfig linkConfig) {
        this.linkService = linkService;
        this.linkConfig = linkConfig;
    }

    /**
     * Shorten a URL. Returns 201 for a new link and 200 when an existing one is reused.
     */
    @POST
    @Path("/shorten")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> shorten(ShortenRequest request) {
        if (request == null || request.url() == null) {
            return Uni.createFrom().failure(LinkProblem.badRequest("Field 'url' is required"));
        }
        return linkService.shorten(request.url(), request.expiresAt()).map(created -> {
            final var body = ShortenResponse.from(created.link(), linkConfig.baseUrl());
            if (created.reused()) {
                return Response.ok(body).build();
            }
            return Response.created(URI.create(body.shortUrl())).entity(body).build();
        });
    }

    @GET
    @Path("/info/{shortCode}")
    public Uni<Response> info(@PathParam("shortCode") String shortCode) {
        return linkService.info(shortCode).map(found -> found.map(LinkInfoResponse::from)
                .map(body -> Response.ok(body).build())
                .orElseThrow(() -> LinkProblem.linkNotFound("Short link not found")));
    }
}
