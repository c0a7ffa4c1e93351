package ai.pipestream.regulatory.http;

import ai.pipestream.regulatory.entity.RuleRelease;
import ai.pipestream.regulatory.exception.ReleaseException;
import ai.pipestream.regulatory.release.ReleaseVerifier;
import ai.pipestream.regulatory.release.RuleReleaser;
import ai.pipestream.regulatory.release.VerificationResult;
import io.smallrye.common.annotation.Blocking;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

@Path("/releases")
@Produces(MediaType.APPLICATION_JSON)
public class ReleaseResource {

    @Inject
    RuleReleaser releaser;

    @Inject
    ReleaseVerifier verifier;

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Blocking
    @Transactional(dontRollbackOn = ReleaseException.class)
    public Response release(ReleaseRequest request) {
        if (request == null || request.releasedBy() == null || request.releasedBy().isBlank()) {
            throw new BadRequestException("releasedBy is required");
        }
        RuleRelease release = request.ruleIds() == null || request.ruleIds().isEmpty()
                ? releaser.releaseAllApproved(request.releasedBy())
                : releaser.release(request.ruleIds(), request.releasedBy());
        return Response.status(Response.Status.CREATED).entity(ReleaseReceipt.of(release)).build();
    }

    @GET
    @Path("/{version}/verify")
    @Blocking
    public VerificationResult verify(@PathParam("version") String version) {
        return verifier.verify(version);
    }
}
