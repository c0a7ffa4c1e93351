package ai.pipestream.regulatory.http;

import ai.pipestream.regulatory.contentsync.ContentSyncAdmin;
import io.smallrye.common.annotation.Blocking;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.List;

@Path("/content-sync")
@Produces(MediaType.APPLICATION_JSON)
public class ContentSyncResource {

    @Inject
    ContentSyncAdmin admin;

    @GET
    @Path("/dead-letters")
    @Blocking
    public List<DeadLetterView> deadLetters(@QueryParam("limit") @DefaultValue("100") int limit) {
        return admin.listDeadLetters(limit).stream().map(DeadLetterView::of).toList();
    }

    @POST
    @Path("/{eventId}/requeue")
    @Blocking
    public Response requeue(@PathParam("eventId") String eventId,
                            @QueryParam("version") Long version,
                            @QueryParam("operator") String operator) {
        if (version == null) {
            throw new BadRequestException("version is required");
        }
        admin.requeue(eventId, version, operator == null ? "operator" : operator);
        return Response.noContent().build();
    }
}
