package ai.pipestream.regulatory.http;

import ai.pipestream.regulatory.arbiter.ConflictArbiter;
import ai.pipestream.regulatory.entity.RegulatoryConflict;
import ai.pipestream.regulatory.entity.ResolutionPolicy;
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
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import java.util.List;
import java.util.UUID;

@Path("/conflicts")
@Produces(MediaType.APPLICATION_JSON)
public class ConflictResource {

    @Inject
    ConflictArbiter arbiter;

    /**
     * OPEN conflicts, optionally for one concept.
     */
    @GET
    @Blocking
    @Transactional
    public List<ConflictView> listOpen(@QueryParam("concept") String concept) {
        List<RegulatoryConflict> open = concept == null || concept.isBlank()
                ? RegulatoryConflict.listOpen()
                : RegulatoryConflict.listOpenByConcept(concept);
        return open.stream().map(ConflictView::of).toList();
    }

    /**
     * Human resolution: the caller names the winning rule.
     */
    @POST
    @Path("/{id}/resolve")
    @Consumes(MediaType.APPLICATION_JSON)
    @Blocking
    public ConflictView resolve(@PathParam("id") UUID id, ConflictDecision decision) {
        if (decision == null || decision.winningRuleId() == null) {
            throw new BadRequestException("winningRuleId is required");
        }
        if (decision.resolvedBy() == null || decision.resolvedBy().isBlank()) {
            throw new BadRequestException("resolvedBy is required");
        }
        return ConflictView.of(arbiter.resolve(id, decision.winningRuleId(), ResolutionPolicy.HUMAN,
                decision.resolvedBy()));
    }
}
