package ai.pipestream.regulatory.http;

import ai.pipestream.regulatory.entity.RegulatoryRule;
import ai.pipestream.regulatory.entity.RuleRelease;
import ai.pipestream.regulatory.release.ReleaseVerifier;
import ai.pipestream.regulatory.review.RuleReviewer;
import io.smallrye.common.annotation.Blocking;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Release consumption and rule review.
 */
@Path("/rules")
@Produces(MediaType.APPLICATION_JSON)
public class RuleResource {

    private static final Logger LOG = Logger.getLogger(RuleResource.class);

    @Inject
    ReleaseVerifier releaseVerifier;

    @Inject
    RuleReviewer reviewer;

    /**
     * Rules of the latest release that are effective for {@code concept} on
     * {@code date} (default: today, UTC). A release failing its integrity
     * check is never served.
     */
    @GET
    @Path("/resolve")
    @Blocking
    @Transactional
    public ResolveResponse resolve(@QueryParam("concept") String concept, @QueryParam("date") String date) {
        if (concept == null || concept.isBlank()) {
            throw new BadRequestException("concept is required");
        }
        LocalDate on = parseDate(date);
        RuleRelease release = RuleRelease.findLatest()
                .orElseThrow(() -> new NotFoundException("No release published yet"));
        releaseVerifier.verifyOrThrow(release);

        List<RuleView> rules = release.rules.stream()
                .filter(r -> concept.equals(r.conceptSlug) && r.isEffectiveOn(on))
                .sorted(Comparator.comparing((RegulatoryRule r) -> r.effectiveFrom,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .map(RuleView::of)
                .toList();
        if (rules.isEmpty()) {
            throw new NotFoundException("No rule for concept " + concept + " on " + on + " in release " + release.version);
        }
        LOG.debugf("Resolved concept=%s, date=%s from release %s: %d rule(s)", concept, on, release.version, rules.size());
        return new ResolveResponse(release.version, release.contentHash, concept, on, rules);
    }

    @POST
    @Path("/{id}/approve")
    @Consumes(MediaType.APPLICATION_JSON)
    @Blocking
    @Transactional
    public RuleView approve(@PathParam("id") UUID id, ReviewDecision decision) {
        ReviewDecision d = decision == null ? new ReviewDecision(null, null) : decision;
        return RuleView.of(reviewer.approve(id, requireReviewer(d.reviewer()), d.note()));
    }

    @POST
    @Path("/{id}/reject")
    @Consumes(MediaType.APPLICATION_JSON)
    @Blocking
    @Transactional
    public RuleView reject(@PathParam("id") UUID id, ReviewDecision decision) {
        ReviewDecision d = decision == null ? new ReviewDecision(null, null) : decision;
        return RuleView.of(reviewer.reject(id, requireReviewer(d.reviewer()), d.note()));
    }

    private static String requireReviewer(String reviewer) {
        if (reviewer == null || reviewer.isBlank()) {
            throw new BadRequestException("reviewer is required");
        }
        return reviewer;
    }

    private static LocalDate parseDate(String date) {
        if (date == null || date.isBlank()) {
            return LocalDate.now(ZoneOffset.UTC);
        }
        try {
            return LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            throw new BadRequestException("date must be yyyy-MM-dd: " + date);
        }
    }
}
