package ai.pipestream.regulatory.http;

import ai.pipestream.regulatory.entity.RiskTier;
import ai.pipestream.regulatory.entity.RuleStatus;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.jboss.logging.Logger;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static ai.pipestream.regulatory.PipelineFixtures.rule;
import static ai.pipestream.regulatory.PipelineFixtures.unique;
import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

/**
 * HTTP tests for creating and verifying releases.
 */
@QuarkusTest
public class ReleaseResourceTest {

    private static final Logger LOG = Logger.getLogger(ReleaseResourceTest.class);

    @Test
    void testRelease_ThenVerify() {
        LOG.info("Testing POST /releases and GET /releases/{version}/verify");

        UUID ruleId = QuarkusTransaction.requiringNew().call(() ->
                rule(unique("opis"), "x", RuleStatus.APPROVED, RiskTier.T3, LocalDate.of(2025, 1, 1), 0.95).id);

        String version = given()
                .contentType(ContentType.JSON)
                .body(Map.of("releasedBy", "release-manager", "ruleIds", List.of(ruleId)))
                .when()
                .post("/releases")
                .then()
                .statusCode(201)
                .body("releaseType", is("PATCH"))
                .body("memberCount", greaterThanOrEqualTo(1))
                .body("changelog", containsString("= x [T3]"))
                .extract().path("version");

        given()
                .when()
                .get("/releases/{version}/verify", version)
                .then()
                .statusCode(200)
                .body("version", is(version))
                .body("valid", is(true));
    }

    @Test
    void testRelease_Rejected() {
        LOG.info("Testing POST /releases - invalid requests");

        UUID draft = QuarkusTransaction.requiringNew().call(() ->
                rule(unique("opis"), "x", RuleStatus.DRAFT, RiskTier.T3, LocalDate.of(2025, 1, 1), 0.95).id);

        given()
                .contentType(ContentType.JSON)
                .body(Map.of("releasedBy", "release-manager", "ruleIds", List.of(draft)))
                .when()
                .post("/releases")
                .then()
                .statusCode(409)
                .body("errorCode", is("RELEASE_REJECTED"));

        given()
                .contentType(ContentType.JSON)
                .body(Map.of("ruleIds", List.of(draft)))
                .when()
                .post("/releases")
                .then()
                .statusCode(400);

        given()
                .when()
                .get("/releases/{version}/verify", "999.0.0")
                .then()
                .statusCode(404)
                .body("errorCode", is("NOT_FOUND"));
    }
}
