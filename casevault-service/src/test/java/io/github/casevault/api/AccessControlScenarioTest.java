package io.github.casevault.api;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

@QuarkusTest
class AccessControlScenarioTest {

    private static final String PASSWORD = "s3cret-password";

    private String clientToken;
    private String clientId;
    private String lawyerToken;
    private String lawyerId;

    private final Map<String, String> emails = new HashMap<>();

    @BeforeEach
    void setUp() {
        clientId = register("CLIENT");
        clientToken = login(emailOf(clientId));
        lawyerId = register("LAWYER");
        lawyerToken = login(emailOf(lawyerId));
    }

    private String register(String role) {
        String email = role.toLowerCase() + "-" + UUID.randomUUID() + "@example.com";
        String id =
                given().contentType(ContentType.JSON)
                        .body(
                                Map.of(
                                        "email", email,
                                        "password", PASSWORD,
                                        "firstName", "Test",
                                        "lastName", role,
                                        "role", role))
                        .when()
                        .post("/v1/auth/register")
                        .then()
                        .statusCode(201)
                        .body("role", is(role))
                        .extract()
                        .path("id");
        emails.put(id, email);
        return id;
    }

    private String emailOf(String userId) {
        return emails.get(userId);
    }

    private static String login(String email) {
        return given().contentType(ContentType.JSON)
                .body(Map.of("email", email, "password", PASSWORD))
                .when()
                .post("/v1/auth/login")
                .then()
                .statusCode(200)
                .extract()
                .path("token");
    }

    private static String adminLogin() {
        return given().contentType(ContentType.JSON)
                .body(Map.of("email", "admin@casevault.test", "password", "admin-password"))
                .when()
                .post("/v1/auth/login")
                .then()
                .statusCode(200)
                .extract()
                .path("token");
    }

    private static String createCase(String token) {
        return createCase(token, "Contract dispute", "CIVIL_LAW");
    }

    private static String createCase(String token, String title, String category) {
        return given().auth()
                .oauth2(token)
                .contentType(ContentType.JSON)
                .body(Map.of("title", title, "category", category))
                .when()
                .post("/v1/cases")
                .then()
                .statusCode(201)
                .body("status", is("OPEN"))
                .extract()
                .path("id");
    }

    private static String submitRequest(String token, String caseId) {
        return given().auth()
                .oauth2(token)
                .when()
                .post("/v1/cases/{caseId}/access-requests", caseId)
                .then()
                .statusCode(201)
                .body("status", is("PENDING"))
                .extract()
                .path("id");
    }

    private static void review(String token, String requestId, String decision, int status) {
        given().auth()
                .oauth2(token)
                .contentType(ContentType.JSON)
                .body(Map.of("decision", decision))
                .when()
                .post("/v1/access-requests/{requestId}/review", requestId)
                .then()
                .statusCode(status);
    }

    private static void expectCaseStatus(String token, String caseId, int status) {
        given().auth()
                .oauth2(token)
                .when()
                .get("/v1/cases/{caseId}", caseId)
                .then()
                .statusCode(status);
    }

    @Test
    void request_approve_revoke_round_trip() {
        String caseId = createCase(clientToken);
        expectCaseStatus(lawyerToken, caseId, 403);

        String requestId = submitRequest(lawyerToken, caseId);
        given().auth()
                .oauth2(lawyerToken)
                .when()
                .post("/v1/cases/{caseId}/access-requests", caseId)
                .then()
                .statusCode(409)
                .body("details.reason", is("DUPLICATE_PENDING"));

        review(clientToken, requestId, "approve", 200);
        expectCaseStatus(lawyerToken, caseId, 200);
        given().auth()
                .oauth2(lawyerToken)
                .when()
                .get("/v1/cases")
                .then()
                .statusCode(200)
                .body("data.id", hasItem(caseId));

        review(clientToken, requestId, "reject", 409);

        given().auth()
                .oauth2(clientToken)
                .when()
                .get("/v1/cases/{caseId}/access", caseId)
                .then()
                .statusCode(200)
                .body("data.lawyerId", hasItem(lawyerId));

        given().auth()
                .oauth2(clientToken)
                .when()
                .delete("/v1/cases/{caseId}/access/{lawyerId}", caseId, lawyerId)
                .then()
                .statusCode(204);
        expectCaseStatus(lawyerToken, caseId, 403);
        given().auth()
                .oauth2(lawyerToken)
                .when()
                .get("/v1/cases")
                .then()
                .statusCode(200)
                .body("data.id", not(hasItem(caseId)));
    }

    @Test
    void rejected_request_creates_no_grant() {
        String caseId = createCase(clientToken);
        String requestId = submitRequest(lawyerToken, caseId);

        review(clientToken, requestId, "reject", 200);

        expectCaseStatus(lawyerToken, caseId, 403);
        given().auth()
                .oauth2(lawyerToken)
                .when()
                .get("/v1/access-requests/{requestId}", requestId)
                .then()
                .statusCode(200)
                .body("status", is("REJECTED"));
        given().auth()
                .oauth2(lawyerToken)
                .when()
                .post("/v1/cases/{caseId}/access-requests", caseId)
                .then()
                .statusCode(409)
                .body("details.reason", is("RESUBMIT_COOLDOWN"));
    }

    @Test
    void lawyer_cannot_review_own_request() {
        String caseId = createCase(clientToken);
        String requestId = submitRequest(lawyerToken, caseId);

        review(lawyerToken, requestId, "approve", 403);
        review(clientToken, requestId, "maybe", 400);
        expectCaseStatus(lawyerToken, caseId, 403);
    }

    @Test
    void withdrawn_request_disappears() {
        String caseId = createCase(clientToken);
        submitRequest(lawyerToken, caseId);

        given().auth()
                .oauth2(lawyerToken)
                .when()
                .delete("/v1/cases/{caseId}/access-requests", caseId)
                .then()
                .statusCode(204);
        given().auth()
                .oauth2(clientToken)
                .when()
                .get("/v1/cases/{caseId}/access-requests", caseId)
                .then()
                .statusCode(200)
                .body("data.size()", is(0));
    }

    @Test
    void direct_grant_is_idempotent() {
        String caseId = createCase(clientToken);
        Map<String, String> body = Map.of("lawyerId", lawyerId);

        given().auth()
                .oauth2(clientToken)
                .contentType(ContentType.JSON)
                .body(body)
                .when()
                .post("/v1/cases/{caseId}/access", caseId)
                .then()
                .statusCode(201)
                .body("outcome", is("GRANTED"));
        given().auth()
                .oauth2(clientToken)
                .contentType(ContentType.JSON)
                .body(body)
                .when()
                .post("/v1/cases/{caseId}/access", caseId)
                .then()
                .statusCode(200)
                .body("outcome", is("ALREADY_GRANTED"));
        given().auth()
                .oauth2(clientToken)
                .contentType(ContentType.JSON)
                .body(Map.of("lawyerId", clientId))
                .when()
                .post("/v1/cases/{caseId}/access", caseId)
                .then()
                .statusCode(400);

        given().auth()
                .oauth2(clientToken)
                .when()
                .get("/v1/cases/{caseId}/access", caseId)
                .then()
                .statusCode(200)
                .body("data.size()", is(1));
    }

    @Test
    void other_clients_cases_are_hidden() {
        String caseId = createCase(clientToken);
        String otherToken = login(emailOf(register("CLIENT")));

        expectCaseStatus(otherToken, caseId, 403);
        expectCaseStatus(otherToken, UUID.randomUUID().toString(), 403);
        expectCaseStatus(otherToken, "not-a-uuid", 403);
        given().auth()
                .oauth2(otherToken)
                .contentType(ContentType.JSON)
                .body(Map.of("caseIds", List.of(caseId)))
                .when()
                .post("/v1/cases/accessible")
                .then()
                .statusCode(200)
                .body("data.size()", is(0));
        given().auth()
                .oauth2(clientToken)
                .contentType(ContentType.JSON)
                .body(Map.of("caseIds", List.of(caseId, UUID.randomUUID().toString())))
                .when()
                .post("/v1/cases/accessible")
                .then()
                .statusCode(200)
                .body("data", is(List.of(caseId)));
    }

    @Test
    void missing_or_invalid_credentials_are_unauthenticated() {
        given().when().get("/v1/cases").then().statusCode(401).body("code", is("unauthenticated"));
        given().auth()
                .oauth2("bogus")
                .when()
                .get("/v1/auth/me")
                .then()
                .statusCode(401);
        given().cookie(Credentials.SESSION_COOKIE, clientToken)
                .when()
                .get("/v1/auth/me")
                .then()
                .statusCode(200)
                .body("id", is(clientId));
    }

    @Test
    void role_checks_guard_case_creation_and_requests() {
        given().auth()
                .oauth2(lawyerToken)
                .contentType(ContentType.JSON)
                .body(Map.of("title", "Not mine", "category", "OTHER"))
                .when()
                .post("/v1/cases")
                .then()
                .statusCode(403)
                .body("code", is("forbidden"));
        String caseId = createCase(clientToken);
        given().auth()
                .oauth2(clientToken)
                .when()
                .post("/v1/cases/{caseId}/access-requests", caseId)
                .then()
                .statusCode(403);
    }

    @Test
    void logout_ends_the_session() {
        given().auth().oauth2(lawyerToken).when().post("/v1/auth/logout").then().statusCode(204);
        given().auth().oauth2(lawyerToken).when().get("/v1/auth/me").then().statusCode(401);
    }

    @Test
    void administrators_cannot_self_register() {
        given().contentType(ContentType.JSON)
                .body(
                        Map.of(
                                "email", "root-" + UUID.randomUUID() + "@example.com",
                                "password", PASSWORD,
                                "firstName", "Root",
                                "lastName", "User",
                                "role", "ADMIN"))
                .when()
                .post("/v1/auth/register")
                .then()
                .statusCode(400);
    }

    @Test
    void deactivated_lawyer_loses_access_immediately() {
        String adminToken = adminLogin();
        String caseId = createCase(clientToken);
        expectCaseStatus(adminToken, caseId, 200);

        given().auth()
                .oauth2(adminToken)
                .contentType(ContentType.JSON)
                .body(Map.of("active", false))
                .when()
                .patch("/v1/admin/users/{userId}", lawyerId)
                .then()
                .statusCode(200)
                .body("active", is(false));

        given().auth().oauth2(lawyerToken).when().get("/v1/auth/me").then().statusCode(401);
        given().contentType(ContentType.JSON)
                .body(Map.of("email", emailOf(lawyerId), "password", PASSWORD))
                .when()
                .post("/v1/auth/login")
                .then()
                .statusCode(401);
        given().auth()
                .oauth2(clientToken)
                .contentType(ContentType.JSON)
                .body(Map.of("active", true))
                .when()
                .patch("/v1/admin/users/{userId}", lawyerId)
                .then()
                .statusCode(403);
    }

    @Test
    void refused_grant_rolls_back_the_approval() {
        String caseId = createCase(clientToken);
        String requestId = submitRequest(lawyerToken, caseId);
        given().auth()
                .oauth2(adminLogin())
                .contentType(ContentType.JSON)
                .body(Map.of("active", false))
                .when()
                .patch("/v1/admin/users/{userId}", lawyerId)
                .then()
                .statusCode(200);

        given().auth()
                .oauth2(clientToken)
                .contentType(ContentType.JSON)
                .body(Map.of("decision", "approve"))
                .when()
                .post("/v1/access-requests/{requestId}/review", requestId)
                .then()
                .statusCode(400)
                .body("details.reason", is("GRANT_FAILED"))
                .body("details.grantOutcome", is("INACTIVE"));

        given().auth()
                .oauth2(clientToken)
                .when()
                .get("/v1/access-requests/{requestId}", requestId)
                .then()
                .statusCode(200)
                .body("status", is("PENDING"))
                .body("reviewedAt", nullValue());
        given().auth()
                .oauth2(clientToken)
                .when()
                .get("/v1/cases/{caseId}/access", caseId)
                .then()
                .statusCode(200)
                .body("data.size()", is(0));
    }

    @Test
    void request_for_unknown_case_looks_like_a_denial() {
        given().auth()
                .oauth2(lawyerToken)
                .when()
                .post("/v1/cases/{caseId}/access-requests", UUID.randomUUID().toString())
                .then()
                .statusCode(403)
                .body("code", is("forbidden"))
                .body("details.message", is("Not allowed"));
        given().auth()
                .oauth2(lawyerToken)
                .when()
                .post("/v1/cases/{caseId}/access-requests", "not-a-uuid")
                .then()
                .statusCode(403)
                .body("code", is("forbidden"));
    }

    @Test
    void only_the_owner_updates_a_case() {
        String caseId = createCase(clientToken);
        given().auth()
                .oauth2(clientToken)
                .contentType(ContentType.JSON)
                .body(Map.of("lawyerId", lawyerId))
                .when()
                .post("/v1/cases/{caseId}/access", caseId)
                .then()
                .statusCode(201);

        given().auth()
                .oauth2(clientToken)
                .contentType(ContentType.JSON)
                .body(Map.of("title", "Contract dispute, appeal", "status", "CLOSED"))
                .when()
                .patch("/v1/cases/{caseId}", caseId)
                .then()
                .statusCode(200)
                .body("title", is("Contract dispute, appeal"))
                .body("status", is("CLOSED"))
                .body("category", is("CIVIL_LAW"));
        given().auth()
                .oauth2(clientToken)
                .contentType(ContentType.JSON)
                .body(Map.of("priority", 4))
                .when()
                .put("/v1/cases/{caseId}", caseId)
                .then()
                .statusCode(200)
                .body("priority", is(4));
        given().auth()
                .oauth2(clientToken)
                .contentType(ContentType.JSON)
                .body(Map.of())
                .when()
                .patch("/v1/cases/{caseId}", caseId)
                .then()
                .statusCode(400);

        given().auth()
                .oauth2(lawyerToken)
                .contentType(ContentType.JSON)
                .body(Map.of("title", "Taken over"))
                .when()
                .patch("/v1/cases/{caseId}", caseId)
                .then()
                .statusCode(403);
        given().auth()
                .oauth2(lawyerToken)
                .when()
                .get("/v1/cases/{caseId}", caseId)
                .then()
                .statusCode(200)
                .body("title", is("Contract dispute, appeal"));
    }

    @Test
    void deleting_a_case_removes_its_grants_and_requests() {
        String caseId = createCase(clientToken);
        submitRequest(lawyerToken, caseId);
        String otherLawyerToken = login(emailOf(register("LAWYER")));

        given().auth()
                .oauth2(lawyerToken)
                .when()
                .delete("/v1/cases/{caseId}", caseId)
                .then()
                .statusCode(403);
        given().auth()
                .oauth2(clientToken)
                .when()
                .delete("/v1/cases/{caseId}", caseId)
                .then()
                .statusCode(204);

        expectCaseStatus(clientToken, caseId, 403);
        given().auth()
                .oauth2(lawyerToken)
                .when()
                .get("/v1/access-requests/mine")
                .then()
                .statusCode(200)
                .body("data.caseId", not(hasItem(caseId)));
        given().auth()
                .oauth2(otherLawyerToken)
                .when()
                .post("/v1/cases/{caseId}/access-requests", caseId)
                .then()
                .statusCode(403);
        given().auth()
                .oauth2(clientToken)
                .when()
                .delete("/v1/cases/{caseId}", caseId)
                .then()
                .statusCode(403);
    }

    @Test
    void case_list_filters_by_title_status_and_category() {
        createCase(clientToken);
        String custodyId = createCase(clientToken, "Custody hearing", "FAMILY_LAW");
        given().auth()
                .oauth2(clientToken)
                .contentType(ContentType.JSON)
                .body(Map.of("status", "CLOSED"))
                .when()
                .patch("/v1/cases/{caseId}", custodyId)
                .then()
                .statusCode(200);

        given().auth()
                .oauth2(clientToken)
                .queryParam("search", "CUSTODY")
                .when()
                .get("/v1/cases")
                .then()
                .statusCode(200)
                .body("data.id", is(List.of(custodyId)));
        given().auth()
                .oauth2(clientToken)
                .queryParam("status", "closed")
                .when()
                .get("/v1/cases")
                .then()
                .statusCode(200)
                .body("data.id", is(List.of(custodyId)));
        given().auth()
                .oauth2(clientToken)
                .queryParam("category", "CIVIL_LAW")
                .when()
                .get("/v1/cases")
                .then()
                .statusCode(200)
                .body("data.title", is(List.of("Contract dispute")));
        given().auth()
                .oauth2(clientToken)
                .when()
                .get("/v1/cases")
                .then()
                .statusCode(200)
                .body("data.size()", is(2));
        given().auth()
                .oauth2(clientToken)
                .queryParam("status", "PENDING")
                .when()
                .get("/v1/cases")
                .then()
                .statusCode(400);

        given().auth()
                .oauth2(lawyerToken)
                .queryParam("search", "custody")
                .when()
                .get("/v1/cases")
                .then()
                .statusCode(200)
                .body("data.size()", is(0));
    }

    @Test
    void available_lawyers_lists_active_lawyers_only() {
        String inactiveId = register("LAWYER");
        given().auth()
                .oauth2(adminLogin())
                .contentType(ContentType.JSON)
                .body(Map.of("active", false))
                .when()
                .patch("/v1/admin/users/{userId}", inactiveId)
                .then()
                .statusCode(200);

        given().auth()
                .oauth2(clientToken)
                .when()
                .get("/v1/lawyers/available")
                .then()
                .statusCode(200)
                .body("data.id", hasItem(lawyerId))
                .body("data.id", not(hasItem(inactiveId)))
                .body("data.id", not(hasItem(clientId)));
        given().when().get("/v1/lawyers/available").then().statusCode(401);
    }
}
