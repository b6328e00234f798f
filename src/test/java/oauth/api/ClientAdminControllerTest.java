package oauth.api;

import io.restassured.http.ContentType;
import io.restassured.specification.RequestSpecification;
import oauth.AbstractIntegrationTest;
import oauth.model.OAuthClient;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClientAdminControllerTest extends AbstractIntegrationTest {

    @Test
    void noSessionToken() {
        given().get("/admin/oauth-clients").then().statusCode(401);
    }

    @Test
    void invalidSessionToken() {
        given().auth().oauth2("forged").get("/admin/oauth-clients").then().statusCode(401);
    }

    @Test
    void nonAdmin() {
        given().auth().oauth2(STUDENT_SESSION).get("/admin/oauth-clients").then().statusCode(403);
        given().auth().oauth2(STUDENT_SESSION).contentType(ContentType.JSON).body(registration(false))
                .post("/admin/oauth-clients").then().statusCode(403);
        assertTrue(clientRegistry.list().isEmpty());
    }

    @Test
    void createConfidentialClient() {
        Map<String, Object> body = admin().contentType(ContentType.JSON).body(registration(false))
                .post("/admin/oauth-clients")
                .then()
                .statusCode(201)
                .extract().as(mapTypeRef);

        String clientSecret = (String) body.get("client_secret");
        assertEquals(64, clientSecret.length());
        assertEquals("Course Planner", body.get("name"));
        assertEquals(List.of(REDIRECT_URI), body.get("redirectUris"));
        assertEquals(List.of("profile", "email"), body.get("allowedScopes"));
        assertEquals(Boolean.FALSE, body.get("isPublic"));
        assertEquals(Boolean.TRUE, body.get("isActive"));
        assertEquals("admin-1", body.get("createdBy"));
        assertFalse(body.containsKey("secretHash"));

        OAuthClient client = clientRegistry.getById((String) body.get("id")).get();
        assertTrue(clientRegistry.verifySecret(client, clientSecret));
    }

    @Test
    void createPublicClient() {
        Map<String, Object> body = admin().contentType(ContentType.JSON).body(registration(true))
                .post("/admin/oauth-clients")
                .then()
                .statusCode(201)
                .extract().as(mapTypeRef);

        assertTrue(body.containsKey("client_secret"));
        assertNull(body.get("client_secret"));
        assertEquals(Boolean.TRUE, body.get("isPublic"));
    }

    @Test
    void createInvalidClient() {
        Map<String, Object> registration = registration(false);
        registration.put("redirectUris", List.of("not a uri"));

        Map<String, Object> body = admin().contentType(ContentType.JSON).body(registration)
                .post("/admin/oauth-clients")
                .then()
                .statusCode(400)
                .extract().as(mapTypeRef);
        assertEquals("invalid_client_metadata", body.get("error"));
    }

    @Test
    void unknownPropertiesAreRejected() {
        Map<String, Object> registration = registration(false);
        registration.put("secretHash", "chosen-by-attacker");

        admin().contentType(ContentType.JSON).body(registration)
                .post("/admin/oauth-clients")
                .then()
                .statusCode(400);
        assertTrue(clientRegistry.list().isEmpty());
    }

    @Test
    void listAndGet() {
        String id = confidentialClient("profile").getClient().getId();
        publicClient("profile");

        List<Map<String, Object>> clients = admin().get("/admin/oauth-clients")
                .then().statusCode(200).extract().as(listOfMapsTypeRef);
        assertEquals(2, clients.size());
        clients.forEach(client -> assertFalse(client.containsKey("client_secret")));

        Map<String, Object> client = admin().get("/admin/oauth-clients/{id}", id)
                .then().statusCode(200).extract().as(mapTypeRef);
        assertEquals(id, client.get("id"));

        Map<String, Object> notFound = admin().get("/admin/oauth-clients/{id}", "nope")
                .then().statusCode(404).extract().as(mapTypeRef);
        assertEquals("not_found", notFound.get("error"));
    }

    @Test
    void update() {
        String id = confidentialClient("profile").getClient().getId();
        Map<String, Object> update = new HashMap<>();
        update.put("name", "Semester Planner");
        update.put("allowedScopes", List.of("profile", "email"));

        Map<String, Object> body = admin().contentType(ContentType.JSON).body(update)
                .patch("/admin/oauth-clients/{id}", id)
                .then().statusCode(200).extract().as(mapTypeRef);

        assertEquals("Semester Planner", body.get("name"));
        assertEquals("Plans your semester", body.get("description"));
        assertEquals(List.of("profile", "email"), body.get("allowedScopes"));
    }

    @Test
    void invalidUpdate() {
        String id = confidentialClient("profile").getClient().getId();

        admin().contentType(ContentType.JSON).body(Map.of("allowedScopes", List.of()))
                .patch("/admin/oauth-clients/{id}", id)
                .then().statusCode(400);
        admin().contentType(ContentType.JSON).body(Map.of("name", "x"))
                .patch("/admin/oauth-clients/{id}", "nope")
                .then().statusCode(404);
    }

    @Test
    void deactivate() {
        String id = confidentialClient("profile").getClient().getId();

        Map<String, Object> body = admin().delete("/admin/oauth-clients/{id}", id)
                .then().statusCode(200).extract().as(mapTypeRef);

        assertEquals(Boolean.TRUE, body.get("success"));
        assertFalse(clientRegistry.getById(id).get().isActive());
        assertFalse(clientRegistry.getActiveById(id).isPresent());
        admin().delete("/admin/oauth-clients/{id}", "nope").then().statusCode(404);
    }

    @Test
    void rotateSecret() {
        String id = confidentialClient("profile").getClient().getId();

        Map<String, Object> body = admin().post("/admin/oauth-clients/{id}/rotate-secret", id)
                .then().statusCode(200).extract().as(mapTypeRef);

        String rotated = (String) body.get("client_secret");
        assertEquals(64, rotated.length());
        assertTrue(clientRegistry.verifySecret(clientRegistry.getById(id).get(), rotated));
    }

    @Test
    void rotateSecretOfPublicClient() {
        String id = publicClient("profile").getClient().getId();

        Map<String, Object> body = admin().post("/admin/oauth-clients/{id}/rotate-secret", id)
                .then().statusCode(409).extract().as(mapTypeRef);
        assertEquals("public_client", body.get("error"));
        assertNotEquals(null, body.get("error_description"));

        admin().post("/admin/oauth-clients/{id}/rotate-secret", "nope").then().statusCode(404);
    }

    private RequestSpecification admin() {
        return given().auth().oauth2(ADMIN_SESSION);
    }

    private Map<String, Object> registration(boolean publicClient) {
        Map<String, Object> registration = new HashMap<>();
        registration.put("name", "Course Planner");
        registration.put("description", "Plans your semester");
        registration.put("redirectUris", List.of(REDIRECT_URI));
        registration.put("allowedScopes", List.of("profile", "email"));
        registration.put("isPublic", publicClient);
        return registration;
    }
}
