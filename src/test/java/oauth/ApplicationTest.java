package oauth;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.notNullValue;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApplicationTest extends AbstractIntegrationTest {

    @Test
    void health() {
        given()
                .when()
                .get("internal/health")
                .then()
                .statusCode(200)
                .body("status", equalTo("UP"))
                .body("components.mongo.details.Collections", notNullValue());
    }

    @Test
    void info() {
        given()
                .when()
                .get("internal/info")
                .then()
                .statusCode(200)
                .extract().as(Map.class);
    }

    @Test
    void unknownPath() {
        given()
                .when()
                .get("/nope")
                .then()
                .statusCode(404)
                .body("error", equalTo("not_found"));
    }

    @Test
    void methodNotAllowedOnConsentRendersErrorPage() {
        String html = given()
                .when()
                .get("/oauth/authorize/confirm")
                .then()
                .statusCode(405)
                .extract().asString();
        assertTrue(html.contains("Authorization error"));
    }
}
