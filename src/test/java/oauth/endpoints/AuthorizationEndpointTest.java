package oauth.endpoints;

import io.restassured.response.Response;
import oauth.AbstractIntegrationTest;
import oauth.model.AuthorizationCode;
import oauth.model.ClientRegistration;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.util.MultiValueMap;

import java.util.List;
import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AuthorizationEndpointTest extends AbstractIntegrationTest {

    @Test
    void consentPage() {
        String clientId = confidentialClient("profile", "email").getClient().getId();

        Response response = authorize(authorizationParameters(clientId, "profile email"));

        assertEquals(200, response.getStatusCode());
        String html = response.asString();
        assertTrue(html.contains("Course Planner"));
        assertTrue(html.contains("View your profile (username, display name, bio, avatar)"));
        assertTrue(html.contains("View your email address"));
        assertTrue(html.contains("value=\"student-session\""));
        assertTrue(html.contains("value=\"example-state\""));
        assertTrue(html.contains("action=\"/oauth/authorize/confirm\""));
    }

    @Test
    void defaultScopeIsProfile() {
        String clientId = confidentialClient("profile").getClient().getId();
        Map<String, String> parameters = authorizationParameters(clientId, "profile");
        parameters.remove("scope");

        Response response = authorize(parameters);

        assertEquals(200, response.getStatusCode());
        assertTrue(response.asString().contains("View your profile"));
    }

    @Test
    void unknownScopeLabelFallsBackToName() {
        String clientId = confidentialClient("profile", "reviews:read").getClient().getId();

        Response response = authorize(authorizationParameters(clientId, "reviews:read"));

        assertEquals(200, response.getStatusCode());
        assertTrue(response.asString().contains("reviews:read"));
    }

    @Test
    void loginRedirectWithoutSession() {
        String clientId = confidentialClient("profile").getClient().getId();
        Map<String, String> parameters = authorizationParameters(clientId, "profile");
        parameters.remove("token");

        Response response = authorize(parameters);

        assertEquals(302, response.getStatusCode());
        String location = response.getHeader("Location");
        assertTrue(location.startsWith("http://localhost:3000/login?next="));
        String next = queryParameters(location).getFirst("next");
        assertTrue(next.contains("/oauth/authorize?"));
        MultiValueMap<String, String> nextParameters = queryParameters(next);
        assertEquals(clientId, nextParameters.getFirst("client_id"));
        assertEquals(REDIRECT_URI, nextParameters.getFirst("redirect_uri"));
        assertEquals("example-state", nextParameters.getFirst("state"));
    }

    @Test
    void invalidSession() {
        String clientId = confidentialClient("profile").getClient().getId();
        Map<String, String> parameters = authorizationParameters(clientId, "profile");
        parameters.put("token", "expired-session");

        Response response = authorize(parameters);

        assertEquals(401, response.getStatusCode());
        assertNull(response.getHeader("Location"));
        assertTrue(response.asString().contains("Authorization error"));
    }

    @Test
    void unknownClientShowsErrorPage() {
        Response response = authorize(authorizationParameters("nope", "profile"));

        assertEquals(400, response.getStatusCode());
        assertNull(response.getHeader("Location"));
        assertTrue(response.asString().contains("invalid_client"));
    }

    @Test
    void inactiveClientShowsErrorPage() {
        String clientId = confidentialClient("profile").getClient().getId();
        clientRegistry.deactivate(clientId);

        Response response = authorize(authorizationParameters(clientId, "profile"));

        assertEquals(400, response.getStatusCode());
        assertNull(response.getHeader("Location"));
    }

    @Test
    void unregisteredRedirectUriIsNeverRedirectedTo() {
        String clientId = confidentialClient("profile").getClient().getId();
        for (String redirectUri : List.of(REDIRECT_URI + "/", "https://REVIEWS-APP.example.com/callback",
                REDIRECT_URI + "?next=evil", "https://evil.example.com/callback")) {
            Map<String, String> parameters = authorizationParameters(clientId, "nope");
            parameters.put("redirect_uri", redirectUri);

            Response response = authorize(parameters);

            assertEquals(400, response.getStatusCode(), redirectUri);
            assertNull(response.getHeader("Location"), redirectUri);
        }
    }

    @Test
    void unsupportedResponseType() {
        String clientId = confidentialClient("profile").getClient().getId();
        Map<String, String> parameters = authorizationParameters(clientId, "profile");
        parameters.put("response_type", "token");

        Response response = authorize(parameters);

        assertEquals(400, response.getStatusCode());
        assertTrue(response.asString().contains("unsupported_response_type"));
    }

    @Test
    void repeatedParameterIsMalformed() {
        String clientId = confidentialClient("profile").getClient().getId();

        Response response = given()
                .redirects().follow(false)
                .queryParams(authorizationParameters(clientId, "profile"))
                .queryParam("state", "second-state")
                .get("/oauth/authorize");

        assertEquals(400, response.getStatusCode());
        assertNull(response.getHeader("Location"));
    }

    @Test
    void invalidScopeIsRedirected() {
        String clientId = confidentialClient("profile").getClient().getId();

        Response response = authorize(authorizationParameters(clientId, "profile email"));

        assertEquals(302, response.getStatusCode());
        String location = response.getHeader("Location");
        assertTrue(location.startsWith(REDIRECT_URI + "?"));
        MultiValueMap<String, String> parameters = queryParameters(location);
        assertEquals("invalid_scope", parameters.getFirst("error"));
        assertEquals("example-state", parameters.getFirst("state"));
    }

    @Test
    void publicClientWithoutChallenge() {
        String clientId = publicClient("profile").getClient().getId();

        Response response = authorize(authorizationParameters(clientId, "profile"));

        assertEquals(302, response.getStatusCode());
        assertEquals("invalid_request", queryParameters(response.getHeader("Location")).getFirst("error"));
    }

    @Test
    void plainChallengeMethod() {
        String clientId = publicClient("profile").getClient().getId();
        Map<String, String> parameters = withPkce(authorizationParameters(clientId, "profile"));
        parameters.put("code_challenge_method", "plain");

        Response response = authorize(parameters);

        assertEquals(302, response.getStatusCode());
        assertEquals("invalid_request", queryParameters(response.getHeader("Location")).getFirst("error"));
    }

    @Test
    void publicClientWithChallenge() {
        String clientId = publicClient("profile").getClient().getId();

        Response response = authorize(withPkce(authorizationParameters(clientId, "profile")));

        assertEquals(200, response.getStatusCode());
        assertTrue(response.asString().contains("value=\"S256\""));
    }

    @Test
    void confirmAllow() {
        String clientId = confidentialClient("profile", "email").getClient().getId();
        Map<String, String> parameters = authorizationParameters(clientId, "profile email");
        parameters.put("state", "a b&c=d");

        Response response = confirm(parameters, "allow");

        assertEquals(302, response.getStatusCode());
        String location = response.getHeader("Location");
        assertTrue(location.startsWith(REDIRECT_URI + "?code="));
        MultiValueMap<String, String> query = queryParameters(location);
        assertEquals("a b&c=d", query.getFirst("state"));

        AuthorizationCode code = mongoTemplate.findOne(
                Query.query(Criteria.where("code").is(query.getFirst("code"))), AuthorizationCode.class);
        assertEquals(clientId, code.getClientId());
        assertEquals(STUDENT_ID, code.getUserId());
        assertEquals(List.of("profile", "email"), code.getScopes());
        assertEquals(REDIRECT_URI, code.getRedirectUri());
    }

    @Test
    void confirmKeepsQueryOfRegisteredRedirectUri() {
        String redirectUri = "https://reviews-app.example.com/callback?tenant=cs";
        String clientId = clientRegistry.create(new ClientRegistration("Tenant App", null,
                List.of(redirectUri), List.of("profile"), false), "admin-1").getClient().getId();
        Map<String, String> parameters = authorizationParameters(clientId, "profile");
        parameters.put("redirect_uri", redirectUri);

        Response response = confirm(parameters, "allow");

        MultiValueMap<String, String> query = queryParameters(response.getHeader("Location"));
        assertEquals("cs", query.getFirst("tenant"));
        assertEquals(64, query.getFirst("code").length());
    }

    @Test
    void confirmDeny() {
        String clientId = confidentialClient("profile").getClient().getId();

        Response response = confirm(authorizationParameters(clientId, "profile"), "deny");

        assertEquals(302, response.getStatusCode());
        MultiValueMap<String, String> query = queryParameters(response.getHeader("Location"));
        assertEquals("access_denied", query.getFirst("error"));
        assertEquals("example-state", query.getFirst("state"));
        assertNull(query.getFirst("code"));
        assertEquals(0, mongoTemplate.count(new Query(), AuthorizationCode.class));
    }

    @Test
    void confirmUnknownAction() {
        String clientId = confidentialClient("profile").getClient().getId();

        Response response = confirm(authorizationParameters(clientId, "profile"), "maybe");

        assertEquals(302, response.getStatusCode());
        assertEquals("invalid_request", queryParameters(response.getHeader("Location")).getFirst("error"));
    }

    @Test
    void confirmRevalidatesClient() {
        String clientId = confidentialClient("profile").getClient().getId();
        Map<String, String> parameters = authorizationParameters(clientId, "profile");
        parameters.put("redirect_uri", "https://evil.example.com/callback");

        Response response = confirm(parameters, "allow");

        assertEquals(400, response.getStatusCode());
        assertNull(response.getHeader("Location"));
    }

    @Test
    void confirmRevalidatesScopes() {
        String clientId = confidentialClient("profile").getClient().getId();

        Response response = confirm(authorizationParameters(clientId, "profile email"), "allow");

        assertEquals(302, response.getStatusCode());
        assertEquals("invalid_scope", queryParameters(response.getHeader("Location")).getFirst("error"));
    }

    @Test
    void confirmRevalidatesSession() {
        String clientId = confidentialClient("profile").getClient().getId();
        Map<String, String> parameters = authorizationParameters(clientId, "profile");
        parameters.put("token", "forged-session");

        Response response = confirm(parameters, "allow");

        assertEquals(401, response.getStatusCode());
        assertEquals(0, mongoTemplate.count(new Query(), AuthorizationCode.class));
    }
}
