package com.albatross.integration.e2e;

import com.albatross.integration.base.FullStackTestBase;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the public API end to end: commands go through the event store and the bus,
 * and reads only succeed once the projection worker has caught up.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@EnabledIf("isDockerAvailable")
@DisplayName("User Journey E2E Tests")
class UserJourneyIntegrationTest extends FullStackTestBase {

    private static final Duration PROJECTION_TIMEOUT = Duration.ofSeconds(20);

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    private ResponseEntity<String> call(HttpMethod method, String path, String token, Map<String, Object> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (token != null) {
            headers.setBearerAuth(token);
        }
        return restTemplate.exchange(path, method, new HttpEntity<>(body, headers), String.class);
    }

    private JsonNode json(ResponseEntity<String> response) throws Exception {
        return objectMapper.readTree(response.getBody());
    }

    private String loginWhenProjected(String username, String password) throws Exception {
        Map<String, Object> body = Map.of("username", username, "password", password);
        await().atMost(PROJECTION_TIMEOUT).pollInterval(Duration.ofMillis(200))
            .until(() -> call(HttpMethod.POST, "/api/v1/login", null, body).getStatusCode() == HttpStatus.OK);
        return json(call(HttpMethod.POST, "/api/v1/login", null, body)).get("api_key").asText();
    }

    private String register(String token, String username, String role, String tenantId) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("username", username);
        body.put("email", username + "@example.com");
        body.put("password", username + "-pw");
        body.put("role", role);
        body.put("tenant_id", tenantId);
        ResponseEntity<String> response = call(HttpMethod.POST, "/api/v1/users", token, body);
        assertEquals(HttpStatus.CREATED, response.getStatusCode(), response.getBody());
        return json(response).get("user_id").asText();
    }

    @Test
    @DisplayName("Bootstrap, tenant onboarding, pilot report and key lifecycle")
    void fullJourney() throws Exception {
        // Bootstrap the first platform admin; a second bootstrap is refused
        ResponseEntity<String> bootstrap = call(HttpMethod.POST, "/api/v1/bootstrap", null,
            Map.of("username", "root", "email", "root@example.com", "password", "root-pw"));
        assertEquals(HttpStatus.CREATED, bootstrap.getStatusCode(), bootstrap.getBody());
        String adminToken = loginWhenProjected("root", "root-pw");
        assertEquals(HttpStatus.FORBIDDEN, call(HttpMethod.POST, "/api/v1/bootstrap", null,
            Map.of("username", "again", "email", "again@example.com", "password", "pw")).getStatusCode());

        // Create a tenant and wait for its read model
        ResponseEntity<String> tenant = call(HttpMethod.POST, "/api/v1/tenants", adminToken, Map.of("name", "Skyward"));
        assertEquals(HttpStatus.CREATED, tenant.getStatusCode(), tenant.getBody());
        String tenantId = json(tenant).get("tenant_id").asText();
        await().atMost(PROJECTION_TIMEOUT)
            .until(() -> json(call(HttpMethod.GET, "/api/v1/tenants", adminToken, null)).get("returned").asInt() == 1);

        // Tenant admin registers a pilot of the same tenant
        register(adminToken, "ops", "TenantAdmin", tenantId);
        String opsToken = loginWhenProjected("ops", "ops-pw");
        String pilotId = register(opsToken, "maverick", "Pilot", tenantId);
        String pilotToken = loginWhenProjected("maverick", "maverick-pw");

        // Duplicate usernames conflict once the first registration is projected
        Map<String, Object> duplicate = new LinkedHashMap<>();
        duplicate.put("username", "maverick");
        duplicate.put("email", "other@example.com");
        duplicate.put("password", "pw");
        duplicate.put("role", "Pilot");
        duplicate.put("tenant_id", tenantId);
        assertEquals(HttpStatus.CONFLICT, call(HttpMethod.POST, "/api/v1/users", opsToken, duplicate).getStatusCode());

        // The pilot files a report that shows up in the tenant's list
        Map<String, Object> pirep = new LinkedHashMap<>();
        pirep.put("aircraft_id", "N123AB");
        pirep.put("departure_icao", "KJFK");
        pirep.put("arrival_icao", "EGLL");
        pirep.put("flight_number", "BA178");
        pirep.put("flight_time_hours", 6.75);
        assertEquals(HttpStatus.CREATED, call(HttpMethod.POST, "/api/v1/pireps", pilotToken, pirep).getStatusCode());
        await().atMost(PROJECTION_TIMEOUT)
            .until(() -> json(call(HttpMethod.GET, "/api/v1/pireps", opsToken, null)).get("returned").asInt() == 1);
        assertEquals(HttpStatus.FORBIDDEN,
            call(HttpMethod.GET, "/api/v1/pireps?tenant_id=elsewhere", pilotToken, null).getStatusCode());

        // A pilot only sees themselves
        JsonNode users = json(call(HttpMethod.GET, "/api/v1/users", pilotToken, null));
        assertEquals(1, users.get("returned").asInt());
        assertEquals(pilotId, users.get("data").get(0).get("user_id").asText());
        assertFalse(users.get("data").get(0).has("password_hash"));

        // Generate an API key, use it, revoke it
        ResponseEntity<String> generated = call(HttpMethod.POST, "/api/v1/users/" + pilotId + "/apikeys", pilotToken,
            Map.of("key_name", "ci"));
        assertEquals(HttpStatus.CREATED, generated.getStatusCode(), generated.getBody());
        String keyId = json(generated).get("key_id").asText();
        String apiKey = json(generated).get("api_key").asText();
        assertEquals(HttpStatus.OK, call(HttpMethod.GET, "/api/v1/users", apiKey, null).getStatusCode());

        await().atMost(PROJECTION_TIMEOUT).until(() ->
            json(call(HttpMethod.GET, "/api/v1/users/" + pilotId + "/apikeys", pilotToken, null)).get("returned").asInt() == 1);

        assertEquals(HttpStatus.NO_CONTENT,
            call(HttpMethod.DELETE, "/api/v1/users/" + pilotId + "/apikeys/" + keyId, pilotToken, null).getStatusCode());
        assertEquals(HttpStatus.UNAUTHORIZED, call(HttpMethod.GET, "/api/v1/users", apiKey, null).getStatusCode());
        assertEquals(HttpStatus.NOT_FOUND,
            call(HttpMethod.DELETE, "/api/v1/users/" + pilotId + "/apikeys/" + keyId, pilotToken, null).getStatusCode());
    }

    @Test
    @DisplayName("Platform admins cannot be registered by tenant admins")
    void shouldForbidPlatformAdminRegistrationByTenantAdmin() throws Exception {
        call(HttpMethod.POST, "/api/v1/bootstrap", null,
            Map.of("username", "root", "email", "root@example.com", "password", "root-pw"));
        String adminToken = loginWhenProjected("root", "root-pw");
        String tenantId = json(call(HttpMethod.POST, "/api/v1/tenants", adminToken, Map.of("name", "Skyward")))
            .get("tenant_id").asText();
        register(adminToken, "ops", "TenantAdmin", tenantId);
        String opsToken = loginWhenProjected("ops", "ops-pw");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("username", "sneaky");
        body.put("email", "sneaky@example.com");
        body.put("password", "pw");
        body.put("role", "PlatformAdmin");
        assertEquals(HttpStatus.FORBIDDEN, call(HttpMethod.POST, "/api/v1/users", opsToken, body).getStatusCode());
    }
}
