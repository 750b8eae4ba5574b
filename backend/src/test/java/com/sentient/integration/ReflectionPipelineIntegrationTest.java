package com.sentient.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentient.entity.PlanRecord;
import com.sentient.repository.PlanRecordRepository;
import com.sentient.security.JwtTokenProvider;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-End Integration Test for the reflection pipeline.
 *
 * Pipeline Flow:
 * POST /api/analyze → stream queue → consumer → plan record (PENDING)
 * → artifact job queue → worker → canvas file → plan record (COMPLETED)
 *
 * No inference key is configured, so every plan is the fallback plan. This
 * keeps the test independent of any external model provider.
 *
 * Test Requirements:
 * - PostgreSQL container for the plan store
 * - RabbitMQ container for the stream and job queues
 * - Local filesystem storage in a temporary directory
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Reflection Pipeline Integration Tests")
class ReflectionPipelineIntegrationTest {

    private static final String SIGNING_SECRET =
            "integrationTestSigningSecretThatIsDefinitelyLongerThan32Bytes";

    private static final Path STORAGE_ROOT = createStorageRoot();

    @Container
    static PostgreSQLContainer<?> postgresContainer = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("sentient_planner_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static RabbitMQContainer rabbitMQContainer = new RabbitMQContainer(
            DockerImageName.parse("rabbitmq:3.13-management-alpine"));

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private JwtTokenProvider jwtTokenProvider;

    @Autowired
    private PlanRecordRepository planRecordRepository;

    @Autowired
    private ObjectMapper objectMapper;

    private String userId;
    private String jwtToken;

    /**
     * Configure dynamic properties for TestContainers.
     */
    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgresContainer::getJdbcUrl);
        registry.add("spring.datasource.username", postgresContainer::getUsername);
        registry.add("spring.datasource.password", postgresContainer::getPassword);
        registry.add("spring.rabbitmq.host", rabbitMQContainer::getHost);
        registry.add("spring.rabbitmq.port", rabbitMQContainer::getAmqpPort);
        registry.add("spring.rabbitmq.username", rabbitMQContainer::getAdminUsername);
        registry.add("spring.rabbitmq.password", rabbitMQContainer::getAdminPassword);
        registry.add("app-secrets", () -> "{\"JWT_SECRET\":\"" + SIGNING_SECRET + "\"}");
        registry.add("app.storage.mode", () -> "local");
        registry.add("app.storage.local.root", STORAGE_ROOT::toString);
        registry.add("app.worker.wait-time-ms", () -> "500");
        registry.add("app.worker.idle-pause-ms", () -> "100");
        registry.add("app.worker.error-backoff-ms", () -> "500");
        registry.add("app.worker.shutdown-timeout-ms", () -> "5000");
    }

    @AfterAll
    static void cleanUpStorage() throws IOException {
        try (Stream<Path> paths = Files.walk(STORAGE_ROOT)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> path.toFile().delete());
        }
    }

    private static Path createStorageRoot() {
        try {
            return Files.createTempDirectory("sentient-storage");
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create storage directory", e);
        }
    }

    @BeforeEach
    void setUp() {
        userId = "it-" + UUID.randomUUID();
        jwtToken = jwtTokenProvider.generateToken(userId);
    }

    private HttpHeaders authHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(jwtToken);
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }

    private ResponseEntity<String> getPlans() {
        return restTemplate.exchange("/api/plans/" + userId, HttpMethod.GET,
                new HttpEntity<>(authHeaders()), String.class);
    }

    @Test
    @DisplayName("Submitted reflection should produce a stored plan with a completed canvas")
    void testReflectionToCompletedCanvas() throws Exception {
        // Step 1: submit the reflection
        ResponseEntity<String> accepted = restTemplate.exchange("/api/analyze", HttpMethod.POST,
                new HttpEntity<>("{\"text\":\"Big presentation on Thursday and I feel unprepared\"}", authHeaders()),
                String.class);
        assertEquals(HttpStatus.ACCEPTED, accepted.getStatusCode());
        assertNotNull(objectMapper.readTree(accepted.getBody()).get("requestId").asText(null));

        // Step 2: wait for the consumer and worker to finish
        PlanRecord record = null;
        for (int attempt = 0; attempt < 60; attempt++) {
            List<PlanRecord> records = planRecordRepository.findAll().stream()
                    .filter(r -> r.getUserId().equals(userId))
                    .toList();
            if (!records.isEmpty() && records.get(0).getArtifactStatus() == PlanRecord.ArtifactStatus.COMPLETED) {
                record = records.get(0);
                break;
            }
            Thread.sleep(500);
        }
        assertNotNull(record, "Plan should reach COMPLETED within 30 seconds");

        // Step 3: verify the stored plan
        assertTrue(record.isFallback());
        assertEquals("neutral", record.getEmotion());
        assertEquals(50, record.getSentimentScore());
        assertEquals(7, record.getWeeklyPlan().size());
        assertNotNull(record.getArtifactGeneratedAt());
        assertTrue(record.getArtifactUrl().endsWith("/" + record.getRecordId() + ".txt"));

        // Step 4: verify the canvas was written
        String key = record.getArtifactUrl().substring(record.getArtifactUrl().indexOf("artifacts/"));
        Path canvas = STORAGE_ROOT.resolve("sentient-artifacts").resolve(key);
        assertTrue(Files.exists(canvas), "Canvas file should exist at " + canvas);
        assertTrue(Files.readString(canvas).contains("ID: " + record.getRecordId().substring(0, 8)));

        // Step 5: read the plan through the API
        ResponseEntity<String> plans = getPlans();
        assertEquals(HttpStatus.OK, plans.getStatusCode());
        JsonNode body = objectMapper.readTree(plans.getBody());
        assertEquals(1, body.get("planCount").asInt());
        assertFalse(body.has("notice"));
        JsonNode plan = body.get("plans").get(0);
        assertTrue(plan.get("isFallback").asBoolean());
        assertEquals("completed", plan.get("artifact").get("status").asText());
        assertEquals(record.getArtifactUrl(), plan.get("artifact").get("url").asText());
    }

    @Test
    @DisplayName("User without plans should get 404")
    void testNoPlansReturns404() {
        ResponseEntity<String> response = getPlans();

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
    }

    @Test
    @DisplayName("Request without a token should get 401")
    void testMissingTokenReturns401() {
        ResponseEntity<String> response = restTemplate.getForEntity("/api/plans/" + userId, String.class);

        assertEquals(HttpStatus.UNAUTHORIZED, response.getStatusCode());
    }

    @Test
    @DisplayName("Worker health should be reported through actuator")
    void testWorkerHealth() throws Exception {
        ResponseEntity<String> response = restTemplate.getForEntity("/actuator/health", String.class);

        JsonNode components = objectMapper.readTree(response.getBody()).get("components");
        assertNotNull(components.get("artifactWorker"));
        assertEquals("UP", components.get("artifactWorker").get("status").asText());
    }
}
