package taskescrow.registry.integration;

import taskescrow.registry.config.Dependencies;
import taskescrow.registry.config.RegistryConfig;
import taskescrow.registry.server.RegistryNettyServer;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Mutations need X-Registry-Key once a key is configured; reads stay open.
 */
class ApiKeyAuthIntegrationTest {

    private static final String BODY = """
            {"title": "t", "deadline": "2099-01-01T00:00:00Z", "reward": 10}
            """;

    private Dependencies deps;
    private RegistryNettyServer server;
    private HttpClient httpClient;
    private String baseUrl;

    @BeforeEach
    void setUp() {
        RegistryConfig config = RegistryConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-auth-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withApiKey("s3cret")
                .withServerHost("127.0.0.1")
                .withServerPort(0);

        deps = Dependencies.create(config);
        server = new RegistryNettyServer(deps.routerHandler());
        server.start(config.serverHost(), config.serverPort());
        baseUrl = "http://127.0.0.1:" + server.port();
        httpClient = HttpClient.newHttpClient();
    }

    @AfterEach
    void tearDown() {
        server.stop();
        deps.close();
    }

    private HttpResponse<String> create(String key) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/v1/tasks"))
                .header("X-Caller-Id", "alice")
                .POST(HttpRequest.BodyPublishers.ofString(BODY));
        if (key != null) {
            builder.header("X-Registry-Key", key);
        }
        return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void mutationWithoutKeyIsForbidden() throws Exception {
        assertEquals(403, create(null).statusCode());
        assertEquals(403, create("wrong").statusCode());
        assertEquals(0, deps.taskRegistry().getTotalTasks());
    }

    @Test
    void mutationWithKeySucceeds() throws Exception {
        assertEquals(201, create("s3cret").statusCode());
        assertEquals(1, deps.taskRegistry().getTotalTasks());
    }

    @Test
    void readsNeedNoKey() throws Exception {
        HttpResponse<String> response = httpClient.send(
                HttpRequest.newBuilder().uri(URI.create(baseUrl + "/api/v1/tasks/count")).GET().build(),
                HttpResponse.BodyHandlers.ofString());
        assertEquals(200, response.statusCode());
    }
}
