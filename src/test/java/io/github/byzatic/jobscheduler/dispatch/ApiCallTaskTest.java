package io.github.byzatic.jobscheduler.dispatch;

import com.sun.net.httpserver.HttpServer;
import io.github.byzatic.jobscheduler.base_exceptions.JobExecutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ApiCallTaskTest {
    HttpServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        respond("/uuid", 200, "{\"uuid\": \"2f1c8c3e-8e7e-4c1d-9d0b-6a1f3c2b7e11\"}");
        respond("/broken", 500, "{\"error\": \"down\"}");
        respond("/html", 200, "<html>hello</html>");
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void respond(String path, int status, String body) {
        server.createContext(path, exchange -> {
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
    }

    private ApiCallTask task(String path) {
        URI uri = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path);
        return new ApiCallTask.Builder().endpoint(uri).timeout(Duration.ofSeconds(5)).build();
    }

    @Test
    void jsonResponseSucceeds() throws Exception {
        task("/uuid").execute("job-1");
    }

    @Test
    void errorStatusFails() {
        ApiCallTask t = task("/broken");
        JobExecutionException e = assertThrows(JobExecutionException.class, () -> t.execute("job-1"));
        assertEquals("HTTP 500 from " + t.getEndpoint(), e.getMessage());
    }

    @Test
    void nonJsonBodyFails() {
        ApiCallTask t = task("/html");
        JobExecutionException e = assertThrows(JobExecutionException.class, () -> t.execute("job-1"));
        assertTrue(e.getMessage().contains("is not JSON"));
    }

    @Test
    void defaultsPointAtPublicEndpoint() {
        assertEquals(URI.create("https://httpbin.org/uuid"), new ApiCallTask().getEndpoint());
    }
}
