package io.github.byzatic.jobscheduler.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.Beta;
import io.github.byzatic.jobscheduler.base_exceptions.JobExecutionException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * Calls an HTTP endpoint with GET and expects a JSON body.
 * <p>
 * A non-2xx status or a body that is not JSON fails the execution.
 */
@Beta
public final class ApiCallTask implements JobTask {
    private final static Logger logger = LoggerFactory.getLogger(ApiCallTask.class);

    public static final URI DEFAULT_ENDPOINT = URI.create("https://httpbin.org/uuid");
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final URI endpoint;
    private final Duration timeout;
    private final HttpClient client;
    private final ObjectMapper mapper;

    private ApiCallTask(Builder b) {
        this.endpoint = b.endpoint;
        this.timeout = b.timeout;
        this.client = b.client != null
                ? b.client
                : HttpClient.newBuilder().connectTimeout(b.timeout).build();
        this.mapper = b.mapper != null ? b.mapper : new ObjectMapper();
    }

    public ApiCallTask() {
        this(new Builder());
    }

    @Override
    public void execute(@NotNull String jobId) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            logger.error("API call failed for job {}: HTTP {} from {}", jobId, status, endpoint);
            throw new JobExecutionException("HTTP " + status + " from " + endpoint);
        }
        JsonNode body;
        try {
            body = mapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new JobExecutionException("Response from " + endpoint + " is not JSON", e);
        }
        logger.info("API call successful for job {}: {}", jobId, body);
    }

    public @NotNull URI getEndpoint() {
        return endpoint;
    }

    public static final class Builder {
        private URI endpoint = DEFAULT_ENDPOINT;
        private Duration timeout = DEFAULT_TIMEOUT;
        private HttpClient client;
        private ObjectMapper mapper;

        public Builder endpoint(URI endpoint) {
            this.endpoint = Objects.requireNonNull(endpoint);
            return this;
        }

        /**
         * Connect and request timeout.
         */
        public Builder timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout);
            return this;
        }

        /**
         * Provide your own HTTP client; the timeout still applies to each request.
         */
        public Builder client(HttpClient client) {
            this.client = client;
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        public ApiCallTask build() {
            return new ApiCallTask(this);
        }
    }
}
