package in.candlevault.infrastructure.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.candlevault.domain.error.FailureKind;
import in.candlevault.domain.error.SourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Shared HTTP GET + JSON helper used by adapters through composition.
 *
 * Failure mapping:
 * - 429, 418: RATE_LIMITED
 * - 401, 403: AUTH_ERROR
 * - 5xx, connection errors: UNAVAILABLE
 * - request timeout: TIMEOUT
 * - other 4xx, unparsable body: MALFORMED_RESPONSE
 */
public class ProviderHttpClient {
    private static final Logger log = LoggerFactory.getLogger(ProviderHttpClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public ProviderHttpClient(Duration requestTimeout) {
        this(HttpClient.newBuilder().connectTimeout(requestTimeout).build(), requestTimeout);
    }

    public ProviderHttpClient(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    /**
     * GET {@code baseUrl + path + ?query} and parse the body as JSON.
     */
    public JsonNode getJson(String sourceId, String baseUrl, String path,
                            Map<String, String> query, Map<String, String> headers) {
        URI uri = URI.create(baseUrl + path + toQueryString(query));
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(requestTimeout)
            .header("Accept", "application/json")
            .GET();
        headers.forEach(builder::header);

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new SourceException(sourceId, FailureKind.TIMEOUT, "request timed out: " + uri.getPath(), e);
        } catch (IOException e) {
            throw new SourceException(sourceId, FailureKind.UNAVAILABLE, "I/O error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceException(sourceId, FailureKind.UNAVAILABLE, "interrupted", e);
        }

        int status = response.statusCode();
        if (status != 200) {
            FailureKind kind = classifyStatus(status);
            String retryAfter = response.headers().firstValue("Retry-After").orElse(null);
            log.warn("[{}] HTTP {} on {} ({}){}", sourceId, status, uri.getPath(), kind,
                retryAfter != null ? " retry-after=" + retryAfter + "s" : "");
            throw new SourceException(sourceId, kind, "HTTP " + status + ": " + abbreviate(response.body()));
        }

        try {
            return MAPPER.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new SourceException(sourceId, FailureKind.MALFORMED_RESPONSE,
                "unparsable body: " + abbreviate(response.body()), e);
        }
    }

    static FailureKind classifyStatus(int status) {
        if (status == 429 || status == 418) {
            return FailureKind.RATE_LIMITED;
        }
        if (status == 401 || status == 403) {
            return FailureKind.AUTH_ERROR;
        }
        if (status >= 500) {
            return FailureKind.UNAVAILABLE;
        }
        return FailureKind.MALFORMED_RESPONSE;
    }

    private static String toQueryString(Map<String, String> query) {
        if (query.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("&", "?", "");
        query.forEach((k, v) -> joiner.add(k + "=" + URLEncoder.encode(v, StandardCharsets.UTF_8)));
        return joiner.toString();
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }
}
