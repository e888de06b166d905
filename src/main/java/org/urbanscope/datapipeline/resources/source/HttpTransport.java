package org.urbanscope.datapipeline.resources.source;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.OptionalLong;

/**
 * Single HTTP GET. Separates the wire from retry and pacing logic.
 */
@FunctionalInterface
public interface HttpTransport {

    /**
     * Response of one attempt.
     *
     * @param status            HTTP status code
     * @param body              response body decoded as UTF-8
     * @param retryAfterSeconds value of a numeric {@code Retry-After} header, if present
     */
    record Response(int status, String body, OptionalLong retryAfterSeconds) {
    }

    Response get(URI uri) throws IOException, InterruptedException;

    /**
     * Transport over {@link HttpClient}.
     */
    static HttpTransport jdk(Duration timeout, String userAgent) {
        HttpClient client = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
        return uri -> {
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Accept", "application/xml,text/xml,text/csv,application/json;q=0.9,*/*;q=0.8")
                .GET()
                .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            OptionalLong retryAfter = OptionalLong.empty();
            String header = response.headers().firstValue("Retry-After").orElse(null);
            if (header != null) {
                try {
                    retryAfter = OptionalLong.of(Long.parseLong(header.trim()));
                } catch (NumberFormatException e) {
                    // HTTP-date form, fall back to computed backoff
                    retryAfter = OptionalLong.empty();
                }
            }
            return new Response(response.statusCode(), response.body(), retryAfter);
        };
    }
}
