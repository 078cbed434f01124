package com.rulewise.core.fetch;

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
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Reads rule documents through the GitHub repository contents API.
 *
 * <p>Requests ask for the raw media type, so the response body is the file
 * itself rather than a base64 JSON envelope. A token is optional; without one
 * GitHub applies the anonymous rate limit.
 */
public class GitHubContentSource implements ContentSource {

    private static final Logger log = LoggerFactory.getLogger(GitHubContentSource.class);

    static final String RAW_MEDIA_TYPE = "application/vnd.github.raw";
    static final String API_VERSION = "2022-11-28";

    private final ContentSourceId sourceId;
    private final String apiUrl;
    private final String token;
    private final Duration requestTimeout;
    private final HttpClient httpClient;

    public GitHubContentSource(ContentSourceId sourceId, String apiUrl, String token, Duration requestTimeout) {
        this.sourceId = sourceId;
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.token = token == null ? "" : token.trim();
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public byte[] read(String path, String ref) {
        var uri = contentUri(path, ref);
        var builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .header("Accept", RAW_MEDIA_TYPE)
                .header("X-GitHub-Api-Version", API_VERSION)
                .header("User-Agent", "rulewise")
                .GET();
        if (!token.isEmpty()) {
            builder.header("Authorization", "Bearer " + token);
        }

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw new TransientContentException("Timed out reading %s after %d ms"
                    .formatted(path, requestTimeout.toMillis()), path, e);
        } catch (IOException e) {
            throw new TransientContentException("Network error reading %s: %s".formatted(path, e.getMessage()), path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContentSourceException("Interrupted reading " + path, path, e);
        }

        int status = response.statusCode();
        log.debug("GET {} -> HTTP {}", uri, status);
        if (status == 200) {
            return response.body();
        }
        if (status == 404) {
            throw new ContentNotFoundException(path);
        }
        if (status == 429 || (status == 403 && isRateLimited(response))) {
            throw new TransientContentException("Rate limited reading %s (HTTP %d)".formatted(path, status), path);
        }
        if (status >= 500) {
            throw new TransientContentException("Server error reading %s (HTTP %d)".formatted(path, status), path);
        }
        throw new ContentSourceException("Reading %s failed (HTTP %d): %s"
                .formatted(path, status, abbreviate(new String(response.body(), StandardCharsets.UTF_8))), path);
    }

    @Override
    public String describe() {
        return "github:" + sourceId;
    }

    URI contentUri(String path, String ref) {
        String encodedPath = Arrays.stream(path.split("/"))
                .filter(segment -> !segment.isEmpty())
                .map(GitHubContentSource::encode)
                .collect(Collectors.joining("/"));
        return URI.create("%s/repos/%s/%s/contents/%s?ref=%s"
                .formatted(apiUrl, sourceId.owner(), sourceId.repo(), encodedPath, encode(ref)));
    }

    private static boolean isRateLimited(HttpResponse<?> response) {
        return response.headers().firstValue("x-ratelimit-remaining").map("0"::equals).orElse(false)
                || response.headers().firstValue("retry-after").isPresent();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String abbreviate(String body) {
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }
}
