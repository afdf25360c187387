package com.ascend.modsync.sync.http;

import com.ascend.modsync.config.ModSyncProperties;
import com.ascend.modsync.sync.model.HttpFetchResult;
import com.ascend.modsync.sync.util.ReasonCodeClassifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;

@Service
public class CurseForgeModClient implements ModMetadataClient {
    private static final Logger log = LoggerFactory.getLogger(CurseForgeModClient.class);

    private final ModSyncProperties.Upstream properties;
    private final ObjectMapper objectMapper;
    private final UpstreamQuotaTracker quotaTracker;
    private final HttpClient client;

    public CurseForgeModClient(
        ModSyncProperties properties,
        ObjectMapper objectMapper,
        UpstreamQuotaTracker quotaTracker,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties.getUpstream();
        this.objectMapper = objectMapper;
        this.quotaTracker = quotaTracker;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(this.properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    @Override
    public JsonNode fetchOne(String key) {
        String apiKey = properties.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new UpstreamPermanentException(
                ReasonCodeClassifier.MISSING_API_KEY + ": upstream API key is not configured", 0);
        }
        String url = properties.getBaseUrl() + "/mods/" + URLEncoder.encode(key, StandardCharsets.UTF_8);
        HttpFetchResult result = executeOnce(url, apiKey);
        quotaTracker.update(result.rateLimitRemaining(), result.rateLimitReset());
        if (!result.isSuccessful()) {
            UpstreamException failure = ReasonCodeClassifier.toException(result);
            log.debug("GET {} failed after {}ms: {}",
                result.requestedUrl(), result.duration().toMillis(), failure.getMessage());
            throw failure;
        }
        log.debug("GET {} -> {} in {}ms", result.requestedUrl(), result.statusCode(), result.duration().toMillis());
        return extractData(key, result.body());
    }

    private HttpFetchResult executeOnce(String url, String apiKey) {
        Instant startedAt = Instant.now();
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", "application/json")
                .header("x-api-key", apiKey)
                .GET()
                .build();
            HttpResponse<String> response = client.send(
                request,
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8)
            );
            return new HttpFetchResult(
                url,
                response.statusCode(),
                response.body(),
                response.headers().firstValue("Retry-After").orElse(null),
                UpstreamQuotaTracker.parseRemaining(response.headers().firstValue("X-RateLimit-Remaining").orElse(null)),
                UpstreamQuotaTracker.parseReset(response.headers().firstValue("X-RateLimit-Reset").orElse(null)),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (IllegalArgumentException e) {
            throw new UpstreamPermanentException("invalid upstream url: " + url, 0);
        }
    }

    private JsonNode extractData(String key, String body) {
        if (body == null || body.isBlank()) {
            throw new UpstreamPermanentException(ReasonCodeClassifier.PARSING_FAILED + ": empty body", 200);
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode data = root == null ? null : root.get("data");
            if (data == null || data.isNull() || data.isMissingNode()) {
                throw new UpstreamPermanentException(
                    ReasonCodeClassifier.PARSING_FAILED + ": response for mod " + key + " has no data", 200);
            }
            return data;
        } catch (JsonProcessingException e) {
            throw new UpstreamPermanentException(ReasonCodeClassifier.PARSING_FAILED + ": " + e.getOriginalMessage(), 200);
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            0,
            null,
            null,
            null,
            null,
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }
}
