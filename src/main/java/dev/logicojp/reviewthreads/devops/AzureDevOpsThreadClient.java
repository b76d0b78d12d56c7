package dev.logicojp.reviewthreads.devops;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.logicojp.reviewthreads.config.AzureDevOpsConfig;
import dev.logicojp.reviewthreads.config.HttpConfig;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * {@link ThreadClient} backed by the Azure DevOps pull request threads REST API.
 *
 * <p>Every call is a single synchronous HTTP request. Non-2xx responses are
 * turned into {@link ThreadApiException}; nothing is retried.</p>
 */
@Singleton
public class AzureDevOpsThreadClient implements ThreadClient {

    private static final Logger logger = LoggerFactory.getLogger(AzureDevOpsThreadClient.class);

    private final AzureDevOpsConfig config;
    private final HttpConfig httpConfig;
    private final HttpClient http;
    private final ObjectMapper mapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Inject
    public AzureDevOpsThreadClient(AzureDevOpsConfig config, HttpConfig httpConfig) {
        this(config, httpConfig, HttpClient.newBuilder()
            .connectTimeout(httpConfig.connectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build());
    }

    AzureDevOpsThreadClient(AzureDevOpsConfig config, HttpConfig httpConfig, HttpClient http) {
        this.config = config;
        this.httpConfig = httpConfig;
        this.http = http;
    }

    @Override
    public CreatedThread createThread(PullRequestRef pullRequest, String content, ThreadAnchor anchor) {
        String url = config.buildApiUrl(pullRequest.repoId(), "pullRequests", pullRequest.prId(), "threads");
        String body = writeJson(buildCreateThreadBody(content, anchor));
        logger.debug("Creating thread on PR {}{}", pullRequest.prId(),
            anchor == null ? "" : " anchored to " + anchor.filePath());

        JsonNode response = readJson(send(request(url).POST(HttpRequest.BodyPublishers.ofString(body)), url));
        JsonNode comments = response.path("comments");
        if (!response.hasNonNull("id") || !comments.isArray() || comments.isEmpty()
            || !comments.get(0).hasNonNull("id")) {
            throw new ThreadApiException("Unexpected create-thread response from " + url,
                ThreadApiException.NO_RESPONSE);
        }
        return new CreatedThread(response.get("id").asLong(), comments.get(0).path("id").asLong());
    }

    @Override
    public void patchComment(PullRequestRef pullRequest, long threadId, long commentId, String content,
                             boolean dryRun) {
        String url = config.buildApiUrl(pullRequest.repoId(), "pullRequests", pullRequest.prId(),
            "threads", threadId, "comments", commentId);
        if (dryRun) {
            logger.info("[DRY RUN] Would update comment {} on thread {} of PR {}",
                commentId, threadId, pullRequest.prId());
            return;
        }
        ObjectNode body = mapper.createObjectNode().put("content", content);
        send(request(url).method("PATCH", HttpRequest.BodyPublishers.ofString(writeJson(body))), url);
        logger.debug("Updated comment {} on thread {}", commentId, threadId);
    }

    @Override
    public void patchThreadStatus(PullRequestRef pullRequest, long threadId, ThreadStatus status, boolean dryRun) {
        String url = config.buildApiUrl(pullRequest.repoId(), "pullRequests", pullRequest.prId(),
            "threads", threadId);
        if (dryRun) {
            logger.info("[DRY RUN] Would set thread {} of PR {} to '{}'", threadId, pullRequest.prId(), status);
            return;
        }
        ObjectNode body = mapper.createObjectNode().put("status", status.value());
        send(request(url).method("PATCH", HttpRequest.BodyPublishers.ofString(writeJson(body))), url);
        logger.debug("Set thread {} status to {}", threadId, status);
    }

    ObjectNode buildCreateThreadBody(String content, ThreadAnchor anchor) {
        ObjectNode body = mapper.createObjectNode();
        ArrayNode comments = body.putArray("comments");
        comments.addObject()
            .put("content", content)
            .put("commentType", "text");
        body.put("status", ThreadStatus.ACTIVE.value());
        if (anchor != null) {
            ObjectNode context = body.putObject("threadContext");
            context.put("filePath", anchor.filePath());
            if (anchor.hasLines()) {
                context.putObject("rightFileStart").put("line", anchor.startLine()).put("offset", 1);
                int end = anchor.endLine() != null ? anchor.endLine() : anchor.startLine();
                context.putObject("rightFileEnd").put("line", end).put("offset", 1);
            }
        }
        return body;
    }

    private HttpRequest.Builder request(String url) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
            .timeout(httpConfig.requestTimeout())
            .header("Content-Type", "application/json")
            .header("Accept", "application/json");
        if (config.hasToken()) {
            String credentials = Base64.getEncoder()
                .encodeToString((":" + config.token()).getBytes(StandardCharsets.UTF_8));
            builder.header("Authorization", "Basic " + credentials);
        }
        return builder;
    }

    private String send(HttpRequest.Builder builder, String url) {
        HttpResponse<String> response;
        try {
            response = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ThreadApiException("Request to " + url + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ThreadApiException("Request to " + url + " was interrupted", e);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new ThreadApiException(
                "HTTP %d from %s: %s".formatted(status, url, abbreviate(response.body())), status);
        }
        return response.body();
    }

    private String writeJson(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize request body", e);
        }
    }

    private JsonNode readJson(String body) {
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ThreadApiException("Malformed JSON response: " + e.getOriginalMessage(), e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }
}
