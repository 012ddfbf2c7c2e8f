package com.williamcallahan.skillcatalog.service.github;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.Lists;
import com.williamcallahan.skillcatalog.config.AppProperties;
import com.williamcallahan.skillcatalog.domain.RepositoryIdentity;
import com.williamcallahan.skillcatalog.domain.RepositoryMetadata;
import com.williamcallahan.skillcatalog.domain.ingestion.RepositoryFile;
import com.williamcallahan.skillcatalog.domain.ingestion.RepositoryTreeEntry;
import com.williamcallahan.skillcatalog.support.RetrySupport;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * GitHub REST and GraphQL client for repository metadata and skill content.
 *
 * <p>Single lookups go through REST and are retried on transient failures. Batch lookups use
 * GraphQL with up to fifty aliased {@code repository(owner:, name:)} sub-queries per request and
 * are not retried here; callers fall back to the data they already have.</p>
 */
@Service
public class GitHubMetadataClient implements RepositoryMetadataClient {
    private static final Logger log = LoggerFactory.getLogger(GitHubMetadataClient.class);

    private static final String ACCEPT_JSON = "application/vnd.github+json";
    private static final String API_VERSION_HEADER = "X-GitHub-Api-Version";
    private static final String API_VERSION = "2022-11-28";
    private static final String REPOSITORY_FIELDS = "stargazerCount forkCount isFork pushedAt description "
            + "defaultBranchRef { name } repositoryTopics(first: 10) { nodes { topic { name } } }";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String apiBaseUrl;
    private final String githubToken;
    private final int graphqlBatchSize;
    private final int maxAttempts;

    public GitHubMetadataClient(
            RestTemplateBuilder restTemplateBuilder,
            ObjectMapper objectMapper,
            AppProperties appProperties,
            @Value("${GITHUB_TOKEN:}") String githubToken) {
        AppProperties.GitHub github = appProperties.getGithub();
        this.restTemplate = restTemplateBuilder
                .connectTimeout(github.getConnectTimeout())
                .readTimeout(github.getReadTimeout())
                .build();
        this.objectMapper = objectMapper;
        this.apiBaseUrl = trimTrailingSlash(github.getApiBaseUrl());
        this.githubToken = githubToken;
        this.graphqlBatchSize = github.getGraphqlBatchSize();
        this.maxAttempts = github.getMaxAttempts();
        if (!hasToken()) {
            log.warn("GITHUB_TOKEN is not set; REST calls are unauthenticated and batch lookups are disabled");
        }
    }

    @Override
    public Optional<RepositoryMetadata> fetchRepository(String owner, String name) {
        URI uri = UriComponentsBuilder.fromUriString(apiBaseUrl)
                .pathSegment("repos", owner, name)
                .build()
                .encode()
                .toUri();
        return withRetry(() -> getJson(uri), "GitHub repo " + owner + "/" + name)
                .map(this::parseRestRepository);
    }

    @Override
    public Optional<RepositoryFile> fetchFile(String owner, String name, String path) {
        URI uri = UriComponentsBuilder.fromUriString(apiBaseUrl)
                .pathSegment("repos", owner, name, "contents")
                .pathSegment(path.split("/"))
                .build()
                .encode()
                .toUri();
        Optional<JsonNode> response = withRetry(() -> getJson(uri), "GitHub contents " + owner + "/" + name + "/" + path);
        if (response.isEmpty() || !response.get().isObject() || !"file".equals(response.get().path("type").asText())) {
            return Optional.empty();
        }
        JsonNode file = response.get();
        String text = null;
        if ("base64".equals(file.path("encoding").asText()) && file.hasNonNull("content")) {
            byte[] decoded = Base64.getMimeDecoder().decode(file.get("content").asText());
            text = new String(decoded, StandardCharsets.UTF_8);
        }
        return Optional.of(new RepositoryFile(
                file.path("path").asText(path), file.path("sha").asText(null), file.path("size").asLong(0), text));
    }

    @Override
    public Optional<String> fetchLatestCommitSha(String owner, String name, String path) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(apiBaseUrl)
                .pathSegment("repos", owner, name, "commits")
                .queryParam("per_page", 1);
        if (path != null && !path.isBlank()) {
            builder.queryParam("path", path);
        }
        URI uri = builder.build().encode().toUri();
        return withRetry(() -> getJson(uri), "GitHub commits " + owner + "/" + name)
                .filter(JsonNode::isArray)
                .filter(commits -> commits.size() > 0)
                .map(commits -> commits.get(0).path("sha").asText(null));
    }

    @Override
    public List<RepositoryTreeEntry> fetchTree(String owner, String name, String ref) {
        URI uri = UriComponentsBuilder.fromUriString(apiBaseUrl)
                .pathSegment("repos", owner, name, "git", "trees", ref)
                .queryParam("recursive", 1)
                .build()
                .encode()
                .toUri();
        Optional<JsonNode> response = withRetry(() -> getJson(uri), "GitHub tree " + owner + "/" + name);
        if (response.isEmpty()) {
            return List.of();
        }
        if (response.get().path("truncated").asBoolean(false)) {
            log.info("Tree for {}/{} was truncated by the provider; collecting from the partial listing", owner, name);
        }
        List<RepositoryTreeEntry> entries = new ArrayList<>();
        for (JsonNode node : response.get().path("tree")) {
            if ("blob".equals(node.path("type").asText())) {
                entries.add(new RepositoryTreeEntry(
                        node.path("path").asText(), node.path("size").asLong(0), node.path("sha").asText(null)));
            }
        }
        return entries;
    }

    @Override
    public Map<String, RepositoryMetadata> fetchRepositories(List<RepositoryIdentity> identities) {
        Map<String, RepositoryMetadata> results = new LinkedHashMap<>();
        if (identities.isEmpty()) {
            return results;
        }
        if (!hasToken()) {
            log.warn("Skipping batch metadata lookup for {} repositories: GITHUB_TOKEN is not set", identities.size());
            return results;
        }
        Map<String, RepositoryIdentity> distinct = new LinkedHashMap<>();
        for (RepositoryIdentity identity : identities) {
            distinct.putIfAbsent(identity.repoKey(), identity);
        }
        for (List<RepositoryIdentity> batch : Lists.partition(new ArrayList<>(distinct.values()), graphqlBatchSize)) {
            results.putAll(fetchGraphqlBatch(batch));
        }
        return results;
    }

    private Map<String, RepositoryMetadata> fetchGraphqlBatch(List<RepositoryIdentity> batch) {
        StringBuilder query = new StringBuilder("query {");
        for (int index = 0; index < batch.size(); index++) {
            RepositoryIdentity identity = batch.get(index);
            query.append(" repo").append(index)
                    .append(": repository(owner: ").append(quote(identity.owner()))
                    .append(", name: ").append(quote(identity.name()))
                    .append(") { ").append(REPOSITORY_FIELDS).append(" }");
        }
        query.append(" }");

        ObjectNode body = objectMapper.createObjectNode().put("query", query.toString());
        URI uri = UriComponentsBuilder.fromUriString(apiBaseUrl).path("/graphql").build().toUri();
        JsonNode response = exchange(uri, HttpMethod.POST, body.toString())
                .orElseThrow(() -> new GitHubApiException("GraphQL endpoint returned 404", HttpStatus.NOT_FOUND.value()));

        JsonNode errors = response.path("errors");
        if (errors.isArray() && errors.size() > 0) {
            // Missing repositories come back as per-alias NOT_FOUND errors next to partial data.
            log.debug("GraphQL batch of {} reported {} errors", batch.size(), errors.size());
        }
        Map<String, RepositoryMetadata> results = new LinkedHashMap<>();
        JsonNode data = response.path("data");
        for (int index = 0; index < batch.size(); index++) {
            JsonNode repository = data.path("repo" + index);
            if (repository.isObject()) {
                results.put(batch.get(index).repoKey(), parseGraphqlRepository(repository));
            }
        }
        return results;
    }

    private RepositoryMetadata parseRestRepository(JsonNode repository) {
        List<String> topics = new ArrayList<>();
        for (JsonNode topic : repository.path("topics")) {
            topics.add(topic.asText().toLowerCase(Locale.ROOT));
        }
        return new RepositoryMetadata(
                repository.path("stargazers_count").asInt(0),
                repository.path("forks_count").asInt(0),
                repository.path("fork").asBoolean(false),
                parseInstant(repository.path("pushed_at").asText(null)),
                textOrNull(repository.path("description")),
                topics,
                textOrNull(repository.path("default_branch")));
    }

    private RepositoryMetadata parseGraphqlRepository(JsonNode repository) {
        List<String> topics = new ArrayList<>();
        for (JsonNode node : repository.path("repositoryTopics").path("nodes")) {
            String topic = node.path("topic").path("name").asText(null);
            if (topic != null) {
                topics.add(topic.toLowerCase(Locale.ROOT));
            }
        }
        return new RepositoryMetadata(
                repository.path("stargazerCount").asInt(0),
                repository.path("forkCount").asInt(0),
                repository.path("isFork").asBoolean(false),
                parseInstant(repository.path("pushedAt").asText(null)),
                textOrNull(repository.path("description")),
                topics,
                textOrNull(repository.path("defaultBranchRef").path("name")));
    }

    private Optional<JsonNode> getJson(URI uri) {
        return exchange(uri, HttpMethod.GET, null);
    }

    private Optional<JsonNode> exchange(URI uri, HttpMethod method, String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.ACCEPT, ACCEPT_JSON);
        headers.set(API_VERSION_HEADER, API_VERSION);
        if (hasToken()) {
            headers.setBearerAuth(githubToken);
        }
        if (body != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        try {
            ResponseEntity<String> response =
                    restTemplate.exchange(uri, method, new HttpEntity<>(body, headers), String.class);
            String responseBody = response.getBody();
            if (responseBody == null || responseBody.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readTree(responseBody));
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return Optional.empty();
            }
            throw new GitHubApiException(
                    "GitHub " + method + " " + uri.getPath() + " failed with " + e.getStatusCode().value() + ": "
                            + summarize(e.getResponseBodyAsString()),
                    e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new GitHubApiException("GitHub " + method + " " + uri.getPath() + " I/O failure: " + e.getMessage(), 0, e);
        } catch (JsonProcessingException e) {
            throw new GitHubApiException("GitHub " + method + " " + uri.getPath() + " returned malformed JSON", 502, e);
        }
    }

    private <T> T withRetry(Supplier<T> call, String operationName) {
        return RetrySupport.executeWithRetry(
                call, operationName, GitHubApiException::isTransient, maxAttempts, RetrySupport.DEFAULT_INITIAL_BACKOFF);
    }

    private boolean hasToken() {
        return githubToken != null && !githubToken.isBlank();
    }

    private String quote(String value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("String literal is not serializable", e);
        }
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable timestamp {}", value);
            return null;
        }
    }

    private static String textOrNull(JsonNode node) {
        return node.isTextual() && !node.asText().isBlank() ? node.asText() : null;
    }

    private static String summarize(String body) {
        if (body == null) {
            return "";
        }
        String flattened = body.replaceAll("\\s+", " ").trim();
        return flattened.length() > 200 ? flattened.substring(0, 200) + "..." : flattened;
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
