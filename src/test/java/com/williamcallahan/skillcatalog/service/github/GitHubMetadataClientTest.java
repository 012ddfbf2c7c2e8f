package com.williamcallahan.skillcatalog.service.github;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withResourceNotFound;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.skillcatalog.config.AppProperties;
import com.williamcallahan.skillcatalog.domain.RepositoryIdentity;
import com.williamcallahan.skillcatalog.domain.RepositoryMetadata;
import com.williamcallahan.skillcatalog.domain.ingestion.RepositoryFile;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

/**
 * Verifies REST and GraphQL response handling of the metadata client against a mock server.
 */
class GitHubMetadataClientTest {

    private MockRestServiceServer server;

    private GitHubMetadataClient client(String token) {
        MockServerRestTemplateCustomizer customizer = new MockServerRestTemplateCustomizer();
        GitHubMetadataClient client = new GitHubMetadataClient(
                new RestTemplateBuilder(customizer), new ObjectMapper(), new AppProperties(), token);
        server = customizer.getServer();
        return client;
    }

    @Test
    void parsesRestRepository() {
        GitHubMetadataClient client = client("");
        server.expect(requestTo("https://api.github.com/repos/acme/notes"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        {"stargazers_count": 42, "forks_count": 3, "fork": false,
                         "pushed_at": "2025-05-01T10:00:00Z", "description": "Notes skill",
                         "topics": ["Notes", "writing"], "default_branch": "main"}
                        """, MediaType.APPLICATION_JSON));

        RepositoryMetadata metadata = client.fetchRepository("acme", "notes").orElseThrow();

        assertEquals(42, metadata.stars());
        assertEquals(3, metadata.forks());
        assertFalse(metadata.fork());
        assertEquals(Instant.parse("2025-05-01T10:00:00Z"), metadata.pushedAt());
        assertEquals(List.of("notes", "writing"), metadata.topics());
        assertEquals("main", metadata.defaultBranch());
        server.verify();
    }

    @Test
    void missingRepositoryIsEmpty() {
        GitHubMetadataClient client = client("");
        server.expect(requestTo("https://api.github.com/repos/acme/gone")).andRespond(withResourceNotFound());

        assertTrue(client.fetchRepository("acme", "gone").isEmpty());
    }

    @Test
    void nonTransientFailureIsRaisedWithoutRetry() {
        GitHubMetadataClient client = client("token");
        server.expect(requestTo("https://api.github.com/repos/acme/notes"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED).body("{\"message\":\"Bad credentials\"}"));

        GitHubApiException failure =
                assertThrows(GitHubApiException.class, () -> client.fetchRepository("acme", "notes"));

        assertEquals(401, failure.statusCode());
        assertFalse(failure.isTransient());
        server.verify();
    }

    @Test
    void decodesBase64FileContent() {
        GitHubMetadataClient client = client("");
        String encoded = Base64.getEncoder().encodeToString("# Notes\n".getBytes());
        server.expect(requestTo("https://api.github.com/repos/acme/notes/contents/SKILL.md"))
                .andRespond(withSuccess("{\"type\":\"file\",\"path\":\"SKILL.md\",\"sha\":\"abc\",\"size\":8,"
                        + "\"encoding\":\"base64\",\"content\":\"" + encoded + "\"}", MediaType.APPLICATION_JSON));

        RepositoryFile file = client.fetchFile("acme", "notes", "SKILL.md").orElseThrow();

        assertEquals("# Notes\n", file.text());
        assertEquals("abc", file.sha());
    }

    @Test
    void latestCommitShaComesFromFirstCommit() {
        GitHubMetadataClient client = client("");
        server.expect(requestTo("https://api.github.com/repos/acme/notes/commits?per_page=1"))
                .andRespond(withSuccess("[{\"sha\":\"commit-1\"},{\"sha\":\"commit-0\"}]", MediaType.APPLICATION_JSON));

        assertEquals(Optional.of("commit-1"), client.fetchLatestCommitSha("acme", "notes", ""));
    }

    @Test
    void graphqlBatchSkipsUnresolvedAliases() {
        GitHubMetadataClient client = client("token");
        server.expect(requestTo("https://api.github.com/graphql"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer token"))
                .andRespond(withSuccess("""
                        {"data": {
                            "repo0": {"stargazerCount": 120, "forkCount": 4, "isFork": false,
                                      "pushedAt": "2025-04-01T00:00:00Z", "description": null,
                                      "defaultBranchRef": {"name": "main"},
                                      "repositoryTopics": {"nodes": [{"topic": {"name": "AI"}}]}},
                            "repo1": null},
                         "errors": [{"type": "NOT_FOUND", "path": ["repo1"]}]}
                        """, MediaType.APPLICATION_JSON));

        Map<String, RepositoryMetadata> results = client.fetchRepositories(List.of(
                RepositoryIdentity.of("acme", "notes"),
                RepositoryIdentity.of("acme", "gone"),
                RepositoryIdentity.of("acme", "notes", "nested")));

        assertEquals(1, results.size());
        RepositoryMetadata notes = results.get("acme/notes");
        assertEquals(120, notes.stars());
        assertEquals(List.of("ai"), notes.topics());
        server.verify();
    }

    @Test
    void batchLookupWithoutTokenMakesNoCalls() {
        GitHubMetadataClient client = client("");

        assertTrue(client.fetchRepositories(List.of(RepositoryIdentity.of("acme", "notes"))).isEmpty());
        server.verify();
    }
}
