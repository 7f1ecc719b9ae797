package com.vidnyan.guardian.adapter.out.sink;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Minimal GitHub REST client: posts pull request comments through the issues API.
 */
public class GitHubCommentClient {

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final String apiUrl;
    private final String token;
    private final String owner;
    private final String repo;

    public GitHubCommentClient(HttpClient http, ObjectMapper mapper, String apiUrl, String token, String repository) {
        String[] parts = repository.split("/");
        if (parts.length != 2) {
            throw new IllegalArgumentException("repository must be owner/repo");
        }
        this.http = http;
        this.mapper = mapper;
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.token = token;
        this.owner = parts[0];
        this.repo = parts[1];
    }

    public static HttpClient defaultHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(20))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /** Post a PR comment (issues API). */
    public void postIssueComment(int prNumber, String body) throws IOException, InterruptedException {
        String url = String.format("%s/repos/%s/%s/issues/%d/comments", apiUrl, owner, repo, prNumber);
        String json = mapper.writeValueAsString(new CommentBody(body));

        HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                .timeout(Duration.ofSeconds(30))
                .header("Authorization", "Bearer " + token)
                .header("Accept", "application/vnd.github+json")
                .header("X-GitHub-Api-Version", "2022-11-28")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        ensureOk(resp);
    }

    /** Throws on non-2xx responses. */
    private void ensureOk(HttpResponse<?> resp) throws IOException {
        if (resp.statusCode() >= 300) {
            throw new IOException("GitHub API error " + resp.statusCode() + ": " + resp.body());
        }
    }

    record CommentBody(String body) {}
}
