package com.chicu.agentpulse.ecosystem;

import com.chicu.agentpulse.common.retry.RateLimitedException;
import com.chicu.agentpulse.common.retry.RetryPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class ColosseumEcosystemClient implements EcosystemClient {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient http;
    private final ObjectMapper objectMapper;
    private final EcosystemProperties props;
    private final RetryPolicy retryPolicy;

    public ColosseumEcosystemClient(OkHttpClient baseClient,
                                    ObjectMapper objectMapper,
                                    EcosystemProperties props,
                                    RetryPolicy retryPolicy) {
        this.http = baseClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(200, props.getConnectTimeoutMs())))
                .readTimeout(Duration.ofMillis(Math.max(500, props.getReadTimeoutMs())))
                .build();
        this.objectMapper = objectMapper;
        this.props = props;
        this.retryPolicy = retryPolicy;
    }

    // =====================================================
    // READ (без ретраев)
    // =====================================================

    @Override
    public List<ProjectSnapshot> fetchProjects() {
        int pageSize = Math.max(1, props.getPageSize());
        List<ProjectSnapshot> out = new ArrayList<>();

        for (int page = 0; page < Math.max(1, props.getMaxPages()); page++) {
            JsonNode root = get("/projects?limit=" + pageSize + "&offset=" + (page * pageSize));
            JsonNode items = root.has("projects") ? root.path("projects") : root;

            int n = 0;
            for (JsonNode p : items) {
                out.add(toProject(p));
                n++;
            }
            if (n < pageSize) break;
        }
        return out;
    }

    @Override
    public List<ForumPostSnapshot> fetchForumPosts(String sort, int limit) {
        String s = (sort == null || sort.isBlank()) ? "new" : sort.trim();
        JsonNode root = get("/forum/posts?sort=" + s + "&limit=" + Math.max(1, limit));
        JsonNode items = root.has("posts") ? root.path("posts") : root;

        List<ForumPostSnapshot> out = new ArrayList<>();
        for (JsonNode p : items) out.add(toPost(p));
        return out;
    }

    @Override
    public List<ForumPostSnapshot> fetchOwnPosts(int limit) {
        JsonNode root = get("/forum/me/posts?sort=new&limit=" + Math.max(1, limit));
        JsonNode items = root.has("posts") ? root.path("posts") : root;

        List<ForumPostSnapshot> out = new ArrayList<>();
        for (JsonNode p : items) out.add(toPost(p));
        return out;
    }

    @Override
    public List<ForumComment> fetchComments(long postId, int limit) {
        JsonNode root = get("/forum/posts/" + postId + "/comments?sort=new&limit=" + Math.max(1, limit));
        JsonNode items = root.has("comments") ? root.path("comments") : root;

        List<ForumComment> out = new ArrayList<>();
        for (JsonNode c : items) out.add(toComment(postId, c));
        return out;
    }

    // =====================================================
    // WRITE (ретрай только на 429)
    // =====================================================

    @Override
    public long createPost(NewForumPost post) {
        JsonNode res = retryPolicy.execute("forum-post", () -> send("/forum/posts", post));
        JsonNode node = res.has("post") ? res.path("post") : res;
        long id = node.path("id").asLong(-1);
        log.info("📝 Forum post created id={} title='{}'", id, post.title());
        return id;
    }

    @Override
    public void voteForProject(long projectId) {
        retryPolicy.execute("project-vote", () -> send("/projects/" + projectId + "/vote", Map.of("value", 1)));
        log.info("🗳 Voted for project {}", projectId);
    }

    @Override
    public long createComment(long postId, String body) {
        JsonNode res = retryPolicy.execute("forum-comment",
                () -> send("/forum/posts/" + postId + "/comments", Map.of("body", body)));
        JsonNode node = res.has("comment") ? res.path("comment") : res;
        long id = node.path("id").asLong(-1);
        log.info("💬 Comment created id={} on post {}", id, postId);
        return id;
    }

    // =====================================================
    // transport
    // =====================================================

    private JsonNode get(String path) {
        return execute("GET", path, request(path).get().build());
    }

    private JsonNode send(String path, Object body) {
        try {
            String json = objectMapper.writeValueAsString(body);
            return execute("POST", path, request(path).post(RequestBody.create(json, JSON)).build());
        } catch (IOException e) {
            throw new EcosystemException("ecosystem serialization error: " + path + " -> " + e.getMessage(), e);
        }
    }

    private Request.Builder request(String path) {
        Request.Builder rb = new Request.Builder()
                .url(props.getBaseUrl().replaceAll("/+$", "") + path);
        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
            rb.header("Authorization", "Bearer " + props.getApiKey().trim());
        }
        if (props.getAgentId() != null && !props.getAgentId().isBlank()) {
            rb.header("X-Agent-Id", props.getAgentId().trim());
        }
        return rb;
    }

    private JsonNode execute(String method, String path, Request req) {
        try (Response resp = http.newCall(req).execute()) {
            String respBody = resp.body() != null ? resp.body().string() : "";

            if (resp.code() == 429) {
                log.warn("🌐 Ecosystem rate limited: {} {}", method, path);
                throw new RateLimitedException("ecosystem rate limit on " + method + " " + path);
            }
            if (!resp.isSuccessful()) {
                log.warn("🌐 Ecosystem error: {} {} -> {} body={}", method, path, resp.code(), shrink(respBody));
                throw new EcosystemException("ecosystem HTTP " + resp.code() + " on " + path + ": " + shrink(respBody), resp.code());
            }
            if (respBody.isBlank()) {
                return objectMapper.createObjectNode();
            }
            return objectMapper.readTree(respBody);

        } catch (IOException e) {
            throw new EcosystemException("ecosystem IO error: " + method + " " + path + " -> " + e.getMessage(), e);
        }
    }

    // =====================================================
    // mapping
    // =====================================================

    private static ProjectSnapshot toProject(JsonNode p) {
        int votes = p.has("humanUpvotes") || p.has("agentUpvotes")
                ? p.path("humanUpvotes").asInt(0) + p.path("agentUpvotes").asInt(0)
                : p.path("upvotes").asInt(p.path("votes").asInt(0));

        return ProjectSnapshot.builder()
                .id(p.path("id").asLong())
                .name(text(p, "name"))
                .slug(text(p, "slug"))
                .tagline(text(p, "tagline"))
                .description(text(p, "description"))
                .repoLink(firstText(p, "repoLink", "githubUrl"))
                .demoLink(firstText(p, "technicalDemoLink", "demoUrl", "presentationLink"))
                .videoLink(firstText(p, "presentationLink", "videoUrl"))
                .votes(votes)
                .createdAt(instant(text(p, "createdAt")))
                .build();
    }

    private static ForumPostSnapshot toPost(JsonNode p) {
        List<String> tags = new ArrayList<>();
        for (JsonNode t : p.path("tags")) tags.add(t.asText());

        return ForumPostSnapshot.builder()
                .id(p.path("id").asLong())
                .title(text(p, "title"))
                .body(text(p, "body"))
                .agentName(firstText(p, "agentName", "author"))
                .upvotes(p.path("upvotes").asInt(p.path("score").asInt(0)))
                .commentCount(p.path("commentCount").asInt(0))
                .tags(tags)
                .createdAt(instant(text(p, "createdAt")))
                .build();
    }

    private static ForumComment toComment(long postId, JsonNode c) {
        return ForumComment.builder()
                .id(c.path("id").asLong())
                .postId(c.path("postId").asLong(postId))
                .body(text(c, "body"))
                .agentName(firstText(c, "agentName", "author"))
                .agentId(text(c, "agentId"))
                .deleted(c.path("isDeleted").asBoolean(false))
                .createdAt(instant(text(c, "createdAt")))
                .build();
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n.path(field);
        return (v.isMissingNode() || v.isNull()) ? null : v.asText();
    }

    private static String firstText(JsonNode n, String... fields) {
        for (String f : fields) {
            String v = text(n, f);
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }

    private static Instant instant(String s) {
        if (s == null || s.isBlank()) return null;
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String shrink(String s) {
        if (s == null) return "null";
        String x = s.trim().replaceAll("\\s+", " ");
        if (x.length() <= 300) return x;
        return x.substring(0, 300) + "...";
    }
}
