package com.example.reelreply.content;

import com.example.reelreply.config.AutoReplyProperties;
import com.example.reelreply.credential.AccessTokenHolder;
import com.example.reelreply.domain.Comment;
import com.example.reelreply.domain.ContentItem;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Graph API implementation of {@link ContentApiClient}.
 *
 * Comments are requested with an embedded, summarized reply edge. When the summary reports
 * more replies than were embedded, the comment's own reply edge is paged through before the
 * comment is returned.
 */
@Slf4j
public class GraphContentApiClient implements ContentApiClient {

    private static final MediaType JSON = MediaType.get("application/json");
    private static final DateTimeFormatter GRAPH_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ");
    private static final String REPLY_FIELDS = "id,message,from,created_time";
    private static final int MAX_REPLY_PAGES = 50;
    static final int MAX_ERROR_BODY = 500;
    static final int ALREADY_REPLIED_CODE = 10900;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AutoReplyProperties.ContentConfig config;
    private final AccessTokenHolder tokenHolder;

    public GraphContentApiClient(OkHttpClient httpClient, ObjectMapper objectMapper,
                                 AutoReplyProperties.ContentConfig config, AccessTokenHolder tokenHolder) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.config = config;
        this.tokenHolder = tokenHolder;
    }

    @Override
    public String accountId() {
        return tokenHolder.getPageId();
    }

    @Override
    public List<ContentItem> listContentItems() {
        HttpUrl url = endpoint(accountId(), "video_reels")
                .addQueryParameter("fields", "id,description,updated_time")
                .addQueryParameter("limit", String.valueOf(config.getReelsLimit()))
                .build();
        JsonNode body = execute(new Request.Builder().url(url).get().build());

        List<ContentItem> items = new ArrayList<>();
        for (JsonNode node : body.path("data")) {
            items.add(new ContentItem(
                    node.path("id").asText(),
                    textOrNull(node, "description"),
                    parseTime(textOrNull(node, "updated_time"))));
        }
        log.debug("Fetched {} reels for page {}", items.size(), accountId());
        return items;
    }

    @Override
    public List<Comment> listComments(String contentItemId) {
        HttpUrl url = endpoint(contentItemId, "comments")
                .addQueryParameter("fields", commentFields())
                .addQueryParameter("limit", String.valueOf(config.getCommentsLimit()))
                .build();
        JsonNode body = execute(new Request.Builder().url(url).get().build());

        List<Comment> comments = new ArrayList<>();
        for (JsonNode node : body.path("data")) {
            comments.add(parseComment(node));
        }
        return comments;
    }

    @Override
    public PostResult postReply(String commentId, String text) {
        HttpUrl url = endpoint(commentId, "comments").build();
        RequestBody form = new FormBody.Builder().add("message", text).build();
        JsonNode body = execute(new Request.Builder().url(url).post(form).build());
        return PostResult.created(textOrNull(body, "id"));
    }

    @Override
    public PostResult postPrivateMessage(String commentId, String text) {
        HttpUrl url = endpoint(accountId(), "messages").build();
        try {
            String json = objectMapper.writeValueAsString(Map.of(
                    "recipient", Map.of("comment_id", commentId),
                    "message", Map.of("text", text)));
            JsonNode body = execute(new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(json, JSON))
                    .build());
            return PostResult.created(textOrNull(body, "message_id"));
        } catch (ContentApiException e) {
            if (e.getErrorCode() != null && e.getErrorCode() == ALREADY_REPLIED_CODE) {
                log.info("Private reply for comment {} already sent", commentId);
                return PostResult.alreadyReplied();
            }
            throw e;
        } catch (IOException e) {
            throw new ContentApiException("Failed to encode private reply: " + e.getMessage(), e);
        }
    }

    private Comment parseComment(JsonNode node) {
        String id = node.path("id").asText();
        JsonNode replyEdge = node.path("comments");

        List<Comment> replies = new ArrayList<>();
        for (JsonNode reply : replyEdge.path("data")) {
            replies.add(parseReply(reply));
        }

        long total = replyEdge.path("summary").path("total_count").asLong(replies.size());
        if (total > replies.size()) {
            log.debug("Comment {} shows {} of {} replies, fetching the rest", id, replies.size(), total);
            replies = fetchAllReplies(id);
        }

        JsonNode from = node.path("from");
        return new Comment(
                id,
                node.path("message").asText(""),
                textOrNull(from, "id"),
                textOrNull(from, "name"),
                parseTime(textOrNull(node, "created_time")),
                replies);
    }

    private Comment parseReply(JsonNode node) {
        JsonNode from = node.path("from");
        return new Comment(
                node.path("id").asText(),
                node.path("message").asText(""),
                textOrNull(from, "id"),
                textOrNull(from, "name"),
                parseTime(textOrNull(node, "created_time")),
                List.of());
    }

    private List<Comment> fetchAllReplies(String commentId) {
        List<Comment> replies = new ArrayList<>();
        HttpUrl url = endpoint(commentId, "comments")
                .addQueryParameter("fields", REPLY_FIELDS)
                .addQueryParameter("limit", String.valueOf(config.getRepliesLimit()))
                .build();

        for (int page = 0; url != null && page < MAX_REPLY_PAGES; page++) {
            JsonNode body = execute(new Request.Builder().url(url).get().build());
            for (JsonNode reply : body.path("data")) {
                replies.add(parseReply(reply));
            }
            String next = textOrNull(body.path("paging"), "next");
            url = next != null ? HttpUrl.parse(next) : null;
        }
        return replies;
    }

    private String commentFields() {
        return "id,message,from,created_time,updated_time,"
                + "comments.limit(" + config.getRepliesLimit() + ").summary(true){" + REPLY_FIELDS + "}";
    }

    private HttpUrl.Builder endpoint(String objectId, String edge) {
        HttpUrl base = HttpUrl.parse(config.getBaseUrl());
        if (base == null) {
            throw new ContentApiException(0, null, "Invalid Graph API base URL: " + config.getBaseUrl());
        }
        return base.newBuilder()
                .addPathSegment(config.getApiVersion())
                .addPathSegment(objectId)
                .addPathSegment(edge)
                .addQueryParameter("access_token", tokenHolder.getAccessToken());
    }

    private JsonNode execute(Request request) {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String raw = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw toException(response.code(), raw);
            }
            return objectMapper.readTree(raw.isBlank() ? "{}" : raw);
        } catch (IOException e) {
            throw new ContentApiException("Graph API request failed: " + e.getMessage(), e);
        }
    }

    private ContentApiException toException(int status, String raw) {
        try {
            JsonNode error = objectMapper.readTree(raw).path("error");
            if (!error.isMissingNode()) {
                Integer code = error.hasNonNull("code") ? error.get("code").asInt() : null;
                String message = error.path("message").asText("HTTP " + status);
                log.debug("Graph API error: status={}, code={}, type={}, message={}",
                        status, code, error.path("type").asText(), message);
                return new ContentApiException(status, code, message);
            }
        } catch (IOException e) {
            log.debug("Unparseable Graph API error body: {}", raw);
        }
        return new ContentApiException(status, null, "HTTP " + status + ": " + abbreviate(raw));
    }

    static String abbreviate(String raw) {
        return raw.length() <= MAX_ERROR_BODY ? raw : raw.substring(0, MAX_ERROR_BODY) + "...";
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() ? value.asText() : null;
    }

    static Instant parseTime(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value, GRAPH_TIME).toInstant();
        } catch (DateTimeParseException e) {
            return OffsetDateTime.parse(value).toInstant();
        }
    }
}
