package com.example.reelreply.content;

import com.example.reelreply.config.AutoReplyProperties;
import com.example.reelreply.credential.AccessTokenHolder;
import com.example.reelreply.domain.Comment;
import com.example.reelreply.domain.ContentItem;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class GraphContentApiClientTest {

    private MockWebServer server;
    private GraphContentApiClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = clientFor(server.url("/").toString());
    }

    private static GraphContentApiClient clientFor(String baseUrl) {
        AutoReplyProperties properties = new AutoReplyProperties();
        properties.getContent().setBaseUrl(baseUrl);
        properties.getContent().setPageId("page1");
        properties.getContent().setAccessToken("token-abc");

        OkHttpClient httpClient = new OkHttpClient.Builder()
                .callTimeout(5, TimeUnit.SECONDS)
                .build();
        return new GraphContentApiClient(httpClient, new ObjectMapper(),
                properties.getContent(), new AccessTokenHolder(properties));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private void enqueueJson(int status, String body) {
        server.enqueue(new MockResponse()
                .setResponseCode(status)
                .setHeader("Content-Type", "application/json")
                .setBody(body));
    }

    @Test
    void listsReelsOfThePage() throws Exception {
        enqueueJson(200, """
                {"data": [
                  {"id": "r1", "description": "First reel", "updated_time": "2026-02-01T10:00:00+0000"},
                  {"id": "r2"}
                ]}
                """);

        List<ContentItem> items = client.listContentItems();

        assertEquals(2, items.size());
        assertEquals("r1", items.get(0).id());
        assertEquals("First reel", items.get(0).description());
        assertEquals(Instant.parse("2026-02-01T10:00:00Z"), items.get(0).updatedAt());
        assertNull(items.get(1).description());

        RecordedRequest request = server.takeRequest();
        assertEquals("GET", request.getMethod());
        assertEquals("/v20.0/page1/video_reels", request.getRequestUrl().encodedPath());
        assertEquals("token-abc", request.getRequestUrl().queryParameter("access_token"));
        assertEquals("25", request.getRequestUrl().queryParameter("limit"));
    }

    @Test
    void commentsCarryTheirEmbeddedReplies() throws Exception {
        enqueueJson(200, """
                {"data": [{
                  "id": "c1", "message": "Thanks a lot!", "created_time": "2026-02-01T10:00:00+0000",
                  "from": {"id": "u1", "name": "Jane"},
                  "comments": {
                    "data": [{"id": "c1r", "message": "You're welcome!", "from": {"id": "page1", "name": "Page"}}],
                    "summary": {"total_count": 1}
                  }
                }]}
                """);

        List<Comment> comments = client.listComments("r1");

        assertEquals(1, comments.size());
        Comment comment = comments.get(0);
        assertEquals("Thanks a lot!", comment.text());
        assertEquals("u1", comment.authorId());
        assertEquals("Jane", comment.authorName());
        assertTrue(comment.repliesPopulated());
        assertEquals("page1", comment.nestedReplies().get(0).authorId());
        assertEquals(1, server.getRequestCount());

        String fields = server.takeRequest().getRequestUrl().queryParameter("fields");
        assertTrue(fields.contains("comments.limit(100).summary(true)"));
    }

    @Test
    void commentWithoutReplyEdgeHasNoReplies() {
        enqueueJson(200, """
                {"data": [{"id": "c1", "message": "hello"}]}
                """);

        Comment comment = client.listComments("r1").get(0);

        assertTrue(comment.repliesPopulated());
        assertTrue(comment.nestedReplies().isEmpty());
        assertNull(comment.authorId());
    }

    @Test
    void truncatedRepliesArePagedThrough() throws Exception {
        enqueueJson(200, """
                {"data": [{
                  "id": "c1", "message": "hello", "from": {"id": "u1"},
                  "comments": {
                    "data": [{"id": "x1", "message": "first", "from": {"id": "u2"}}],
                    "summary": {"total_count": 3}
                  }
                }]}
                """);
        String nextPage = server.url("/v20.0/c1/comments?after=cursor2&access_token=token-abc").toString();
        enqueueJson(200, """
                {"data": [
                  {"id": "x1", "message": "first", "from": {"id": "u2"}},
                  {"id": "x2", "message": "second", "from": {"id": "u3"}}
                ],
                 "paging": {"next": "%s"}}
                """.formatted(nextPage));
        enqueueJson(200, """
                {"data": [{"id": "x3", "message": "Hi!", "from": {"id": "page1"}}]}
                """);

        Comment comment = client.listComments("r1").get(0);

        assertEquals(3, comment.nestedReplies().size());
        assertEquals("page1", comment.nestedReplies().get(2).authorId());
        assertEquals(3, server.getRequestCount());

        server.takeRequest();
        assertEquals("/v20.0/c1/comments", server.takeRequest().getRequestUrl().encodedPath());
        assertEquals("cursor2", server.takeRequest().getRequestUrl().queryParameter("after"));
    }

    @Test
    void postReplySendsMessageForm() throws Exception {
        enqueueJson(200, """
                {"id": "c1_reply"}
                """);

        PostResult result = client.postReply("c1", "You're welcome!");

        assertEquals("c1_reply", result.id());
        assertFalse(result.duplicate());
        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/v20.0/c1/comments", request.getRequestUrl().encodedPath());
        String form = request.getBody().readUtf8();
        assertTrue(form.startsWith("message="));
        assertTrue(form.contains("welcome"));
    }

    @Test
    void privateReplyIsSentToPageMessages() throws Exception {
        enqueueJson(200, """
                {"recipient_id": "psid", "message_id": "m_1"}
                """);

        PostResult result = client.postPrivateMessage("c1", "Check your inbox");

        assertEquals("m_1", result.id());
        RecordedRequest request = server.takeRequest();
        assertEquals("/v20.0/page1/messages", request.getRequestUrl().encodedPath());
        String body = request.getBody().readUtf8();
        assertTrue(body.contains("\"comment_id\":\"c1\""));
        assertTrue(body.contains("\"text\":\"Check your inbox\""));
    }

    @Test
    void alreadyAnsweredPrivateReplyIsNotAnError() {
        enqueueJson(400, """
                {"error": {"message": "Activity already replied to", "type": "OAuthException", "code": 10900}}
                """);

        PostResult result = client.postPrivateMessage("c1", "Check your inbox");

        assertTrue(result.duplicate());
    }

    @Test
    void graphErrorCarriesStatusAndCode() {
        enqueueJson(400, """
                {"error": {"message": "Error validating access token: Session has expired", "type": "OAuthException", "code": 190}}
                """);

        ContentApiException error = assertThrows(ContentApiException.class, () -> client.listContentItems());

        assertEquals(400, error.getStatus());
        assertEquals(190, error.getErrorCode());
        assertTrue(error.getMessage().contains("Session has expired"));
    }

    @Test
    void nonJsonErrorKeepsStatus() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("upstream unavailable"));

        ContentApiException error = assertThrows(ContentApiException.class, () -> client.listComments("r1"));

        assertEquals(503, error.getStatus());
        assertNull(error.getErrorCode());
    }

    @Test
    void htmlErrorPageIsShortenedInMessage() {
        String page = "<html><body>" + "Bad Gateway ".repeat(1000) + "</body></html>";
        server.enqueue(new MockResponse().setResponseCode(502).setBody(page));

        ContentApiException error = assertThrows(ContentApiException.class, () -> client.listContentItems());

        assertEquals(502, error.getStatus());
        assertTrue(error.getMessage().startsWith("HTTP 502: <html>"));
        assertTrue(error.getMessage().length() <= "HTTP 502: ".length() + GraphContentApiClient.MAX_ERROR_BODY + 3);
    }

    @Test
    void connectionFailureBecomesContentApiException() throws IOException {
        MockWebServer unreachable = new MockWebServer();
        unreachable.start();
        String baseUrl = unreachable.url("/").toString();
        unreachable.shutdown();
        GraphContentApiClient offline = clientFor(baseUrl);

        ContentApiException error = assertThrows(ContentApiException.class, offline::listContentItems);

        assertEquals(0, error.getStatus());
        assertInstanceOf(IOException.class, error.getCause());
    }

    @Test
    void parsesBothTimestampFormats() {
        assertEquals(Instant.parse("2026-02-01T10:00:00Z"), GraphContentApiClient.parseTime("2026-02-01T10:00:00+0000"));
        assertEquals(Instant.parse("2026-02-01T10:00:00Z"), GraphContentApiClient.parseTime("2026-02-01T12:00:00+02:00"));
        assertNull(GraphContentApiClient.parseTime(null));
    }
}
