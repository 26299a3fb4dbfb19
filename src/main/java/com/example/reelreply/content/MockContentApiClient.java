package com.example.reelreply.content;

import com.example.reelreply.domain.Comment;
import com.example.reelreply.domain.ContentItem;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Canned reels and comments for trying rules without a real credential.
 * Replies posted here show up as nested replies on the next fetch, so
 * already-replied detection behaves as it does against the real platform.
 */
@Slf4j
public class MockContentApiClient implements ContentApiClient {

    public static final String DEFAULT_PAGE_ID = "123456789";

    private final String pageId;
    private final Clock clock;
    private final Instant seededAt;
    private final Map<String, List<Comment>> postedReplies = new ConcurrentHashMap<>();
    private final List<String> privateMessages = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    public MockContentApiClient(String pageId, Clock clock) {
        this.pageId = pageId == null || pageId.isBlank() ? DEFAULT_PAGE_ID : pageId;
        this.clock = clock;
        this.seededAt = clock.instant();
    }

    @Override
    public String accountId() {
        return pageId;
    }

    @Override
    public List<ContentItem> listContentItems() {
        log.info("[MOCK] Fetching reels");
        return List.of(
                new ContentItem("1001", "Welcome to our community! Check out this amazing video.", ago(Duration.ofHours(2))),
                new ContentItem("1002", "Behind the scenes of our latest project.", ago(Duration.ofHours(5))),
                new ContentItem("1003", "Quick tutorial on how to use our product.", ago(Duration.ofDays(1))),
                new ContentItem("1004", "Customer success story - hear from our users!", ago(Duration.ofDays(2))),
                new ContentItem("1005", null, ago(Duration.ofDays(3))));
    }

    @Override
    public List<Comment> listComments(String contentItemId) {
        log.info("[MOCK] Fetching comments for {}", contentItemId);
        return switch (contentItemId) {
            case "1001" -> List.of(
                    comment("c1001", "Great content! Keep it up!", "u1", "John Doe", Duration.ofMinutes(30)),
                    comment("c1002", "Love this!", "u2", "Jane Smith", Duration.ofHours(1)),
                    comment("c1003", "Thanks for sharing", "u3", "Bob Johnson", Duration.ofHours(2)));
            case "1002" -> List.of(
                    comment("c2001", "Amazing behind the scenes!", "u4", "Alice Brown", Duration.ofHours(3)),
                    comment("c2002", "hello world", "u5", "Charlie Wilson", Duration.ofHours(4)));
            case "1003" -> List.of(
                    comment("c3001", "Very helpful tutorial, thank you!", "u6", "Diana Martinez", Duration.ofDays(1)));
            default -> List.of();
        };
    }

    @Override
    public PostResult postReply(String commentId, String text) {
        String id = "mock-reply-" + sequence.incrementAndGet();
        postedReplies.computeIfAbsent(commentId, key -> new CopyOnWriteArrayList<>())
                .add(new Comment(id, text, pageId, "Mock Page", clock.instant(), List.of()));
        log.info("[MOCK] Replied to {}: {}", commentId, text);
        return PostResult.created(id);
    }

    @Override
    public PostResult postPrivateMessage(String commentId, String text) {
        if (privateMessages.contains(commentId)) {
            return PostResult.alreadyReplied();
        }
        privateMessages.add(commentId);
        log.info("[MOCK] Private reply to {}: {}", commentId, text);
        return PostResult.created("mock-message-" + sequence.incrementAndGet());
    }

    private Comment comment(String id, String text, String authorId, String authorName, Duration age) {
        List<Comment> replies = new ArrayList<>(postedReplies.getOrDefault(id, List.of()));
        return new Comment(id, text, authorId, authorName, ago(age), replies);
    }

    private Instant ago(Duration age) {
        return seededAt.minus(age);
    }
}
