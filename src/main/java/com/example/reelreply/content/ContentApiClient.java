package com.example.reelreply.content;

import com.example.reelreply.domain.Comment;
import com.example.reelreply.domain.ContentItem;

import java.util.List;

/**
 * Remote content source the monitoring engine reads reels and comments from and posts replies to.
 * Every call may fail with a {@link ContentApiException}.
 */
public interface ContentApiClient {

    /** Id of the account replies are posted as. */
    String accountId();

    List<ContentItem> listContentItems();

    /**
     * Comments on a reel. Each returned comment has its {@code nestedReplies} populated with every
     * direct reply the platform currently shows; callers never fetch replies separately.
     */
    List<Comment> listComments(String contentItemId);

    PostResult postReply(String commentId, String text);

    /** Best effort private message addressed to the author of a comment. */
    PostResult postPrivateMessage(String commentId, String text);
}
