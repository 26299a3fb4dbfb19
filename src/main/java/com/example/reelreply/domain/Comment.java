package com.example.reelreply.domain;

import java.time.Instant;
import java.util.List;

/**
 * Read-only snapshot of a comment as fetched from the content API.
 *
 * @param authorId      may be null when the platform withholds the author
 * @param nestedReplies direct replies already posted under this comment; null means the
 *                      content API did not populate them, which is different from "no replies"
 */
public record Comment(String id,
                      String text,
                      String authorId,
                      String authorName,
                      Instant createdAt,
                      List<Comment> nestedReplies) {

    public Comment {
        nestedReplies = nestedReplies == null ? null : List.copyOf(nestedReplies);
    }

    public boolean repliesPopulated() {
        return nestedReplies != null;
    }
}
