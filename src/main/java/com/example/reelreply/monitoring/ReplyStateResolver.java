package com.example.reelreply.monitoring;

import com.example.reelreply.domain.Comment;
import org.springframework.stereotype.Component;

/**
 * Decides whether an account has already replied to a comment, using only the nested
 * replies fetched with the comment. The platform is the record of what was posted;
 * no local ledger is kept.
 */
@Component
public class ReplyStateResolver {

    /**
     * @throws UnpopulatedRepliesException when the comment's replies were never populated
     */
    public boolean hasAccountReplied(Comment comment, String accountId) {
        if (!comment.repliesPopulated()) {
            throw new UnpopulatedRepliesException(comment.id());
        }
        if (accountId == null || accountId.isBlank() || comment.nestedReplies().isEmpty()) {
            return false;
        }
        return comment.nestedReplies().stream()
                .anyMatch(reply -> accountId.equals(reply.authorId()));
    }
}
