package com.example.reelreply.domain;

import java.util.List;
import java.util.Locale;

/**
 * Immutable reply rule for one reel: which keywords trigger a reply and what to post.
 *
 * An empty keyword list, or the single keyword {@value #MATCH_ALL}, matches every comment.
 */
public record Rule(String targetId,
                   List<String> keywords,
                   String replyText,
                   String privateReplyText,
                   boolean enabled) {

    public static final String MATCH_ALL = ".";

    public Rule {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    /**
     * Case-insensitive substring match of any keyword against the comment text.
     */
    public boolean matches(String commentText) {
        if (matchesEverything()) {
            return true;
        }
        String text = commentText == null ? "" : commentText.toLowerCase(Locale.ROOT);
        return keywords.stream()
                .anyMatch(keyword -> text.contains(keyword.toLowerCase(Locale.ROOT)));
    }

    public boolean matchesEverything() {
        return keywords.isEmpty() || (keywords.size() == 1 && MATCH_ALL.equals(keywords.get(0)));
    }

    /** An enabled rule needs reply text; a disabled one is always valid. */
    public boolean isValid() {
        return !enabled || (replyText != null && !replyText.isBlank());
    }

    public boolean hasPrivateReply() {
        return privateReplyText != null && !privateReplyText.isBlank();
    }
}
