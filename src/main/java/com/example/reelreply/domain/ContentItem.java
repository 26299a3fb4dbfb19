package com.example.reelreply.domain;

import java.time.Instant;

/**
 * A monitored reel that comments are attached to.
 */
public record ContentItem(String id, String description, Instant updatedAt) {
}
