package com.example.reelreply.controller;

import com.example.reelreply.content.ContentApiClient;
import com.example.reelreply.domain.Comment;
import com.example.reelreply.domain.ContentItem;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Read-only view of reels and their comments, for choosing rule targets.
 */
@RestController
@RequestMapping("/api/content")
@RequiredArgsConstructor
public class ContentController {

    private final ContentApiClient contentApiClient;

    @GetMapping("/items")
    public ResponseEntity<List<ContentItem>> listItems() {
        return ResponseEntity.ok(contentApiClient.listContentItems());
    }

    @GetMapping("/items/{itemId}/comments")
    public ResponseEntity<List<Comment>> listComments(@PathVariable String itemId) {
        return ResponseEntity.ok(contentApiClient.listComments(itemId));
    }
}
