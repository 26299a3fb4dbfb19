package com.example.reelreply;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Reel Auto-Reply - keyword-triggered replies for comments on video reels.
 *
 * Architecture:
 * - Rules → operator-defined keywords and reply text, one per reel
 * - Content API → Graph API (or mock) client for reels, comments and replies
 * - Cycle Executor → one pass of "check everything, reply where due"
 * - Scheduler → start/stop lifecycle, recurring timer, runtime interval changes
 * - Statistics → checks, replies and last error, persisted across restarts
 * - Metrics → per-cycle history rows with summary and aggregate queries
 */
@SpringBootApplication
@EnableScheduling
public class ReelReplyApplication {

    public static void main(String[] args) {
        System.out.println("""
            ╔══════════════════════════════════════════════════╗
            ║         Reel Auto-Reply v0.1.0                   ║
            ║         Comment monitoring engine                ║
            ╚══════════════════════════════════════════════════╝
            """);
        SpringApplication.run(ReelReplyApplication.class, args);
    }
}
