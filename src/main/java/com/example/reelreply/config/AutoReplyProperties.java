package com.example.reelreply.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Central configuration for the auto-reply engine.
 * Maps to the 'reel-autoreply' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "reel-autoreply")
public class AutoReplyProperties {

    private MonitoringConfig monitoring = new MonitoringConfig();
    private ContentConfig content = new ContentConfig();

    @Data
    public static class MonitoringConfig {
        private int defaultIntervalSeconds = 300;
        private int minIntervalSeconds = 60;
        private boolean resumeOnStartup = true;
        /** Key of the persisted statistics row. */
        private String scope = "default";
        private int itemFetchParallelism = 4;
        private int itemTimeoutSeconds = 120;
    }

    @Data
    public static class ContentConfig {
        private ContentMode mode = ContentMode.GRAPH;
        private String baseUrl = "https://graph.facebook.com";
        private String apiVersion = "v20.0";
        /** The page replies are posted as. */
        private String pageId = "";
        private String accessToken = "";
        private int reelsLimit = 25;
        private int commentsLimit = 100;
        private int repliesLimit = 100;
        private int connectTimeoutSeconds = 10;
        private int readTimeoutSeconds = 30;
        private int callTimeoutSeconds = 60;
    }

    public enum ContentMode {
        GRAPH, MOCK
    }
}
