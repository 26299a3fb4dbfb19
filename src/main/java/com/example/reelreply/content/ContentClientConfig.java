package com.example.reelreply.content;

import com.example.reelreply.config.AutoReplyProperties;
import com.example.reelreply.credential.AccessTokenHolder;
import com.example.reelreply.credential.CredentialProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Picks the content source once, at construction time, from {@code reel-autoreply.content.mode}.
 */
@Slf4j
@Configuration
public class ContentClientConfig {

    @Bean
    public ContentApiClient contentApiClient(AutoReplyProperties properties, OkHttpClient httpClient,
                                             ObjectMapper objectMapper, AccessTokenHolder tokenHolder,
                                             Clock clock) {
        AutoReplyProperties.ContentConfig content = properties.getContent();
        log.info("Content source: {}", content.getMode());
        return switch (content.getMode()) {
            case GRAPH -> new GraphContentApiClient(httpClient, objectMapper, content, tokenHolder);
            case MOCK -> new MockContentApiClient(content.getPageId(), clock);
        };
    }

    @Bean
    public CredentialProvider credentialProvider(AutoReplyProperties properties, AccessTokenHolder tokenHolder) {
        return switch (properties.getContent().getMode()) {
            case GRAPH -> tokenHolder::hasUsableToken;
            case MOCK -> () -> true;
        };
    }
}
