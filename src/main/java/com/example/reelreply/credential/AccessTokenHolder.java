package com.example.reelreply.credential;

import com.example.reelreply.config.AutoReplyProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Holds the page access token. Starts from configuration and can be replaced at runtime
 * without a restart; the next content API call picks up the new value.
 */
@Slf4j
@Component
public class AccessTokenHolder {

    private volatile String accessToken;
    private volatile String pageId;

    public AccessTokenHolder(AutoReplyProperties properties) {
        this.accessToken = properties.getContent().getAccessToken();
        this.pageId = properties.getContent().getPageId();
    }

    public String getAccessToken() {
        return accessToken;
    }

    public String getPageId() {
        return pageId;
    }

    public void update(String accessToken, String pageId) {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("Access token must not be blank");
        }
        this.accessToken = accessToken.trim();
        if (pageId != null && !pageId.isBlank()) {
            this.pageId = pageId.trim();
        }
        log.info("Access token replaced for page {}", this.pageId);
    }

    /** A token without a page id is not usable: replies could not be attributed. */
    public boolean hasUsableToken() {
        return accessToken != null && !accessToken.isBlank()
                && pageId != null && !pageId.isBlank();
    }
}
