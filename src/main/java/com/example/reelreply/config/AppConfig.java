package com.example.reelreply.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

@Configuration
public class AppConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Every content API call goes through this client, so the call timeout is
     * the upper bound on how long a single network step can stall a cycle.
     */
    @Bean
    public OkHttpClient okHttpClient(AutoReplyProperties properties) {
        AutoReplyProperties.ContentConfig content = properties.getContent();
        return new OkHttpClient.Builder()
                .connectTimeout(content.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(content.getReadTimeoutSeconds(), TimeUnit.SECONDS)
                .writeTimeout(content.getReadTimeoutSeconds(), TimeUnit.SECONDS)
                .callTimeout(content.getCallTimeoutSeconds(), TimeUnit.SECONDS)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
