package com.mirrorgroups.insights.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient for the remote language model used by narrative synthesis.
 */
@Configuration
@Slf4j
public class WebClientConfig {

    @Bean
    public WebClient languageModelWebClient(WebClient.Builder builder, GroupInsightsProperties properties) {
        GroupInsightsProperties.Synthesis synthesis = properties.getSynthesis();

        WebClient.Builder configured = builder
            .baseUrl(synthesis.getEndpoint())
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(2 * 1024 * 1024));

        if (StringUtils.hasText(synthesis.getApiKey())) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + synthesis.getApiKey());
        }

        log.info("Language model client configured: endpoint={}, remoteEnabled={}",
            synthesis.getEndpoint(), synthesis.isRemoteEnabled());
        return configured.build();
    }
}
