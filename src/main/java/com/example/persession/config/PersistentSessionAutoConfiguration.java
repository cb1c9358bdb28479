package com.example.persession.config;

import com.example.persession.PersistentSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Paths;

@AutoConfiguration
@ConditionalOnClass(WebClient.class)
@EnableConfigurationProperties(SessionProperties.class)
public class PersistentSessionAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PersistentSessionAutoConfiguration.class);

    // close() runs when the context shuts down, which is the AT_EXIT save point
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "persession", name = "enabled", havingValue = "true")
    public PersistentSession persistentSession(SessionProperties properties) {
        log.info("Creating persistent session (cache type {}, timeout {})",
                properties.getCacheType(), properties.getCacheTimeout());
        return PersistentSession.builder()
                .cacheFilePath(properties.getCacheFilePath() != null ? Paths.get(properties.getCacheFilePath()) : null)
                .cacheTimeout(properties.getCacheTimeout())
                .cacheType(properties.getCacheType())
                .proxies(properties.getProxies())
                .userAgent(properties.getUserAgent())
                .verbose(properties.isVerbose())
                .build();
    }
}
