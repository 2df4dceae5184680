package com.fixforge.core.platform;

import com.fixforge.core.config.FixforgeProperties;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.GitHubBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

/**
 * Creates the GitHub client when a token is configured. Without one no
 * {@link PlatformClient} bean exists and platform features are unavailable.
 */
@Configuration
@ConditionalOnExpression("'${fixforge.github.token:}' != ''")
public class PlatformConfig {

    private static final Logger log = LoggerFactory.getLogger(PlatformConfig.class);

    @Bean
    public PlatformClient platformClient(FixforgeProperties properties) throws IOException {
        var github = properties.getGithub();
        var builder = new GitHubBuilder().withOAuthToken(github.getToken());
        if (github.getApiUrl() != null && !github.getApiUrl().isBlank()) {
            builder = builder.withEndpoint(github.getApiUrl());
        }
        GitHub client = builder.build();
        log.info("GitHub client configured");
        return new GitHubPlatformClient(client, properties.getTriage().getFriendlyLabels());
    }
}
