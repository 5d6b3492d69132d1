package uk.gegc.assessment.shared.config;

import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups, one per feature area.
 */
@Configuration
public class OpenApiGroupConfig {

    @Bean
    public GroupedOpenApi authoringGroup() {
        return GroupedOpenApi.builder()
                .group("authoring")
                .displayName("Tests & Drafts")
                .pathsToMatch("/api/v1/tests/**", "/api/v1/drafts/**")
                .build();
    }

    @Bean
    public GroupedOpenApi attemptsGroup() {
        return GroupedOpenApi.builder()
                .group("attempts")
                .displayName("Test Attempts & Snapshots")
                .pathsToMatch("/api/v1/attempts/**", "/api/v1/students/**")
                .build();
    }
}
