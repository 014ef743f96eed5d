package com.vibecoding.karmadadashboard.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibecoding.karmadadashboard.fga.OpenFgaAuthorizer;
import com.vibecoding.karmadadashboard.fga.RelationshipAuthorizer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OPENFGA_API_URL 이 비어 있으면 RelationshipAuthorizer 빈을 만들지 않는다 (FGA 비활성)
 */
@Configuration
@ConditionalOnExpression("'${dashboard.openfga.api-url:}' != ''")
public class OpenFgaConfig {

    @Bean
    public RelationshipAuthorizer relationshipAuthorizer(DashboardProperties properties, ObjectMapper objectMapper) {
        DashboardProperties.OpenFga openfga = properties.getOpenfga();
        OpenFgaAuthorizer authorizer = new OpenFgaAuthorizer(openfga.getApiUrl(), openfga.getStoreName(), objectMapper);
        authorizer.initialize();
        return authorizer;
    }
}
