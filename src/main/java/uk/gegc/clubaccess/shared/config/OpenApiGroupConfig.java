package uk.gegc.clubaccess.shared.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups for the admin back-office.
 */
@Configuration
public class OpenApiGroupConfig {

    @Bean
    public OpenAPI clubAccessOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Club Access Admin API")
                        .description("Grant, extend, revoke and refund paid club access")
                        .version("v1"))
                .components(new Components()
                        .addSecuritySchemes("Bearer Authentication", new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")));
    }

    @Bean
    public GroupedOpenApi accessGroup() {
        return GroupedOpenApi.builder()
                .group("access")
                .displayName("Access Grants & Subscriptions")
                .pathsToMatch(
                        "/api/v1/admin/access-grants/**",
                        "/api/v1/admin/orders/*/grant-access",
                        "/api/v1/admin/subscriptions/**"
                )
                .build();
    }

    @Bean
    public GroupedOpenApi refundsGroup() {
        return GroupedOpenApi.builder()
                .group("refunds")
                .displayName("Refunds")
                .pathsToMatch("/api/v1/admin/orders/*/refunds")
                .build();
    }

    @Bean
    public GroupedOpenApi auditGroup() {
        return GroupedOpenApi.builder()
                .group("audit")
                .displayName("Audit Trail")
                .pathsToMatch("/api/v1/admin/audit/**")
                .build();
    }
}
