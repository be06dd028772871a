package com.kincircle.trust.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Documents the principal headers so Swagger UI can send them on mutating calls.
 */
@Configuration
public class OpenApiConfig {

    private static final String ID_SCHEME = "principalId";
    private static final String ROLE_SCHEME = "principalRole";

    @Bean
    public OpenAPI trustCoreOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("KinCircle Trust Core API")
                        .description("Session lock, PIN credentials, access control, rate limits, redaction")
                        .version("v1"))
                .components(new Components()
                        .addSecuritySchemes(ID_SCHEME, header(PrincipalArgumentResolver.ID_HEADER))
                        .addSecuritySchemes(ROLE_SCHEME, header(PrincipalArgumentResolver.ROLE_HEADER)))
                .addSecurityItem(new SecurityRequirement().addList(ID_SCHEME).addList(ROLE_SCHEME));
    }

    private static SecurityScheme header(String name) {
        return new SecurityScheme()
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .name(name);
    }
}
