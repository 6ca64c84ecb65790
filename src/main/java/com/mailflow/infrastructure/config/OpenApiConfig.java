package com.mailflow.infrastructure.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.StringSchema;
import org.springdoc.core.customizers.OperationCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    private static final String DEFAULT_SERVICE_TYPE = "gmail";

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Mailflow API")
                        .version("1.0")
                        .description("Mailbox sync status, one-shot fetches, watch management and the Pub/Sub push endpoint"));
    }

    @Bean
    public OperationCustomizer defaultServiceTypeParameter() {
        return (operation, handlerMethod) -> {
            if (operation.getParameters() != null) {
                operation.getParameters().stream()
                        .filter(p -> "serviceType".equals(p.getName()))
                        .forEach(p -> {
                            StringSchema schema = new StringSchema();
                            schema.setDefault(DEFAULT_SERVICE_TYPE);
                            schema.setExample(DEFAULT_SERVICE_TYPE);
                            p.setSchema(schema);
                            p.setExample(DEFAULT_SERVICE_TYPE);
                        });
            }
            return operation;
        };
    }
}
