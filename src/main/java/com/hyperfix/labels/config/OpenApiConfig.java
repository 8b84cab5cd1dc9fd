package com.hyperfix.labels.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("HyperFix Label Normalizer API")
                        .version("0.1.0")
                        .description("Spring Boot WebFlux API that corrects retail product labels into BRAND PRODUCT QUANTITY form."));
    }

    @Bean
    public OpenApiCustomizer labelTagsCustomizer() {
        return openAPI -> {
            if (openAPI.getPaths() == null) return;
            openAPI.addTagsItem(new Tag().name("labels").description("Single-label correction, import and export"));
            openAPI.addTagsItem(new Tag().name("batch").description("Background batch runs with SSE progress"));
            openAPI.getPaths().forEach((path, item) -> {
                String tag = path.startsWith("/batch") ? "batch" : path.startsWith("/labels") ? "labels" : null;
                if (tag == null) return;
                item.readOperations().forEach(op -> op.addTagsItem(tag));
            });
        };
    }
}
