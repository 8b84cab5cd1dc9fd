package com.hyperfix.labels.config;

import com.hyperfix.labels.service.PacingPolicy;
import com.hyperfix.labels.service.normalization.BrandCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

import java.util.List;

@Configuration
public class LabelPipelineConfig {
    private static final Logger log = LoggerFactory.getLogger(LabelPipelineConfig.class);

    @Bean
    public BrandCatalog brandCatalog(AppProperties props) {
        BrandCatalog catalog = BrandCatalog.of(props.getBrands());
        if (catalog.isEmpty()) {
            log.warn("app.brands is empty; falling back to the default brand catalog");
            catalog = BrandCatalog.defaults();
        }
        log.info("Brand catalog: {}", catalog.getBrands());
        return catalog;
    }

    @Bean
    public PacingPolicy pacingPolicy(AppProperties props) {
        AppProperties.Pacing pacing = props.getPacing();
        if (pacing == null || !pacing.isEnabled()) {
            return PacingPolicy.none();
        }
        return PacingPolicy.randomBetween(pacing.getMinDelayMs(), pacing.getMaxDelayMs());
    }

    /** The back-office front end runs on another origin and reads the export file name. */
    @Bean
    public CorsWebFilter corsWebFilter() {
        CorsConfiguration cors = new CorsConfiguration();
        cors.setAllowedOriginPatterns(List.of("*"));
        cors.setAllowedMethods(List.of("GET", "POST"));
        cors.setAllowedHeaders(List.of(HttpHeaders.CONTENT_TYPE));
        cors.setExposedHeaders(List.of(HttpHeaders.CONTENT_DISPOSITION));

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", cors);
        return new CorsWebFilter(source);
    }
}
