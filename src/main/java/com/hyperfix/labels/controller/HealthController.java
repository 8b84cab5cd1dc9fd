package com.hyperfix.labels.controller;

import com.hyperfix.labels.admin.RunRegistry;
import com.hyperfix.labels.service.normalization.LabelNormalizer;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
public class HealthController {
    private final LabelNormalizer labelNormalizer;
    private final RunRegistry runRegistry;

    public HealthController(LabelNormalizer labelNormalizer, RunRegistry runRegistry) {
        this.labelNormalizer = labelNormalizer;
        this.runRegistry = runRegistry;
    }

    @GetMapping("/healthz")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromCallable(() -> Map.<String, Object>of(
                        "ok", Boolean.TRUE,
                        "brands", labelNormalizer.getBrandCatalog().size(),
                        "runs", runRegistry.size()))
                .map(ResponseEntity::ok)
                .onErrorReturn(ResponseEntity.status(500).body(Map.<String, Object>of("ok", Boolean.FALSE)));
    }
}
