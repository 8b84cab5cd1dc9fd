package com.hyperfix.labels.controller;

import com.hyperfix.labels.config.AppProperties;
import com.hyperfix.labels.dto.LabelDtos;
import com.hyperfix.labels.model.LabelRecord;
import com.hyperfix.labels.service.LabelExportService;
import com.hyperfix.labels.service.LabelImportService;
import com.hyperfix.labels.service.normalization.LabelAnalysis;
import com.hyperfix.labels.service.normalization.LabelNormalizer;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/labels")
public class LabelController {
    private final LabelNormalizer normalizer;
    private final LabelImportService importService;
    private final LabelExportService exportService;
    private final AppProperties appProperties;

    public LabelController(LabelNormalizer normalizer,
                           LabelImportService importService,
                           LabelExportService exportService,
                           AppProperties appProperties) {
        this.normalizer = normalizer;
        this.importService = importService;
        this.exportService = exportService;
        this.appProperties = appProperties;
    }

    @PostMapping(value = "/normalize", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<LabelDtos.NormalizeResponse> normalize(@Valid @RequestBody LabelDtos.NormalizeRequest body) {
        String label = body.getLabel();
        return Mono.just(new LabelDtos.NormalizeResponse(label, normalizer.normalize(label)));
    }

    @PostMapping(value = "/analyze", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<LabelAnalysis> analyze(@Valid @RequestBody LabelDtos.NormalizeRequest body) {
        return Mono.just(normalizer.analyze(body.getLabel()));
    }

    /** Synchronous batches have nobody watching progress, so they run unpaced in one pass. */
    @PostMapping(value = "/batch", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<LabelDtos.BatchReport> batch(@Valid @RequestBody LabelDtos.BatchRequest body) {
        List<String> labels = checkBatchSize(body.getLabels());
        return Mono.fromCallable(() -> report(labels));
    }

    @PostMapping(value = "/import", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<LabelDtos.ImportResponse> importLabels(@RequestBody(required = false) String content) {
        List<String> labels = checkBatchSize(importService.parseLines(content));
        return Mono.just(new LabelDtos.ImportResponse(labels));
    }

    @PostMapping(value = "/export")
    public Mono<ResponseEntity<byte[]>> export(@RequestParam(value = "format", required = false, defaultValue = "csv") String format,
                                               @RequestBody List<LabelRecord> records) {
        LabelExportService.Format f = LabelExportService.Format.parse(format);
        MediaType type = MediaType.parseMediaType(f.getContentType());
        if (f.isText()) {
            type = new MediaType(type, StandardCharsets.UTF_8);
        }
        byte[] body = exportService.export(records, f);
        ResponseEntity.BodyBuilder response = ResponseEntity.ok().contentType(type);
        if (f.isAttachment()) {
            response.header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + f.getFileName() + "\"");
        }
        return Mono.just(response.body(body));
    }

    private List<String> checkBatchSize(List<String> labels) {
        List<String> safe = labels != null ? labels : List.of();
        int max = appProperties.getMaxBatchSize();
        if (max > 0 && safe.size() > max) {
            throw new IllegalArgumentException("Batch of " + safe.size() + " labels exceeds the limit of " + max);
        }
        return safe;
    }

    private LabelDtos.BatchReport report(List<String> labels) {
        List<LabelRecord> records = new ArrayList<>(labels.size());
        int withBrand = 0;
        int withQuantity = 0;
        for (String label : labels) {
            LabelAnalysis a = normalizer.analyze(label);
            records.add(new LabelRecord(label, a.getCorrected(), false));
            if (a.getBrand() != null) withBrand++;
            if (!a.getQuantities().isEmpty()) withQuantity++;
        }
        LabelDtos.BatchReport report = new LabelDtos.BatchReport();
        report.setTotal(records.size());
        report.setWith_brand(withBrand);
        report.setWith_quantity(withQuantity);
        report.setRecords(records);
        return report;
    }
}
