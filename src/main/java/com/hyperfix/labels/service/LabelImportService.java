package com.hyperfix.labels.service;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns an uploaded text or CSV body into the list of labels to correct: one label per line,
 * trimmed, blank lines dropped.
 */
@Service
public class LabelImportService {
    private static final char BOM = '\uFEFF';

    public List<String> parseLines(String content) {
        List<String> labels = new ArrayList<>();
        if (content == null || content.isEmpty()) return labels;
        String body = content.charAt(0) == BOM ? content.substring(1) : content;
        for (String line : body.split("\\r?\\n|\\r")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                labels.add(trimmed);
            }
        }
        return labels;
    }
}
