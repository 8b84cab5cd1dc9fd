package com.hyperfix.labels.service.normalization;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Orchestrates the label correction pipeline that turns a free-form catalog label into
 * {@code BRAND PRODUCT QUANTITIES}, uppercase.
 *
 * <h3>Pipeline Flow</h3>
 * <ol>
 *   <li><strong>TextNormalizer</strong> - strip accents and disallowed symbols</li>
 *   <li><strong>BrandMatcher</strong> - first catalog brand present as a whole word</li>
 *   <li><strong>QuantityExtractor</strong> - pack sizes and volumes via the ordered cascade</li>
 *   <li><strong>LabelAssembler</strong> - isolate the product name and reassemble</li>
 * </ol>
 *
 * <p>Brand matching and quantity extraction both read the normalized text independently.
 * The pipeline is deterministic and total: any input, including {@code null} and "", produces
 * a string. Feeding a corrected label back in returns it unchanged, except for contrived
 * inputs where quantities overlap inside one run of digits.
 *
 * @see LabelAnalysis
 * @see QuantityPatterns
 */
@Service
public class LabelNormalizer {
    private static final Logger log = LoggerFactory.getLogger(LabelNormalizer.class);

    private final BrandMatcher brandMatcher;
    private final QuantityExtractor quantityExtractor;
    private final LabelAssembler assembler;

    @Autowired
    public LabelNormalizer(BrandCatalog brandCatalog) {
        this(new BrandMatcher(brandCatalog), new QuantityExtractor(), new LabelAssembler());
    }

    public LabelNormalizer(BrandMatcher brandMatcher, QuantityExtractor quantityExtractor, LabelAssembler assembler) {
        this.brandMatcher = brandMatcher;
        this.quantityExtractor = quantityExtractor;
        this.assembler = assembler;
    }

    /**
     * Corrects a single label.
     *
     * @param label raw label, may be null or empty
     * @return the corrected label, empty when nothing usable remains
     */
    public String normalize(String label) {
        return analyze(label).getCorrected();
    }

    /**
     * Runs the pipeline and keeps every intermediate result.
     */
    public LabelAnalysis analyze(String label) {
        String normalized = TextNormalizer.normalize(label);
        String brand = brandMatcher.findBrand(normalized).orElse(null);
        List<String> quantities = quantityExtractor.extract(normalized);
        String productName = assembler.productName(normalized, brand, quantities);
        String corrected = assembler.assemble(brand, productName, quantities);

        List<Warn> warnings = new ArrayList<>();
        if (!normalized.isEmpty()) {
            if (brand == null) warnings.add(Warn.missingBrand(label));
            if (quantities.isEmpty()) warnings.add(Warn.missingQuantity(label));
            collectOverlaps(label, quantities, warnings);
        }

        log.debug("Corrected '{}' -> '{}' (brand={}, quantities={})", label, corrected, brand, quantities);
        return new LabelAnalysis(label, normalized, brand, quantities, productName, corrected, warnings);
    }

    private static void collectOverlaps(String label, List<String> quantities, List<Warn> warnings) {
        for (int i = 0; i < quantities.size(); i++) {
            for (int j = 0; j < quantities.size(); j++) {
                if (i == j) continue;
                String a = quantities.get(i);
                String b = quantities.get(j);
                if (b.length() > a.length() && b.contains(a)) {
                    warnings.add(Warn.quantityOverlap(label, a, b));
                }
            }
        }
    }

    public BrandCatalog getBrandCatalog() {
        return brandMatcher.getCatalog();
    }
}
