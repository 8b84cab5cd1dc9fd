package com.hyperfix.labels.service.normalization;

import com.hyperfix.labels.util.TextUtils;

import java.util.Locale;
import java.util.Optional;

/**
 * Finds the brand of a label by scanning the catalog in order.
 *
 * <p>A brand is recognized only as a whole word, so "PM" does not match inside "PMU" or "6PM".
 * At most one brand is returned per label; catalog order is the tie-break.
 */
public class BrandMatcher {
    private final BrandCatalog catalog;

    public BrandMatcher(BrandCatalog catalog) {
        this.catalog = catalog != null ? catalog : BrandCatalog.defaults();
    }

    public Optional<String> findBrand(String normalizedText) {
        if (normalizedText == null || normalizedText.isEmpty()) return Optional.empty();
        String upper = normalizedText.toUpperCase(Locale.ROOT);
        for (String brand : catalog.getBrands()) {
            if (TextUtils.containsWholeWord(upper, brand)) {
                return Optional.of(brand);
            }
        }
        return Optional.empty();
    }

    public BrandCatalog getCatalog() {
        return catalog;
    }
}
