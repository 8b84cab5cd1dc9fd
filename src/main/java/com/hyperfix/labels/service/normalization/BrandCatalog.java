package com.hyperfix.labels.service.normalization;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Ordered, immutable vocabulary of recognized brands.
 *
 * <p>Order matters: when a label mentions several catalog entries, the one listed first wins.
 * Entries are trimmed and uppercased; blank and repeated entries are dropped.
 */
public final class BrandCatalog {
    /** Retail and stationery brands handled by the back office. */
    public static final List<String> DEFAULT_BRANDS = List.of(
            "CRF", "CARF", "CARREFOUR", "PAPERMATE", "PM", "SHARPIE", "ROTRING");

    private final List<String> brands;

    private BrandCatalog(List<String> brands) {
        this.brands = brands;
    }

    public static BrandCatalog defaults() {
        return of(DEFAULT_BRANDS);
    }

    public static BrandCatalog of(Collection<String> entries) {
        Set<String> cleaned = new LinkedHashSet<>();
        if (entries != null) {
            for (String entry : entries) {
                if (entry == null || entry.isBlank()) continue;
                cleaned.add(entry.trim().toUpperCase(Locale.ROOT));
            }
        }
        return new BrandCatalog(Collections.unmodifiableList(new ArrayList<>(cleaned)));
    }

    public static BrandCatalog of(String... entries) {
        return of(entries == null ? null : Arrays.asList(entries));
    }

    public List<String> getBrands() {
        return brands;
    }

    public int size() {
        return brands.size();
    }

    public boolean isEmpty() {
        return brands.isEmpty();
    }

    @Override
    public String toString() {
        return "BrandCatalog" + brands;
    }
}
