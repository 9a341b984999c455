package com.example.pdflayout.domain.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;

/**
 * Parts of a page layout a caller can ask the extractor for.
 */
public enum LayoutFeature {
    TEXT,
    IMAGES,
    DOCUMENT_METADATA;

    public static EnumSet<LayoutFeature> allFeatures() {
        return EnumSet.allOf(LayoutFeature.class);
    }

    /**
     * Converts request parameters into a feature set.
     * Unknown values are ignored; an empty or fully invalid selection means every feature.
     *
     * @param rawValues feature names supplied by the caller
     * @return parsed feature set
     */
    public static EnumSet<LayoutFeature> fromStrings(List<String> rawValues) {
        if (rawValues == null || rawValues.isEmpty()) {
            return allFeatures();
        }
        EnumSet<LayoutFeature> features = EnumSet.noneOf(LayoutFeature.class);
        for (String value : rawValues) {
            LayoutFeature feature = fromString(value);
            if (feature != null) {
                features.add(feature);
            }
        }
        return features.isEmpty() ? allFeatures() : features;
    }

    private static LayoutFeature fromString(String rawValue) {
        if (rawValue == null) {
            return null;
        }
        try {
            return LayoutFeature.valueOf(rawValue.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
