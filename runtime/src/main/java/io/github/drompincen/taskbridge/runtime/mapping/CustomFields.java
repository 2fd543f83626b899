package io.github.drompincen.taskbridge.runtime.mapping;

import io.github.drompincen.taskbridge.runtime.resolve.Names;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup of custom field values by field name. Field names vary between source projects,
 * so an exact (case-insensitive) match on any candidate is tried first, then a substring match.
 * Candidates shorter than four characters only match exactly ("PM" would otherwise hit "Development").
 */
public final class CustomFields {

    private static final int MIN_SUBSTRING_LENGTH = 4;

    private CustomFields() {
    }

    public static Optional<String> find(Map<String, String> fields, String... candidates) {
        if (fields == null || fields.isEmpty()) {
            return Optional.empty();
        }
        for (String candidate : candidates) {
            for (Map.Entry<String, String> e : fields.entrySet()) {
                if (e.getKey() != null && e.getKey().trim().equalsIgnoreCase(candidate) && !Names.isBlank(e.getValue())) {
                    return Optional.of(e.getValue().trim());
                }
            }
        }
        for (String candidate : candidates) {
            if (candidate.length() < MIN_SUBSTRING_LENGTH) {
                continue;
            }
            String lower = candidate.toLowerCase(Locale.ROOT);
            for (Map.Entry<String, String> e : fields.entrySet()) {
                if (e.getKey() != null && e.getKey().toLowerCase(Locale.ROOT).contains(lower) && !Names.isBlank(e.getValue())) {
                    return Optional.of(e.getValue().trim());
                }
            }
        }
        return Optional.empty();
    }

    /** Parses a numeric field such as "2.5" or "3 h"; empty when no number can be read. */
    public static Optional<Double> findNumber(Map<String, String> fields, String... candidates) {
        return find(fields, candidates).flatMap(v -> {
            String digits = v.replace(',', '.').replaceAll("[^0-9.]", "");
            if (digits.isEmpty()) {
                return Optional.empty();
            }
            try {
                return Optional.of(Double.parseDouble(digits));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        });
    }
}
