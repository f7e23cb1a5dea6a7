package com.timesync.reconciliation.basedata;

import com.timesync.reconciliation.domain.CategoryKind;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only mapping of raw database values to external dropdown identifiers
 * for one {@link CategoryKind}. Keys are case-normalized; labels that collide
 * after normalization but point at different identifiers are ambiguous and never resolve.
 */
@Slf4j
public final class BaseDataMapping {

    private final CategoryKind kind;
    private final Map<String, String> idsByKey;
    private final Set<String> ambiguousKeys;

    private BaseDataMapping(CategoryKind kind, Map<String, String> idsByKey, Set<String> ambiguousKeys) {
        this.kind = kind;
        this.idsByKey = Collections.unmodifiableMap(idsByKey);
        this.ambiguousKeys = Collections.unmodifiableSet(ambiguousKeys);
    }

    /**
     * Builds a mapping from dropdown contents, label to external id.
     */
    public static BaseDataMapping of(CategoryKind kind, Map<String, String> dropdownValues) {
        Map<String, String> idsByKey = new HashMap<>();
        Set<String> ambiguous = new HashSet<>();

        if (dropdownValues != null) {
            dropdownValues.forEach((label, externalId) -> {
                if (label == null || label.isBlank() || externalId == null || externalId.isBlank()) {
                    return;
                }
                String key = normalizeKey(label);
                String existing = idsByKey.putIfAbsent(key, externalId);
                if (existing != null && !existing.equals(externalId)) {
                    ambiguous.add(key);
                }
            });
        }

        ambiguous.forEach(idsByKey::remove);
        if (!ambiguous.isEmpty()) {
            log.warn("{} dropdown has {} ambiguous labels: {}", kind, ambiguous.size(), ambiguous);
        }
        return new BaseDataMapping(kind, idsByKey, ambiguous);
    }

    public Optional<String> lookup(String rawValue) {
        if (rawValue == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(idsByKey.get(normalizeKey(rawValue)));
    }

    public boolean isAmbiguous(String rawValue) {
        return rawValue != null && ambiguousKeys.contains(normalizeKey(rawValue));
    }

    public CategoryKind getKind() {
        return kind;
    }

    public int size() {
        return idsByKey.size();
    }

    static String normalizeKey(String value) {
        return value.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
