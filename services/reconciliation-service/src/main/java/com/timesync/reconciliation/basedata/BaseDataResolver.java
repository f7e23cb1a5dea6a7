package com.timesync.reconciliation.basedata;

import com.timesync.reconciliation.domain.CategoryKind;
import com.timesync.reconciliation.domain.CategoryRef;
import com.timesync.reconciliation.exception.BaseDataConflictException;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Resolves database category values against a snapshot of the external
 * system's dropdowns. The snapshot is taken once per run and never refreshed.
 */
@Slf4j
public class BaseDataResolver {

    private final Map<CategoryKind, BaseDataMapping> mappings;

    public BaseDataResolver(Map<CategoryKind, BaseDataMapping> mappings) {
        this.mappings = new EnumMap<>(CategoryKind.class);
        this.mappings.putAll(mappings);
    }

    /**
     * Fetches every dropdown once through {@code dropdownFetcher} and freezes the result.
     */
    public static BaseDataResolver snapshot(Function<CategoryKind, Map<String, String>> dropdownFetcher) {
        Map<CategoryKind, BaseDataMapping> mappings = new EnumMap<>(CategoryKind.class);
        for (CategoryKind kind : CategoryKind.values()) {
            BaseDataMapping mapping = BaseDataMapping.of(kind, dropdownFetcher.apply(kind));
            log.info("Loaded {} {} dropdown values", mapping.size(), kind);
            mappings.put(kind, mapping);
        }
        return new BaseDataResolver(mappings);
    }

    /**
     * @throws BaseDataConflictException when the value has no case-insensitive match
     */
    public String resolve(CategoryKind kind, String rawValue) {
        BaseDataMapping mapping = mappings.get(kind);
        if (mapping == null) {
            throw new BaseDataConflictException(kind, rawValue,
                "No " + kind + " base data loaded");
        }
        if (mapping.isAmbiguous(rawValue)) {
            throw new BaseDataConflictException(kind, rawValue,
                kind + " '" + rawValue + "' matches more than one external value");
        }
        return mapping.lookup(rawValue)
            .orElseThrow(() -> new BaseDataConflictException(kind, rawValue,
                kind + " '" + rawValue + "' does not exist in the external system"));
    }

    /**
     * Resolves an unresolved reference; already resolved references are returned as is.
     */
    public CategoryRef resolve(CategoryRef ref) {
        if (ref.isResolved()) {
            return ref;
        }
        return CategoryRef.resolved(ref.kind(), ref.label(), resolve(ref.kind(), ref.label()));
    }
}
