package com.timesync.reconciliation.domain;

import java.util.Objects;

/**
 * Categorical reference of an event: the human readable value plus, once
 * resolved, the external dropdown identifier it maps to.
 */
public record CategoryRef(
    CategoryKind kind,
    String label,
    String externalId
) {

    public static CategoryRef unresolved(CategoryKind kind, String label) {
        return new CategoryRef(kind, label, null);
    }

    public static CategoryRef resolved(CategoryKind kind, String label, String externalId) {
        return new CategoryRef(kind, label, externalId);
    }

    public boolean isResolved() {
        return externalId != null;
    }

    /**
     * Resolved references compare by external id only; labels are cosmetic.
     */
    public boolean sameAs(CategoryRef other) {
        if (other == null) {
            return false;
        }
        if (isResolved() && other.isResolved()) {
            return externalId.equals(other.externalId);
        }
        return Objects.equals(label, other.label) && Objects.equals(externalId, other.externalId);
    }

    @Override
    public String toString() {
        return isResolved() ? label + " (" + externalId + ")" : label;
    }
}
