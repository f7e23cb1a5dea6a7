package com.timesync.reconciliation.engine;

import com.timesync.reconciliation.domain.CanonicalEvent;
import com.timesync.reconciliation.domain.CategoryRef;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Field-wise comparison of the business content of two canonical events.
 * Descriptions are compared without the identity marker line; invoiced,
 * lastModified and record ids are not business content.
 */
public final class EventComparator {

    private EventComparator() {
    }

    /**
     * @return names of the fields that differ, empty when the events are equal
     */
    public static List<String> differences(CanonicalEvent expected, CanonicalEvent actual) {
        List<String> diffs = new ArrayList<>();
        if (!Objects.equals(expected.getSubject(), actual.getSubject())) {
            diffs.add("subject");
        }
        if (!Objects.equals(expected.getStart(), actual.getStart())) {
            diffs.add("start");
        }
        if (!Objects.equals(expected.getEnd(), actual.getEnd())) {
            diffs.add("end");
        }
        if (!sameHours(expected.getHours(), actual.getHours())) {
            diffs.add("hours");
        }
        if (!Objects.equals(expected.getDescription(), actual.getDescription())) {
            diffs.add("description");
        }
        if (!sameCategory(expected.getEmployee(), actual.getEmployee())) {
            diffs.add("employee");
        }
        if (!sameCategory(expected.getProject(), actual.getProject())) {
            diffs.add("project");
        }
        if (!sameCategory(expected.getActivity(), actual.getActivity())) {
            diffs.add("activity");
        }
        return diffs;
    }

    private static boolean sameHours(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.compareTo(b) == 0;
    }

    private static boolean sameCategory(CategoryRef a, CategoryRef b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.sameAs(b);
    }
}
