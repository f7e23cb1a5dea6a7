package com.timesync.reconciliation.client;

import com.timesync.reconciliation.domain.RawDbEvent;

import java.util.List;

/**
 * Authoritative source of time registrations. Each row already carries its
 * employee, project and activity assignment.
 */
public interface DatabaseEventSource {

    List<RawDbEvent> fetchDatabaseEvents(int year);
}
