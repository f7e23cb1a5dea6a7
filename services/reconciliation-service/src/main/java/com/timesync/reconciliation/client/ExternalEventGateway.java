package com.timesync.reconciliation.client;

import com.timesync.reconciliation.domain.CanonicalEvent;
import com.timesync.reconciliation.domain.CategoryKind;
import com.timesync.reconciliation.domain.RawExternalEvent;
import com.timesync.reconciliation.exception.ExternalWriteException;

import java.util.List;
import java.util.Map;

/**
 * Read and write access to the external accounting system's time registrations.
 *
 * <p>Implementations own sessions, retries and timeouts. Every call blocks
 * until it completes. Fetches return a fully materialized snapshot. Records are
 * never deleted through this interface.
 */
public interface ExternalEventGateway {

    List<RawExternalEvent> fetchExternalEvents(int year);

    /**
     * @return the record id the external system assigned
     * @throws ExternalWriteException when the record was not created
     */
    String insertExternalEvent(CanonicalEvent event);

    /**
     * Must refuse to touch an invoiced record.
     *
     * @throws ExternalWriteException when the record was not updated
     */
    void updateExternalEvent(String externalRecordId, CanonicalEvent event);

    /**
     * @return dropdown contents as label to external id
     */
    Map<String, String> fetchDropdownValues(CategoryKind kind);
}
