package com.timesync.reconciliation.client;

import com.timesync.reconciliation.config.TimesheetSyncProperties;
import com.timesync.reconciliation.domain.WhitelistEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Whitelist curated in the {@code timesync.whitelist} configuration
 */
@Component
@RequiredArgsConstructor
public class PropertiesWhitelistProvider implements WhitelistProvider {

    private final TimesheetSyncProperties properties;

    @Override
    public List<WhitelistEntry> getWhitelist() {
        return List.copyOf(properties.getWhitelist());
    }
}
