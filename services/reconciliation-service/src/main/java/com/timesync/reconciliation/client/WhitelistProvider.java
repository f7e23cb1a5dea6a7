package com.timesync.reconciliation.client;

import com.timesync.reconciliation.domain.WhitelistEntry;

import java.util.List;

public interface WhitelistProvider {

    List<WhitelistEntry> getWhitelist();
}
