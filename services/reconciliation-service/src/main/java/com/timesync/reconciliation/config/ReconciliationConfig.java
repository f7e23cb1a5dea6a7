package com.timesync.reconciliation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.timesync.reconciliation.identity.EventIdentityCodec;
import com.timesync.reconciliation.normalizer.EventNormalizer;
import com.timesync.reconciliation.verification.SyncVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Wiring of the reconciliation core. The core classes carry no Spring
 * annotations; they are assembled here from {@link TimesheetSyncProperties}.
 */
@Slf4j
@Configuration
public class ReconciliationConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock(TimesheetSyncProperties properties) {
        return Clock.system(ZoneId.of(properties.getReferenceZone()));
    }

    @Bean
    public EventIdentityCodec eventIdentityCodec() {
        return new EventIdentityCodec();
    }

    @Bean
    public EventNormalizer eventNormalizer(EventIdentityCodec identityCodec, TimesheetSyncProperties properties) {
        ZoneId reference = ZoneId.of(properties.getReferenceZone());
        ZoneId database = zoneOrDefault(properties.getDatabaseZone(), reference);
        ZoneId external = zoneOrDefault(properties.getExternalZone(), reference);
        log.info("Normalizing timestamps to {} (database: {}, external: {})", reference, database, external);
        return new EventNormalizer(identityCodec, reference, database, external);
    }

    @Bean
    public SyncVerifier syncVerifier(EventNormalizer normalizer, ObjectMapper objectMapper, Clock clock) {
        return new SyncVerifier(normalizer, objectMapper, clock);
    }

    private static ZoneId zoneOrDefault(String zone, ZoneId fallback) {
        return zone == null || zone.isBlank() ? fallback : ZoneId.of(zone);
    }
}
