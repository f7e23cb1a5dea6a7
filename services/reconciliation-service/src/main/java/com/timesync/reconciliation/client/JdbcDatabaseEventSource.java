package com.timesync.reconciliation.client;

import com.timesync.reconciliation.config.TimesheetSyncProperties;
import com.timesync.reconciliation.domain.RawDbEvent;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Reads the year's events from the event database. The query is loaded from
 * the classpath and receives the year as its only parameter.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcDatabaseEventSource implements DatabaseEventSource {

    static final RowMapper<RawDbEvent> EVENT_ROW_MAPPER = (rs, rowNum) -> RawDbEvent.builder()
        .eventId(rs.getString("event_id"))
        .userName(rs.getString("user_name"))
        .userEmail(rs.getString("user_email"))
        .subject(rs.getString("subject"))
        .description(rs.getString("description"))
        .startDate(rs.getString("start_date"))
        .endDate(rs.getString("end_date"))
        .hours(rs.getBigDecimal("hours"))
        .project(rs.getString("project"))
        .activity(rs.getString("activity"))
        .lastModified(rs.getString("last_modified"))
        .build();

    private final JdbcTemplate jdbcTemplate;
    private final TimesheetSyncProperties properties;

    private volatile String query;

    @Override
    @Retry(name = "timesheet-database")
    public List<RawDbEvent> fetchDatabaseEvents(int year) {
        log.info("Querying database events for {}", year);
        List<RawDbEvent> events = jdbcTemplate.query(query(), EVENT_ROW_MAPPER, year);
        log.info("Retrieved {} database events for {}", events.size(), year);
        return events;
    }

    private String query() {
        if (query == null) {
            String location = properties.getDatabase().getQueryLocation();
            try {
                query = StreamUtils.copyToString(new ClassPathResource(location).getInputStream(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot load event query from " + location, e);
            }
        }
        return query;
    }
}
