package com.timesync.reconciliation.normalizer;

import com.timesync.reconciliation.basedata.BaseDataResolver;
import com.timesync.reconciliation.domain.CanonicalEvent;
import com.timesync.reconciliation.domain.CategoryKind;
import com.timesync.reconciliation.domain.CategoryRef;
import com.timesync.reconciliation.domain.EventSource;
import com.timesync.reconciliation.domain.RawDbEvent;
import com.timesync.reconciliation.domain.RawExternalEvent;
import com.timesync.reconciliation.exception.BaseDataConflictException;
import com.timesync.reconciliation.exception.MissingCategoryException;
import com.timesync.reconciliation.exception.NormalizationException;
import com.timesync.reconciliation.identity.EventIdentityCodec;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Converts raw records from either store into {@link CanonicalEvent}s.
 *
 * <p>Timestamps with an offset are converted to the reference zone; timestamps
 * without one are read in the zone of their source. Database categories come
 * out unresolved from {@link #normalize(RawDbEvent)}; resolution against the
 * dropdown snapshot is a separate step so callers can decide when a
 * resolution failure matters.
 */
@Slf4j
public class EventNormalizer {

    private static final BigDecimal QUARTERS_PER_HOUR = BigDecimal.valueOf(4);
    private static final BigDecimal MINUTES_PER_HOUR = BigDecimal.valueOf(60);

    private final EventIdentityCodec identityCodec;
    private final ZoneId referenceZone;
    private final ZoneId databaseZone;
    private final ZoneId externalZone;

    public EventNormalizer(EventIdentityCodec identityCodec, ZoneId referenceZone) {
        this(identityCodec, referenceZone, referenceZone, referenceZone);
    }

    public EventNormalizer(EventIdentityCodec identityCodec, ZoneId referenceZone,
                           ZoneId databaseZone, ZoneId externalZone) {
        this.identityCodec = identityCodec;
        this.referenceZone = referenceZone;
        this.databaseZone = databaseZone;
        this.externalZone = externalZone;
    }

    /**
     * Normalizes a database row. Categories stay unresolved.
     *
     * @throws MissingCategoryException when project or activity is not assigned
     * @throws NormalizationException   when any other required field is absent or unparseable
     */
    public CanonicalEvent normalize(RawDbEvent raw) {
        UUID identity = parseIdentity(raw.getEventId());

        LocalDateTime start = parseTimestamp(raw.getStartDate(), databaseZone, "startDate");
        LocalDateTime end = parseTimestamp(raw.getEndDate(), databaseZone, "endDate");
        requireOrdered(start, end);

        String employee = !TextNormalizer.isBlank(raw.getUserName()) ? raw.getUserName() : raw.getUserEmail();
        if (TextNormalizer.isBlank(employee)) {
            throw new NormalizationException("userName", "Event " + identity + " has no employee");
        }
        if (TextNormalizer.isBlank(raw.getProject())) {
            throw new MissingCategoryException(CategoryKind.PROJECT, "Event " + identity + " has no project category");
        }
        if (TextNormalizer.isBlank(raw.getActivity())) {
            throw new MissingCategoryException(CategoryKind.ACTIVITY, "Event " + identity + " has no activity category");
        }

        return CanonicalEvent.builder()
            .identity(identity)
            .source(EventSource.DATABASE)
            .subject(TextNormalizer.normalizeLine(raw.getSubject()))
            .description(TextNormalizer.normalizeText(identityCodec.strip(raw.getDescription())))
            .start(start)
            .end(end)
            .hours(raw.getHours() != null ? roundToQuarter(raw.getHours()) : quarterHours(start, end))
            .employee(CategoryRef.unresolved(CategoryKind.EMPLOYEE, TextNormalizer.normalizeLine(employee)))
            .project(CategoryRef.unresolved(CategoryKind.PROJECT, TextNormalizer.normalizeLine(raw.getProject())))
            .activity(CategoryRef.unresolved(CategoryKind.ACTIVITY, TextNormalizer.normalizeLine(raw.getActivity())))
            .invoiced(false)
            .lastModified(parseInstant(raw.getLastModified(), databaseZone))
            .build();
    }

    /**
     * Resolves employee, project and activity against the dropdown snapshot.
     * The employee falls back to {@code fallbackEmployee} (the e-mail address) when the name does not resolve.
     *
     * @throws BaseDataConflictException when any of the three cannot be resolved
     */
    public CanonicalEvent resolveCategories(CanonicalEvent event, BaseDataResolver resolver, String fallbackEmployee) {
        CategoryRef employee;
        try {
            employee = resolver.resolve(event.getEmployee());
        } catch (BaseDataConflictException e) {
            if (TextNormalizer.isBlank(fallbackEmployee)
                || fallbackEmployee.equalsIgnoreCase(event.getEmployee().label())) {
                throw e;
            }
            String label = TextNormalizer.normalizeLine(fallbackEmployee);
            try {
                employee = CategoryRef.resolved(CategoryKind.EMPLOYEE, label, resolver.resolve(CategoryKind.EMPLOYEE, label));
            } catch (BaseDataConflictException fallbackFailure) {
                throw e;
            }
        }
        return event.toBuilder()
            .employee(employee)
            .project(resolver.resolve(event.getProject()))
            .activity(resolver.resolve(event.getActivity()))
            .build();
    }

    /**
     * Normalizes an external record. The identity comes from the description
     * marker and is absent when the marker is missing or malformed.
     *
     * @throws NormalizationException when the start date is absent or a timestamp does not parse
     */
    public CanonicalEvent normalize(RawExternalEvent raw) {
        LocalDateTime start = parseTimestamp(raw.getStartDate(), externalZone, "startDate");
        LocalDateTime end;
        BigDecimal hours;
        if (!TextNormalizer.isBlank(raw.getEndDate())) {
            end = parseTimestamp(raw.getEndDate(), externalZone, "endDate");
            requireOrdered(start, end);
            hours = raw.getHours() != null ? roundToQuarter(raw.getHours()) : quarterHours(start, end);
        } else if (raw.getHours() != null) {
            hours = roundToQuarter(raw.getHours());
            end = start.plusMinutes(hours.multiply(MINUTES_PER_HOUR).longValue());
        } else {
            throw new NormalizationException("endDate",
                "External record " + raw.getExternalRecordId() + " has neither an end date nor hours");
        }

        return CanonicalEvent.builder()
            .identity(identityCodec.extract(raw.getDescription()).orElse(null))
            .source(EventSource.EXTERNAL)
            .externalRecordId(raw.getExternalRecordId())
            .subject(TextNormalizer.normalizeLine(raw.getSubject()))
            .description(TextNormalizer.normalizeText(identityCodec.strip(raw.getDescription())))
            .start(start)
            .end(end)
            .hours(hours)
            .employee(externalRef(CategoryKind.EMPLOYEE, raw.getEmployeeName(), raw.getEmployeeId()))
            .project(externalRef(CategoryKind.PROJECT, raw.getProjectName(), raw.getProjectId()))
            .activity(externalRef(CategoryKind.ACTIVITY, raw.getActivityName(), raw.getActivityId()))
            .invoiced(raw.isInvoiced())
            .lastModified(parseInstant(raw.getLastModified(), externalZone))
            .build();
    }

    /**
     * Duration in hours at quarter-hour granularity: {@code round(minutes / 60 * 4) / 4}.
     */
    public static BigDecimal quarterHours(LocalDateTime start, LocalDateTime end) {
        long minutes = Duration.between(start, end).toMinutes();
        BigDecimal quarters = BigDecimal.valueOf(minutes)
            .multiply(QUARTERS_PER_HOUR)
            .divide(MINUTES_PER_HOUR, 0, RoundingMode.HALF_UP);
        return quarters.divide(QUARTERS_PER_HOUR, 2, RoundingMode.UNNECESSARY);
    }

    public static BigDecimal roundToQuarter(BigDecimal hours) {
        return hours.multiply(QUARTERS_PER_HOUR)
            .setScale(0, RoundingMode.HALF_UP)
            .divide(QUARTERS_PER_HOUR, 2, RoundingMode.UNNECESSARY);
    }

    private static CategoryRef externalRef(CategoryKind kind, String label, String externalId) {
        String normalizedLabel = TextNormalizer.normalizeLine(label);
        if (TextNormalizer.isBlank(externalId)) {
            return CategoryRef.unresolved(kind, normalizedLabel);
        }
        return CategoryRef.resolved(kind, normalizedLabel, externalId.strip());
    }

    private static UUID parseIdentity(String eventId) {
        if (TextNormalizer.isBlank(eventId)) {
            throw new NormalizationException("eventId", "Database event has no event_id");
        }
        try {
            return UUID.fromString(eventId.strip());
        } catch (IllegalArgumentException e) {
            throw new NormalizationException("eventId", "Database event_id '" + eventId + "' is not a GUID", e);
        }
    }

    private static void requireOrdered(LocalDateTime start, LocalDateTime end) {
        if (end.isBefore(start)) {
            throw new NormalizationException("endDate", "End " + end + " lies before start " + start);
        }
    }

    LocalDateTime parseTimestamp(String value, ZoneId sourceZone, String field) {
        if (TextNormalizer.isBlank(value)) {
            throw new NormalizationException(field, "Required field " + field + " is missing");
        }
        String text = value.strip();
        if (text.length() > 10 && text.charAt(10) == ' ') {
            text = text.substring(0, 10) + 'T' + text.substring(11);
        }
        try {
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay();
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                .parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            ZonedDateTime zoned = parsed instanceof OffsetDateTime offset
                ? offset.atZoneSameInstant(referenceZone)
                : ((LocalDateTime) parsed).atZone(sourceZone).withZoneSameInstant(referenceZone);
            return zoned.toLocalDateTime().truncatedTo(ChronoUnit.MINUTES);
        } catch (DateTimeParseException e) {
            throw new NormalizationException(field, "Cannot parse " + field + " '" + value + "'", e);
        }
    }

    private Instant parseInstant(String value, ZoneId sourceZone) {
        if (TextNormalizer.isBlank(value)) {
            return null;
        }
        try {
            return parseTimestamp(value, sourceZone, "lastModified").atZone(referenceZone).toInstant();
        } catch (NormalizationException e) {
            log.debug("Ignoring unparseable lastModified '{}'", value);
            return null;
        }
    }
}
