package uk.gegc.clubaccess.features.ledger.domain.model;

import uk.gegc.clubaccess.shared.exception.ValidationException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;

/**
 * Inclusive calendar window of access. {@code days = (end - start) + 1}.
 *
 * <p>Access starts at the first instant of {@code start} and ends at 23:59:59 of {@code end}
 * in the application zone.
 */
public record AccessWindow(LocalDate start, LocalDate end) {

    public AccessWindow {
        if (start == null || end == null) {
            throw new ValidationException("Access window requires a start and an end date");
        }
        if (end.isBefore(start)) {
            throw new ValidationException("Access window end " + end + " is before start " + start);
        }
    }

    public static AccessWindow of(LocalDate start, LocalDate end) {
        return new AccessWindow(start, end);
    }

    public static AccessWindow ofDays(LocalDate start, int days) {
        if (days < 1) {
            throw new ValidationException("Access days must be at least 1, got " + days);
        }
        if (start == null) {
            throw new ValidationException("Access window requires a start date");
        }
        return new AccessWindow(start, start.plusDays(days - 1L));
    }

    public int days() {
        return Math.toIntExact(ChronoUnit.DAYS.between(start, end) + 1);
    }

    public Instant startInstant(ZoneId zone) {
        return startOfDay(start, zone);
    }

    public Instant endInstant(ZoneId zone) {
        return endOfDay(end, zone);
    }

    public static Instant startOfDay(LocalDate date, ZoneId zone) {
        return date.atStartOfDay(zone).toInstant();
    }

    public static Instant endOfDay(LocalDate date, ZoneId zone) {
        return date.plusDays(1).atStartOfDay(zone).toInstant().minusSeconds(1);
    }

    /**
     * Days of access left from {@code today} (or the window start, if later) through {@code endDate}, at least 1.
     */
    public static int remainingDays(LocalDate today, LocalDate startDate, LocalDate endDate) {
        LocalDate from = startDate != null && startDate.isAfter(today) ? startDate : today;
        long days = ChronoUnit.DAYS.between(from, endDate) + 1;
        return (int) Math.max(1, days);
    }
}
