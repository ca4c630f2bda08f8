package in.epicast.util;

import in.epicast.domain.filter.TimeType;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Conversions between integer-encoded time values and calendar dates.
 *
 * Day values are YYYYMMDD. Week values are MMWR epiweeks encoded YYYYWW:
 * weeks run Sunday to Saturday and week 1 is the first week with at least
 * four days in the calendar year.
 */
public final class TimeValues {

    private static final DateTimeFormatter COMPACT = DateTimeFormatter.BASIC_ISO_DATE;

    public static LocalDate toDate(int dayValue) {
        return LocalDate.of(dayValue / 10000, (dayValue / 100) % 100, dayValue % 100);
    }

    public static int fromDate(LocalDate date) {
        return Integer.parseInt(date.format(COMPACT));
    }

    public static String toIso(int dayValue) {
        return toDate(dayValue).toString();
    }

    /**
     * Shift a day value by a number of days (negative shifts go back in time).
     */
    public static int shiftDays(int dayValue, int days) {
        return fromDate(toDate(dayValue).plusDays(days));
    }

    /**
     * First day (Sunday) of epiweek 1 of the given year.
     */
    static LocalDate epiyearStart(int year) {
        LocalDate jan4 = LocalDate.of(year, 1, 4);
        return jan4.with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY));
    }

    /**
     * First day (Sunday) of an epiweek encoded YYYYWW.
     */
    public static LocalDate weekStart(int weekValue) {
        int year = weekValue / 100;
        int week = weekValue % 100;
        if (week < 1 || week > 53) {
            throw new IllegalArgumentException("invalid epiweek: " + weekValue);
        }
        return epiyearStart(year).plusWeeks(week - 1L);
    }

    /**
     * Epiweek (YYYYWW) containing the given date.
     */
    public static int weekOf(LocalDate date) {
        int year = date.getYear();
        LocalDate start = epiyearStart(year);
        if (date.isBefore(start)) {
            year -= 1;
            start = epiyearStart(year);
        } else {
            LocalDate next = epiyearStart(year + 1);
            if (!date.isBefore(next)) {
                year += 1;
                start = next;
            }
        }
        long week = ChronoUnit.WEEKS.between(start, date) + 1;
        return year * 100 + (int) week;
    }

    /**
     * The time value immediately following {@code value} at the given granularity.
     */
    public static int next(TimeType timeType, int value) {
        return shift(timeType, value, 1);
    }

    /**
     * Shift a time value by {@code steps} days or weeks.
     */
    public static int shift(TimeType timeType, int value, int steps) {
        if (timeType == TimeType.WEEK) {
            return weekOf(weekStart(value).plusWeeks(steps));
        }
        return shiftDays(value, steps);
    }

    /**
     * Whether a day value is a real calendar date.
     */
    public static boolean isValidDay(int dayValue) {
        try {
            toDate(dayValue);
            return true;
        } catch (RuntimeException e) {
            return false;
        }
    }

    private TimeValues() {}
}
