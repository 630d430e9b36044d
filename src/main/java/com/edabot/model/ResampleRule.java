package com.edabot.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * Calendar downsampling period. Daily and business-day bins are labelled by
 * their own day; weekly, monthly, quarterly and yearly bins by the last day
 * of the period.
 */
public final class ResampleRule {

    public enum Unit {
        DAY,
        BUSINESS_DAY,
        WEEK,
        MONTH,
        QUARTER,
        YEAR
    }

    public final String code;
    public final Unit unit;
    public final DayOfWeek weekEnd;

    private ResampleRule(String code, Unit unit, DayOfWeek weekEnd) {
        this.code = code;
        this.unit = unit;
        this.weekEnd = weekEnd;
    }

    public static ResampleRule parse(String raw) {
        String code = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
        switch (code) {
            case "D":
                return new ResampleRule(code, Unit.DAY, null);
            case "B":
                return new ResampleRule(code, Unit.BUSINESS_DAY, null);
            case "W":
                return new ResampleRule(code, Unit.WEEK, DayOfWeek.SUNDAY);
            case "M":
            case "ME":
                return new ResampleRule(code, Unit.MONTH, null);
            case "Q":
            case "QE":
                return new ResampleRule(code, Unit.QUARTER, null);
            case "A":
            case "Y":
            case "YE":
                return new ResampleRule(code, Unit.YEAR, null);
            default:
                if (code.startsWith("W-")) {
                    DayOfWeek anchor = weekAnchor(code.substring(2));
                    if (anchor != null) {
                        return new ResampleRule(code, Unit.WEEK, anchor);
                    }
                }
                throw new IllegalArgumentException("unsupported resample rule '" + raw + "'");
        }
    }

    public LocalDate periodEnd(LocalDate date) {
        switch (unit) {
            case DAY:
                return date;
            case BUSINESS_DAY:
                if (date.getDayOfWeek() == DayOfWeek.SATURDAY || date.getDayOfWeek() == DayOfWeek.SUNDAY) {
                    return date.with(TemporalAdjusters.previous(DayOfWeek.FRIDAY));
                }
                return date;
            case WEEK:
                return date.with(TemporalAdjusters.nextOrSame(weekEnd));
            case MONTH:
                return date.with(TemporalAdjusters.lastDayOfMonth());
            case QUARTER:
                int quarterEndMonth = ((date.getMonthValue() - 1) / 3 + 1) * 3;
                return LocalDate.of(date.getYear(), quarterEndMonth, 1).with(TemporalAdjusters.lastDayOfMonth());
            case YEAR:
                return LocalDate.of(date.getYear(), 12, 31);
            default:
                throw new IllegalStateException("unknown unit " + unit);
        }
    }

    private static DayOfWeek weekAnchor(String abbrev) {
        switch (abbrev) {
            case "MON":
                return DayOfWeek.MONDAY;
            case "TUE":
                return DayOfWeek.TUESDAY;
            case "WED":
                return DayOfWeek.WEDNESDAY;
            case "THU":
                return DayOfWeek.THURSDAY;
            case "FRI":
                return DayOfWeek.FRIDAY;
            case "SAT":
                return DayOfWeek.SATURDAY;
            case "SUN":
                return DayOfWeek.SUNDAY;
            default:
                return null;
        }
    }

    @Override
    public String toString() {
        return code;
    }
}
