package com.everrich.cashflow.forecast;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.everrich.cashflow.entities.RecurrenceInterval;
import com.everrich.cashflow.entities.RecurringTransaction;
import com.everrich.cashflow.util.DateUtils;

/**
 * Turns a recurring series into the concrete occurrences that fall inside a window.
 *
 * The result depends only on the series and the window. Occurrences never fall before the
 * series start date, after its end date, or outside the window, so expanding two adjacent
 * windows yields exactly the occurrences of the combined window.
 */
@Component
public class RecurrenceExpander {

    private static final int WEEK = 7;
    private static final int FORTNIGHT = 14;

    /**
     * @param series      a validated series; its interval is assumed to be set
     * @param windowStart first day of the window, inclusive
     * @param windowEnd   last day of the window, inclusive
     * @return occurrences in ascending date order, empty if the series does not overlap the window
     */
    public List<Occurrence> expand(RecurringTransaction series, LocalDate windowStart, LocalDate windowEnd) {
        LocalDate anchor = series.getStartDate();
        LocalDate seriesEnd = series.getEndDate();
        if (anchor.isAfter(windowEnd)) {
            return List.of();
        }
        if (seriesEnd != null && seriesEnd.isBefore(windowStart)) {
            return List.of();
        }

        LocalDate from = DateUtils.max(windowStart, anchor);
        LocalDate to = seriesEnd != null ? DateUtils.min(windowEnd, seriesEnd) : windowEnd;
        if (from.isAfter(to)) {
            return List.of();
        }

        List<LocalDate> dates;
        RecurrenceInterval interval = series.getInterval();
        switch (interval) {
            case WEEKLY:
                dates = weeklyDates(series, from, to, WEEK);
                break;
            case BIWEEKLY:
                dates = weeklyDates(series, from, to, FORTNIGHT);
                break;
            case MONTHLY:
                dates = monthlyDates(series, from, to);
                break;
            case YEARLY:
                dates = yearlyDates(series, from, to);
                break;
            default:
                throw new IllegalStateException("Unhandled interval " + interval);
        }

        List<Occurrence> occurrences = new ArrayList<>(dates.size());
        for (LocalDate date : dates) {
            occurrences.add(Occurrence.projected(series, date));
        }
        return occurrences;
    }

    /**
     * Candidates sit {@code step} days apart starting at the anchor, each pushed forward to the
     * target weekday. When the weekday is pinned to something other than the anchor's own
     * weekday, every occurrence shifts by the same 1..6 days while the cadence stays phased
     * from the anchor.
     */
    private List<LocalDate> weeklyDates(RecurringTransaction series, LocalDate from, LocalDate to, int step) {
        LocalDate first = series.getStartDate().with(TemporalAdjusters.nextOrSame(series.targetDayOfWeek()));
        if (first.isBefore(from)) {
            long behind = ChronoUnit.DAYS.between(first, from);
            long steps = (behind + step - 1) / step;
            first = first.plusDays(steps * step);
        }

        List<LocalDate> dates = new ArrayList<>();
        for (LocalDate d = first; !d.isAfter(to); d = d.plusDays(step)) {
            dates.add(d);
        }
        return dates;
    }

    private List<LocalDate> monthlyDates(RecurringTransaction series, LocalDate from, LocalDate to) {
        int day = series.targetDayOfMonth();
        YearMonth last = YearMonth.from(to);

        List<LocalDate> dates = new ArrayList<>();
        for (YearMonth month = YearMonth.from(from); !month.isAfter(last); month = month.plusMonths(1)) {
            addIfInRange(dates, clampedDate(month, day), series.getStartDate(), from, to);
        }
        return dates;
    }

    private List<LocalDate> yearlyDates(RecurringTransaction series, LocalDate from, LocalDate to) {
        int day = series.targetDayOfMonth();
        int monthOfYear = series.getStartDate().getMonthValue();

        List<LocalDate> dates = new ArrayList<>();
        for (int year = from.getYear(); year <= to.getYear(); year++) {
            addIfInRange(dates, clampedDate(YearMonth.of(year, monthOfYear), day), series.getStartDate(), from, to);
        }
        return dates;
    }

    private static void addIfInRange(List<LocalDate> dates, LocalDate candidate, LocalDate anchor,
                                     LocalDate from, LocalDate to) {
        if (candidate.isBefore(from) || candidate.isAfter(to) || candidate.isBefore(anchor)) {
            return;
        }
        dates.add(candidate);
    }

    /**
     * Day 31 in a 30-day month lands on the 30th, in February on the 28th or 29th.
     */
    static LocalDate clampedDate(YearMonth month, int day) {
        return month.atDay(Math.min(day, month.lengthOfMonth()));
    }
}
