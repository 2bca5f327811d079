package com.everrich.cashflow.forecast;

import java.util.List;

import org.springframework.stereotype.Component;

@Component
public class LowestPointAnalyzer {

    /**
     * Finds the first day with the minimum balance; ties resolve to the earliest day.
     *
     * @throws EmptyForecastException if the forecast has no days
     */
    public LowestPoint findLowest(List<ForecastDay> days) {
        if (days == null || days.isEmpty()) {
            throw new EmptyForecastException("Cannot find the lowest point of an empty forecast");
        }
        int lowestIndex = 0;
        ForecastDay lowest = days.get(0);
        for (int i = 1; i < days.size(); i++) {
            ForecastDay day = days.get(i);
            if (day.balance().compareTo(lowest.balance()) < 0) {
                lowest = day;
                lowestIndex = i;
            }
        }
        return new LowestPoint(lowest, lowestIndex);
    }
}
