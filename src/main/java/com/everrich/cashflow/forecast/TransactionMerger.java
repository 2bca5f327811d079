package com.everrich.cashflow.forecast;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

import org.springframework.stereotype.Component;

/**
 * Merges ledger entries with projected occurrences into one list ordered by date, then by
 * description (case-sensitive). Entries that tie on both keep their input order, one-offs first.
 */
@Component
public class TransactionMerger {

    static final Comparator<Occurrence> ORDER = Comparator
            .comparing(Occurrence::date, Comparator.<LocalDate>naturalOrder())
            .thenComparing(Occurrence::description, Comparator.nullsFirst(Comparator.<String>naturalOrder()));

    public List<Occurrence> merge(Collection<? extends Occurrence> oneOffs, Collection<? extends Occurrence> projected) {
        List<Occurrence> merged = new ArrayList<>(oneOffs.size() + projected.size());
        merged.addAll(oneOffs);
        merged.addAll(projected);
        // List.sort is a stable merge sort
        merged.sort(ORDER);
        return merged;
    }
}
