package com.samplesift.predicate;

import com.samplesift.date.DateValue;
import com.samplesift.date.MalformedDateException;
import com.samplesift.record.RecordContext;
import java.time.LocalDate;

/**
 * Applies {@code min_date} and {@code max_date}. An ambiguous date is compared by the range of days
 * it could denote: it survives a lower bound if its latest possible day is on or after the bound,
 * and an upper bound if its earliest possible day is on or before it. Dates with an unknown year
 * cannot be bounded and are dropped.
 */
final class DateBoundsPredicate implements RecordPredicate {
    private final LocalDate minDate;
    private final LocalDate maxDate;

    DateBoundsPredicate(LocalDate minDate, LocalDate maxDate) {
        this.minDate = minDate;
        this.maxDate = maxDate;
    }

    @Override
    public Decision evaluate(RecordContext context) {
        DateValue date;
        try {
            date = context.getDate();
        } catch (MalformedDateException ex) {
            return Decision.drop(DropReason.MALFORMED_DATE, "date=" + ex.getRawValue());
        }
        LocalDate earliest = date.earliest();
        LocalDate latest = date.latest();
        if (minDate != null && (latest == null || latest.isBefore(minDate))) {
            return Decision.drop(DropReason.DATE_BOUNDS, "min_date=" + minDate);
        }
        if (maxDate != null && (earliest == null || earliest.isAfter(maxDate))) {
            return Decision.drop(DropReason.DATE_BOUNDS, "max_date=" + maxDate);
        }
        return Decision.pass();
    }
}
