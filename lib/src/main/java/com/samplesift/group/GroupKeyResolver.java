package com.samplesift.group;

import com.samplesift.config.ConfigurationException;
import com.samplesift.date.DateComponent;
import com.samplesift.date.DateValue;
import com.samplesift.date.MalformedDateException;
import com.samplesift.predicate.DropReason;
import com.samplesift.record.RecordContext;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Derives the {@link GroupKey} of a record that passed filtering.
 *
 * <p>Literal columns contribute their raw cell. The synthetic columns {@code year}, {@code month}
 * and {@code week} are computed from the date column and require the needed components to be
 * known: {@code year} needs the year, {@code month} the year and month, {@code week} the full
 * date. A record failing that check gets no key and is reported under the first ambiguous
 * component. Month values carry their year ({@code 2021-05}) so that equal months of different
 * years stay apart.</p>
 */
public final class GroupKeyResolver {

    private static final Logger LOGGER = Logger.getLogger(GroupKeyResolver.class.getName());

    private final List<GroupingColumn> columns;
    private final DateComponent deepestDateComponent;

    public GroupKeyResolver(List<String> groupBy, List<String> inputColumns, String dateColumn)
            throws ConfigurationException {
        Set<String> known = new HashSet<>(inputColumns);
        List<GroupingColumn> resolved = new ArrayList<>();
        DateComponent deepest = null;
        for (String name : groupBy) {
            GroupingColumn.Kind kind = GroupingColumn.Kind.forName(name);
            if (kind == GroupingColumn.Kind.LITERAL) {
                if (!known.contains(name)) {
                    throw new ConfigurationException("group_by column '" + name + "' does not exist in the input");
                }
            } else {
                if (!known.contains(dateColumn)) {
                    throw new ConfigurationException(
                            "group_by '" + name + "' is derived from the '" + dateColumn
                                    + "' column, which does not exist in the input");
                }
                if (known.contains(name)) {
                    LOGGER.log(
                            Level.WARNING,
                            "Input column ''{0}'' is shadowed by the value derived from ''{1}'' for grouping",
                            new Object[] {name, dateColumn});
                }
                DateComponent needed = kind.getDeepestComponent();
                if (deepest == null || needed.compareTo(deepest) > 0) {
                    deepest = needed;
                }
            }
            resolved.add(new GroupingColumn(name, kind));
        }
        this.columns = List.copyOf(resolved);
        this.deepestDateComponent = deepest;
    }

    public List<GroupingColumn> getColumns() {
        return columns;
    }

    public boolean usesDates() {
        return deepestDateComponent != null;
    }

    public GroupResolution resolve(RecordContext context) {
        if (columns.isEmpty()) {
            return GroupResolution.grouped(GroupKey.IMPLICIT);
        }
        DateValue date = null;
        if (usesDates()) {
            try {
                date = context.getDate();
            } catch (MalformedDateException ex) {
                return GroupResolution.ambiguous(DropReason.GROUPING_AMBIGUOUS_YEAR, "date=" + ex.getRawValue());
            }
            DateComponent ambiguous = date.firstAmbiguousThrough(deepestDateComponent);
            if (ambiguous != null) {
                return GroupResolution.ambiguous(
                        DropReason.forGroupingAmbiguity(ambiguous), "ambiguity=" + ambiguous.label());
            }
        }
        List<String> values = new ArrayList<>(columns.size());
        for (GroupingColumn column : columns) {
            values.add(valueFor(column, context, date));
        }
        return GroupResolution.grouped(new GroupKey(values));
    }

    private static String valueFor(GroupingColumn column, RecordContext context, DateValue date) {
        return switch (column.getKind()) {
            case LITERAL -> {
                String value = context.getRecord().get(column.getName());
                yield value == null ? "" : value;
            }
            case YEAR -> String.valueOf(date.getYear());
            case MONTH -> String.format(Locale.ROOT, "%04d-%02d", date.getYear(), date.getMonth());
            case WEEK -> date.isoWeekLabel();
        };
    }
}
