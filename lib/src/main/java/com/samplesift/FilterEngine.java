package com.samplesift;

import com.samplesift.allocation.Allocation;
import com.samplesift.allocation.AllocationExhaustedException;
import com.samplesift.allocation.QuotaAllocator;
import com.samplesift.config.ConfigurationException;
import com.samplesift.config.FilterConfig;
import com.samplesift.group.GroupKey;
import com.samplesift.group.GroupKeyResolver;
import com.samplesift.group.GroupResolution;
import com.samplesift.outcome.EmptyOutputException;
import com.samplesift.outcome.Outcome;
import com.samplesift.outcome.OutcomeAggregator;
import com.samplesift.outcome.OutcomeListener;
import com.samplesift.predicate.Decision;
import com.samplesift.predicate.DropReason;
import com.samplesift.predicate.PredicatePipeline;
import com.samplesift.quality.SequenceStatistics;
import com.samplesift.query.ExpressionQueryEvaluator;
import com.samplesift.query.QueryEvaluator;
import com.samplesift.record.DuplicateIdException;
import com.samplesift.record.Record;
import com.samplesift.record.RecordContext;
import com.samplesift.record.RecordSource;
import com.samplesift.record.RecordSourceException;
import com.samplesift.record.RecordStream;
import com.samplesift.selection.Candidate;
import com.samplesift.selection.GroupQueue;
import com.samplesift.selection.PriorityProvider;
import com.samplesift.selection.PrioritySelector;
import com.samplesift.selection.ScorePriorities;
import com.samplesift.selection.UniformPriorities;
import java.security.SecureRandom;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of the filtering and subsampling engine.
 *
 * <p>The number of streaming passes depends on the configuration:</p>
 * <ul>
 *   <li>no subsampling: one pass, every record that clears the predicate pipeline is kept;</li>
 *   <li>{@code subsample_per_group}: one pass, quotas are known up front;</li>
 *   <li>{@code subsample_total}: pass 1 classifies records and tallies group populations, the
 *       {@link QuotaAllocator} turns populations into quotas, pass 2 ranks grouped records into
 *       bounded per-group queues.</li>
 * </ul>
 * Classification events (drops and force-inclusions) are emitted during the first pass only.
 * Identifiers must be unique; duplicates fail the run at the end of the first pass, before any
 * allocation or selection. Rows the source could not parse are dropped, not failed.
 * All configuration problems surface as {@link ConfigurationException} before the first record
 * is read.
 */
public final class FilterEngine {

    private static final Logger LOGGER = Logger.getLogger(FilterEngine.class.getName());

    static final String EMPTY_OUTPUT_MESSAGE =
            "All samples have been dropped! Check filter rules and metadata file format.";

    private final FilterConfig config;
    private final QueryEvaluator queryEvaluator;
    private final SequenceStatistics sequences;
    private final PriorityProvider priorities;
    private final OutcomeListener listener;

    private FilterEngine(Builder builder) {
        this.config = builder.config;
        this.queryEvaluator = builder.queryEvaluator;
        this.sequences = builder.sequences;
        this.priorities = builder.priorities;
        this.listener = builder.listener;
    }

    public static Builder builder(FilterConfig config) {
        return new Builder(config);
    }

    public FilterConfig getConfig() {
        return config;
    }

    /**
     * Filters and subsamples {@code source}.
     *
     * @throws ConfigurationException if the configuration does not fit the input columns.
     * @throws RecordSourceException if reading fails or the input changes between passes.
     * @throws DuplicateIdException if an identifier occurs on more than one row.
     * @throws AllocationExhaustedException if no usable quotas could be drawn.
     * @throws EmptyOutputException if nothing was kept and the empty output policy is
     *     {@code ERROR}.
     */
    public Outcome run(RecordSource source)
            throws ConfigurationException, RecordSourceException, DuplicateIdException,
                    AllocationExhaustedException, EmptyOutputException {
        Objects.requireNonNull(source, "source");
        List<String> columns = source.getColumns();
        GroupKeyResolver resolver = new GroupKeyResolver(config.getGroupBy(), columns, config.getDateColumn());
        boolean datesConsulted = PredicatePipeline.consultsDates(config, resolver.usesDates());
        PredicatePipeline pipeline =
                PredicatePipeline.fromConfig(config, columns, queryEvaluator, sequences, datesConsulted);
        long seed = resolveSeed();
        PriorityProvider ranking = priorities != null ? priorities : new UniformPriorities(seed);

        Run run = new Run(pipeline, resolver, ranking, new OutcomeAggregator(listener));
        Allocation allocation;
        if (config.getSubsampleTotal() != null) {
            allocation = run.twoPass(source, config.getSubsampleTotal(), seed);
        } else if (config.getSubsamplePerGroup() != null) {
            allocation = run.perGroup(source, config.getSubsamplePerGroup());
        } else {
            run.unsampled(source);
            allocation = null;
        }
        if (run.unscored > 0) {
            LOGGER.log(
                    Level.WARNING,
                    "{0} records had no priority score and were ranked below all scored records",
                    run.unscored);
        }
        Outcome outcome = run.aggregator.finish(seed, allocation);
        LOGGER.log(
                Level.INFO,
                "{0} of {1} records kept ({2} force-included)",
                new Object[] {outcome.getKeptCount(), outcome.getTotalInput(), outcome.getForceIncludedCount()});
        if (outcome.isEmpty()) {
            switch (config.getEmptyOutputPolicy()) {
                case ERROR -> throw new EmptyOutputException(EMPTY_OUTPUT_MESSAGE, outcome);
                case WARN -> LOGGER.warning(EMPTY_OUTPUT_MESSAGE);
                case SILENT -> LOGGER.fine(EMPTY_OUTPUT_MESSAGE);
            }
        }
        return outcome;
    }

    private long resolveSeed() {
        if (config.getSeed() != null) {
            return config.getSeed();
        }
        long generated = new SecureRandom().nextLong();
        LOGGER.log(Level.INFO, "No subsampling seed configured; using {0}", Long.toString(generated));
        return generated;
    }

    /** State of one {@link #run} call. */
    private final class Run {
        private final PredicatePipeline pipeline;
        private final GroupKeyResolver resolver;
        private final PriorityProvider ranking;
        private final OutcomeAggregator aggregator;
        private final Set<String> seenIds = new HashSet<>();
        private final Set<String> duplicateIds = new TreeSet<>();
        private long unscored;

        Run(PredicatePipeline pipeline, GroupKeyResolver resolver, PriorityProvider ranking,
                OutcomeAggregator aggregator) {
            this.pipeline = pipeline;
            this.resolver = resolver;
            this.ranking = ranking;
            this.aggregator = aggregator;
        }

        void unsampled(RecordSource source) throws RecordSourceException, DuplicateIdException {
            try (RecordStream stream = source.open()) {
                long ordinal = 0;
                for (Record record = stream.next(); record != null; record = stream.next(), ordinal++) {
                    RecordContext context = new RecordContext(record, ordinal, config.getDateColumn());
                    GroupKey key = classify(context);
                    if (key != null) {
                        aggregator.recordGrouped(key);
                        aggregator.recordKept(record.getId(), ordinal, key);
                    }
                }
            }
            checkUnique();
        }

        Allocation perGroup(RecordSource source, long perGroup) throws RecordSourceException, DuplicateIdException {
            PrioritySelector selector = new PrioritySelector(key -> perGroup, ranking);
            try (RecordStream stream = source.open()) {
                long ordinal = 0;
                for (Record record = stream.next(); record != null; record = stream.next(), ordinal++) {
                    RecordContext context = new RecordContext(record, ordinal, config.getDateColumn());
                    GroupKey key = classify(context);
                    if (key != null) {
                        aggregator.recordGrouped(key);
                        offer(selector, key, record.getId(), ordinal);
                    }
                }
            }
            checkUnique();
            Allocation allocation = QuotaAllocator.perGroup(perGroup, aggregator.getPopulations());
            LOGGER.log(Level.INFO, "Sampling at {0} per group across {1} groups",
                    new Object[] {perGroup, allocation.getQuotas().size()});
            collectSelected(selector);
            return allocation;
        }

        Allocation twoPass(RecordSource source, long total, long seed)
                throws RecordSourceException, DuplicateIdException, AllocationExhaustedException {
            BitSet candidates = config.isCacheDecisions() ? new BitSet() : null;
            long firstPassCount = 0;
            try (RecordStream stream = source.open()) {
                for (Record record = stream.next(); record != null; record = stream.next(), firstPassCount++) {
                    RecordContext context = new RecordContext(record, firstPassCount, config.getDateColumn());
                    GroupKey key = classify(context);
                    if (key != null) {
                        aggregator.recordGrouped(key);
                        if (candidates != null && cacheable(firstPassCount)) {
                            candidates.set((int) firstPassCount);
                        }
                    }
                }
            }
            checkUnique();
            Map<GroupKey, Long> populations = aggregator.getPopulations();
            LOGGER.log(Level.INFO, "Pass 1 complete: {0} records, {1} groups",
                    new Object[] {firstPassCount, populations.size()});

            QuotaAllocator allocator =
                    new QuotaAllocator(seed, config.getMaxAllocationAttempts(), config.isProbabilisticSampling());
            Allocation allocation = allocator.forTotal(total, populations);

            PrioritySelector selector = new PrioritySelector(allocation::getQuota, ranking);
            long secondPassCount = 0;
            try (RecordStream stream = source.open()) {
                for (Record record = stream.next(); record != null; record = stream.next(), secondPassCount++) {
                    long ordinal = secondPassCount;
                    RecordContext context = new RecordContext(record, ordinal, config.getDateColumn());
                    GroupKey key;
                    if (candidates != null && cacheable(ordinal)) {
                        key = candidates.get((int) ordinal) ? resolver.resolve(context).getKey() : null;
                    } else {
                        key = candidateKey(context);
                    }
                    if (key != null) {
                        offer(selector, key, record.getId(), ordinal);
                    }
                }
            }
            if (secondPassCount != firstPassCount) {
                throw new RecordSourceException(
                        "Input changed between passes: " + firstPassCount + " records in pass 1, "
                                + secondPassCount + " in pass 2");
            }
            collectSelected(selector);
            return allocation;
        }

        /**
         * Runs the pipeline and the group resolver, reporting drops and force-inclusions.
         *
         * @return the group of a record competing for a quota, otherwise {@code null}.
         */
        private GroupKey classify(RecordContext context) {
            aggregator.recordSeen();
            Record record = context.getRecord();
            if (!record.isMalformed() && !seenIds.add(record.getId())) {
                duplicateIds.add(record.getId());
            }
            Decision decision = pipeline.evaluate(context);
            if (decision.isForceIncluded()) {
                GroupResolution resolution = resolver.resolve(context);
                aggregator.recordForceIncluded(
                        context.getId(), context.getOrdinal(), decision.getDetail(), resolution.getKey());
                return null;
            }
            if (decision.isDropped()) {
                aggregator.recordDropped(context.getId(), decision.getReason(), decision.getDetail());
                return null;
            }
            GroupResolution resolution = resolver.resolve(context);
            if (!resolution.isGrouped()) {
                aggregator.recordDropped(context.getId(), resolution.getReason(), resolution.getDetail());
                return null;
            }
            return resolution.getKey();
        }

        private void checkUnique() throws DuplicateIdException {
            if (!duplicateIds.isEmpty()) {
                throw new DuplicateIdException(duplicateIds);
            }
        }

        /** Same as {@link #classify} without reporting anything. */
        private GroupKey candidateKey(RecordContext context) {
            if (!pipeline.evaluate(context).isPass()) {
                return null;
            }
            return resolver.resolve(context).getKey();
        }

        private void offer(PrioritySelector selector, GroupKey key, String id, long ordinal) {
            if (ranking instanceof ScorePriorities scores && !scores.contains(id)) {
                unscored++;
            }
            Candidate evicted = selector.offer(key, id, ordinal);
            if (evicted != null) {
                aggregator.recordDropped(evicted.getId(), DropReason.SUBSAMPLING, "group=" + key);
            }
        }

        private void collectSelected(PrioritySelector selector) {
            for (Map.Entry<GroupKey, GroupQueue> entry : selector.getQueues().entrySet()) {
                for (Candidate candidate : entry.getValue().selected()) {
                    aggregator.recordKept(candidate.getId(), candidate.getOrdinal(), entry.getKey());
                }
            }
        }
    }

    private static boolean cacheable(long ordinal) {
        return ordinal < Integer.MAX_VALUE;
    }

    public static final class Builder {
        private final FilterConfig config;
        private QueryEvaluator queryEvaluator = new ExpressionQueryEvaluator();
        private SequenceStatistics sequences;
        private PriorityProvider priorities;
        private OutcomeListener listener = OutcomeListener.NONE;

        private Builder(FilterConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        public Builder queryEvaluator(QueryEvaluator queryEvaluator) {
            this.queryEvaluator = Objects.requireNonNull(queryEvaluator, "queryEvaluator");
            return this;
        }

        /** Per-record sequence statistics; enables the missing-sequence and quality stages. */
        public Builder sequenceStatistics(SequenceStatistics sequences) {
            this.sequences = sequences;
            return this;
        }

        /** Ranking inside groups; defaults to {@link UniformPriorities} seeded by the run seed. */
        public Builder priorities(PriorityProvider priorities) {
            this.priorities = priorities;
            return this;
        }

        public Builder listener(OutcomeListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener");
            return this;
        }

        public FilterEngine build() {
            return new FilterEngine(this);
        }
    }
}
