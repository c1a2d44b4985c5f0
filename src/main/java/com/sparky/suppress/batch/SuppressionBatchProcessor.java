package com.sparky.suppress.batch;

import com.google.common.base.Stopwatch;
import com.sparky.suppress.action.ISuppressionAction;
import com.sparky.suppress.csv.InvalidSuppressionFileException;
import com.sparky.suppress.csv.NormalizedRecord;
import com.sparky.suppress.csv.SuppressionRecordSource;
import com.sparky.suppress.model.IdentityKey;
import com.sparky.suppress.model.SuppressionRecord;
import com.sparky.suppress.util.SuppressionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Single pass over normalized records: drops invalid and duplicate entries, groups the rest into
 * batches of at most {@code batchSize} and hands each full batch to the action as soon as it fills.
 * The dedup set and the counters live only for the duration of {@link #process}.
 */
public class SuppressionBatchProcessor {
    private static final Logger LOGGER = LoggerFactory.getLogger(SuppressionBatchProcessor.class);

    private final int batchSize;
    private final SuppressionMetrics metrics;

    public SuppressionBatchProcessor(int batchSize, SuppressionMetrics metrics) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batch size must be positive: " + batchSize);
        }
        this.batchSize = batchSize;
        this.metrics = metrics;
    }

    public RunSummary process(SuppressionRecordSource source, ISuppressionAction action) throws InvalidSuppressionFileException {
        final Stopwatch sw = Stopwatch.createStarted();
        Set<IdentityKey> seen = new HashSet<>();
        List<SuppressionRecord> batch = new ArrayList<>();
        int batchNumber = 0;

        long checked = 0;
        long good = 0;
        long bad = 0;
        long duplicate = 0;
        long done = 0;
        long flagsGood = 0;
        long flagsDefaulted = 0;

        NormalizedRecord normalized;
        while ((normalized = source.next()) != null) {
            checked++;
            metrics.recordProcessed();
            if (normalized.isDefaulted()) {
                flagsDefaulted++;
            } else {
                flagsGood++;
            }

            if (!normalized.valid()) {
                bad++;
                continue;
            }

            SuppressionRecord record = normalized.record();
            if (!seen.add(record.identityKey())) {
                LOGGER.warn("Line {} : {} duplicate entry, skipping", normalized.lineNumber(), record.recipient());
                duplicate++;
                continue;
            }

            good++;
            batch.add(record);
            if (batch.size() >= batchSize) {
                done += flush(action, batch, ++batchNumber);
                batch = new ArrayList<>();
            }
        }

        if (!batch.isEmpty()) {
            done += flush(action, batch, ++batchNumber);
        }

        sw.stop();
        RunSummary summary = new RunSummary(checked, good, bad, duplicate, done, flagsGood, flagsDefaulted, sw.elapsed(TimeUnit.MILLISECONDS));
        LOGGER.info("{}", summary);
        LOGGER.info("Summary: {}", summary.toJson().encode());
        return summary;
    }

    private int flush(ISuppressionAction action, List<SuppressionRecord> batch, int batchNumber) {
        final Stopwatch sw = Stopwatch.createStarted();
        int done = action.apply(batch);
        sw.stop();
        metrics.recordTransacted(done);
        LOGGER.info("Batch {}: {} {} of {} entries in {}ms", batchNumber, action.name(), done, batch.size(), sw.elapsed(TimeUnit.MILLISECONDS));
        return done;
    }
}
