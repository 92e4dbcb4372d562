package io.github.hotbrkm.mailgoat.dispatcher.send.engine;

import io.github.hotbrkm.mailgoat.dispatcher.domain.EmailAddressUtil;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.BatchRecord;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.BatchRunSummary;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.MessageOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Batch summary aggregator
 * <p>
 * - Count sent/failed outcomes and locate the abort point
 * - Generate per-domain statistics keyed by recipient domain
 * - Output a top-domain summary log
 */
@Slf4j
@RequiredArgsConstructor
public final class BatchSummaryAggregator {

    public static final int DEFAULT_TOP_DOMAIN_LIMIT = 5;

    private final int topDomainSummaryLimit;

    public BatchSummaryAggregator() {
        this(DEFAULT_TOP_DOMAIN_LIMIT);
    }

    /**
     * Aggregates a sealed record into a summary marked as persisted.
     */
    public BatchRunSummary summarize(BatchRecord record) {
        Map<String, int[]> counts = new TreeMap<>();
        List<MessageOutcome> failures = new ArrayList<>();
        for (MessageOutcome outcome : record.outcomes()) {
            for (String address : outcome.to()) {
                int[] domainCounts = counts.computeIfAbsent(EmailAddressUtil.extractDomain(address), k -> new int[2]);
                domainCounts[0]++;
                if (outcome.isSent()) {
                    domainCounts[1]++;
                }
            }
            if (outcome.isFailed()) {
                failures.add(outcome);
            }
        }

        Map<String, BatchRunSummary.DomainStats> stats = new TreeMap<>();
        counts.forEach((domain, c) -> stats.put(domain, new BatchRunSummary.DomainStats(c[0], c[1])));
        logTopDomainSummary(record.batchId(), stats);

        MessageOutcome stop = record.abortPoint().orElse(null);
        return BatchRunSummary.builder()
                .batchId(record.batchId())
                .status(record.status())
                .profile(record.profileName())
                .total(record.totalCount())
                .attempted(record.attemptedCount())
                .sent(record.sentCount())
                .failed(record.failedCount())
                .createdAt(record.createdAt())
                .finishedAt(record.finishedAt())
                .rateLimit(record.rateLimit())
                .abortedAtRow(stop != null ? stop.rowIndex() : null)
                .abortReason(stop != null ? stop.error() : null)
                .domainStats(stats)
                .failures(failures)
                .persisted(true)
                .build();
    }

    /**
     * Output top domain summary log by recipient count
     */
    private void logTopDomainSummary(String batchId, Map<String, BatchRunSummary.DomainStats> stats) {
        if (stats.isEmpty()) {
            return;
        }
        List<Map.Entry<String, BatchRunSummary.DomainStats>> entries = new ArrayList<>(stats.entrySet());
        entries.sort((a, b) -> Integer.compare(b.getValue().total(), a.getValue().total()));
        int limit = Math.min(topDomainSummaryLimit, entries.size());
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < limit; i++) {
            Map.Entry<String, BatchRunSummary.DomainStats> e = entries.get(i);
            if (i > 0) sb.append(", ");
            sb.append(e.getKey())
              .append(" (total=").append(e.getValue().total())
              .append(", sent=").append(e.getValue().sent())
              .append(", successRate=").append(String.format("%.2f%%", e.getValue().successRate()))
              .append(")");
        }
        log.info("batchId={}, topDomainLimit={}, topDomains={}", batchId, topDomainSummaryLimit, sb);
    }
}
