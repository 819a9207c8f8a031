package icu.wwj.benchmark.rmdb;

import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one benchmark run, merged from the results of all terminals.
 */
@Getter
public final class BenchmarkResult {
    
    private final long totalTransactions;
    
    private final long successfulTransactions;
    
    private final long failedTransactions;
    
    private final double successRate;
    
    private final double averageResponseMillis;
    
    private final double throughput;
    
    private final double tpmC;
    
    private final long durationMillis;
    
    private final Map<TPCCTransaction, Long> executedCounts;
    
    private final Map<TPCCTransaction, Long> successfulCounts;
    
    private final List<List<TransactionResult>> terminalResults;
    
    private final boolean cancelled;
    
    private BenchmarkResult(List<List<TransactionResult>> terminalResults, long durationMillis, boolean cancelled) {
        this.terminalResults = terminalResults;
        this.durationMillis = durationMillis;
        this.cancelled = cancelled;
        Map<TPCCTransaction, Long> executed = new EnumMap<>(TPCCTransaction.class);
        Map<TPCCTransaction, Long> successful = new EnumMap<>(TPCCTransaction.class);
        for (TPCCTransaction each : TPCCTransaction.values()) {
            executed.put(each, 0L);
            successful.put(each, 0L);
        }
        long total = 0L;
        long succeeded = 0L;
        long elapsedSum = 0L;
        for (List<TransactionResult> results : terminalResults) {
            for (TransactionResult each : results) {
                total++;
                elapsedSum += each.getElapsedMillis();
                executed.merge(each.getType(), 1L, Long::sum);
                if (each.isSuccess()) {
                    succeeded++;
                    successful.merge(each.getType(), 1L, Long::sum);
                }
            }
        }
        totalTransactions = total;
        successfulTransactions = succeeded;
        failedTransactions = total - succeeded;
        successRate = 0L == total ? 0.0 : succeeded * 100.0 / total;
        averageResponseMillis = 0L == total ? 0.0 : (double) elapsedSum / total;
        throughput = durationMillis <= 0L ? 0.0 : total * 1000.0 / durationMillis;
        tpmC = durationMillis <= 0L ? 0.0 : successful.get(TPCCTransaction.NEW_ORDER) * 60_000.0 / durationMillis;
        executedCounts = Collections.unmodifiableMap(executed);
        successfulCounts = Collections.unmodifiableMap(successful);
    }
    
    public static BenchmarkResult aggregate(List<List<TransactionResult>> terminalResults, long durationMillis, boolean cancelled) {
        return new BenchmarkResult(terminalResults, durationMillis, cancelled);
    }
}
