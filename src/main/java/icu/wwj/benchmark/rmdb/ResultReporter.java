package icu.wwj.benchmark.rmdb;

import lombok.Getter;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Live counters for the progress log. Each slot is written by its own terminal only.
 */
@Getter
public class ResultReporter {
    
    private final AtomicLong[] totalCounts;
    
    private final AtomicLong[] newOrderCounts;
    
    public ResultReporter(int terminals) {
        totalCounts = new AtomicLong[terminals];
        newOrderCounts = new AtomicLong[terminals];
        for (int i = 0; i < terminals; i++) {
            totalCounts[i] = new AtomicLong();
            newOrderCounts[i] = new AtomicLong();
        }
    }
    
    public void record(TransactionResult result) {
        int slot = result.getTerminalId() - 1;
        totalCounts[slot].incrementAndGet();
        if (TPCCTransaction.NEW_ORDER == result.getType() && result.isSuccess()) {
            newOrderCounts[slot].incrementAndGet();
        }
    }
    
    public long sumTotalCount() {
        return sum(totalCounts);
    }
    
    public long sumNewOrderCount() {
        return sum(newOrderCounts);
    }
    
    private static long sum(AtomicLong[] counts) {
        long result = 0;
        for (AtomicLong each : counts) {
            result += each.get();
        }
        return result;
    }
}
