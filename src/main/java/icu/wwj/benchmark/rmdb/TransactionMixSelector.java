package icu.wwj.benchmark.rmdb;

import icu.wwj.benchmark.rmdb.config.BenchmarkConfiguration;

/**
 * Picks the next transaction type of a terminal.
 * <p>
 * With probability {@code readWriteRatio} the type is drawn from the read-write class (NewOrder, Payment, Delivery)
 * by their weights, otherwise from the read-only class (OrderStatus, StockLevel). A class without positive weight
 * is never drawn.
 */
public final class TransactionMixSelector {
    
    private static final TPCCTransaction[] TRANSACTIONS = TPCCTransaction.values();
    
    private final jTPCCRandom random;
    
    private final double readWriteRatio;
    
    private final double[] weights;
    
    private final double readWriteSum;
    
    private final double readOnlySum;
    
    public TransactionMixSelector(double readWriteRatio, double[] weights, jTPCCRandom random) {
        if (weights.length != TRANSACTIONS.length) {
            throw new IllegalArgumentException("Expected %d transaction weights, got %d".formatted(TRANSACTIONS.length, weights.length));
        }
        this.random = random;
        this.readWriteRatio = readWriteRatio;
        this.weights = weights.clone();
        double readWrite = 0.0;
        double readOnly = 0.0;
        for (TPCCTransaction each : TRANSACTIONS) {
            if (each.isReadWrite()) {
                readWrite += weights[each.ordinal()];
            } else {
                readOnly += weights[each.ordinal()];
            }
        }
        if (readWrite <= 0.0 && readOnly <= 0.0) {
            throw new IllegalArgumentException("At least one transaction weight must be positive");
        }
        readWriteSum = readWrite;
        readOnlySum = readOnly;
    }
    
    public static TransactionMixSelector of(BenchmarkConfiguration configuration, jTPCCRandom random) {
        return new TransactionMixSelector(configuration.getReadWriteRatio(), configuration.getTransactionWeights(), random);
    }
    
    public TPCCTransaction next() {
        boolean readWrite;
        if (readWriteSum <= 0.0) {
            readWrite = false;
        } else if (readOnlySum <= 0.0) {
            readWrite = true;
        } else {
            readWrite = random.nextDouble() < readWriteRatio;
        }
        return pick(readWrite, readWrite ? readWriteSum : readOnlySum);
    }
    
    private TPCCTransaction pick(boolean readWrite, double sum) {
        double point = random.nextDouble() * sum;
        TPCCTransaction result = null;
        for (TPCCTransaction each : TRANSACTIONS) {
            if (each.isReadWrite() != readWrite || weights[each.ordinal()] <= 0.0) {
                continue;
            }
            result = each;
            point -= weights[each.ordinal()];
            if (point < 0.0) {
                break;
            }
        }
        return result;
    }
}
