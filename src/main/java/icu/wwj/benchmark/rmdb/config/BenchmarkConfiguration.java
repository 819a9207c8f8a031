package icu.wwj.benchmark.rmdb.config;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.Properties;

/**
 * Benchmark settings. Every property may be overridden by a JVM system property of the same name, which in turn is
 * overridden by the command line.
 */
@Getter
public class BenchmarkConfiguration {
    
    private final String host;
    
    private final int port;
    
    private final String vertxOptions;
    
    private final String netClientOptions;
    
    private final long requestTimeoutMillis;
    
    private final int warehouses;
    
    private final boolean terminalWarehouseFixed;
    
    private final int terminals;
    
    private final int transactionsPerTerminal;
    
    private final double readWriteRatio;
    
    private final int reportIntervalSeconds;
    
    private final String resultFile;
    
    private final Long seed;
    
    private final double newOrderWeight;
    
    private final double paymentWeight;
    
    private final double deliveryWeight;
    
    private final double orderStatusWeight;
    
    private final double stockLevelWeight;
    
    @Getter(AccessLevel.NONE)
    private final Properties overrides;
    
    public BenchmarkConfiguration(Properties props) {
        this(props, new Properties());
    }
    
    public BenchmarkConfiguration(Properties props, Properties overrides) {
        this.overrides = overrides;
        host = get(props, "host", Configurations.HOST);
        port = Integer.parseInt(get(props, "port", String.valueOf(Configurations.PORT)));
        vertxOptions = get(props, "vertxOptions", "{}");
        netClientOptions = get(props, "netClientOptions", "{}");
        requestTimeoutMillis = Long.parseLong(get(props, "requestTimeoutMillis", "0"));
        warehouses = Integer.parseInt(get(props, "warehouses", String.valueOf(Configurations.WAREHOUSES)));
        terminalWarehouseFixed = Boolean.parseBoolean(get(props, "terminalWarehouseFixed", Boolean.FALSE.toString()));
        terminals = Integer.parseInt(get(props, "terminals", String.valueOf(Configurations.TERMINALS)));
        transactionsPerTerminal = Integer.parseInt(get(props, "transactionsPerTerminal", String.valueOf(Configurations.TRANSACTIONS_PER_TERMINAL)));
        readWriteRatio = Double.parseDouble(get(props, "readWriteRatio", String.valueOf(Configurations.READ_WRITE_RATIO)));
        reportIntervalSeconds = Integer.parseInt(get(props, "reportIntervalSeconds", "0"));
        resultFile = get(props, "resultFile", null);
        String seedValue = get(props, "seed", null);
        seed = null == seedValue || seedValue.isBlank() ? null : Long.valueOf(seedValue.trim());
        newOrderWeight = Double.parseDouble(get(props, "newOrderWeight", String.valueOf(Configurations.NEW_ORDER_WEIGHT)));
        paymentWeight = Double.parseDouble(get(props, "paymentWeight", String.valueOf(Configurations.PAYMENT_WEIGHT)));
        deliveryWeight = Double.parseDouble(get(props, "deliveryWeight", String.valueOf(Configurations.DELIVERY_WEIGHT)));
        orderStatusWeight = Double.parseDouble(get(props, "orderStatusWeight", String.valueOf(Configurations.ORDER_STATUS_WEIGHT)));
        stockLevelWeight = Double.parseDouble(get(props, "stockLevelWeight", String.valueOf(Configurations.STOCK_LEVEL_WEIGHT)));
    }
    
    private String get(Properties props, String key, String defaultValue) {
        return overrides.getProperty(key, System.getProperty(key, props.getProperty(key, defaultValue)));
    }
    
    /**
     * Check everything except the scale factor, which the caller reports on its own.
     *
     * @throws IllegalArgumentException on the first invalid setting
     */
    public void validate() {
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be in [1, 65535], got " + port);
        }
        if (terminals < 1) {
            throw new IllegalArgumentException("terminals must be at least 1, got " + terminals);
        }
        if (transactionsPerTerminal < 0) {
            throw new IllegalArgumentException("transactionsPerTerminal must not be negative, got " + transactionsPerTerminal);
        }
        if (readWriteRatio < 0.0 || readWriteRatio > 1.0) {
            throw new IllegalArgumentException("readWriteRatio must be in [0.0, 1.0], got " + readWriteRatio);
        }
        if (requestTimeoutMillis < 0L) {
            throw new IllegalArgumentException("requestTimeoutMillis must not be negative, got " + requestTimeoutMillis);
        }
        double[] weights = getTransactionWeights();
        double sum = 0.0;
        for (double each : weights) {
            if (each < 0.0 || Double.isNaN(each)) {
                throw new IllegalArgumentException("Transaction weights must not be negative, got " + each);
            }
            sum += each;
        }
        if (sum <= 0.0) {
            throw new IllegalArgumentException("At least one transaction weight must be positive");
        }
    }
    
    /**
     * Weights indexed by {@link icu.wwj.benchmark.rmdb.TPCCTransaction#ordinal()}.
     */
    public double[] getTransactionWeights() {
        return new double[]{newOrderWeight, paymentWeight, deliveryWeight, orderStatusWeight, stockLevelWeight};
    }
}
