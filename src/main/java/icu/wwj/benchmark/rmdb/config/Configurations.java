package icu.wwj.benchmark.rmdb.config;

public class Configurations {
    
    public static final String HOST = "localhost";
    
    public static final int PORT = 8765;
    
    public static final int WAREHOUSES = 1;
    
    public static final int DISTRICTS_PER_WAREHOUSE = 10;
    
    public static final int CUSTOMERS_PER_DISTRICT = 3000;
    
    public static final int ITEMS = 100000;
    
    public static final int TERMINALS = 1;
    
    public static final int TRANSACTIONS_PER_TERMINAL = 100;
    
    public static final double READ_WRITE_RATIO = 0.5;
    
    public static final double NEW_ORDER_WEIGHT = 0.45;
    
    public static final double PAYMENT_WEIGHT = 0.43;
    
    public static final double DELIVERY_WEIGHT = 0.04;
    
    public static final double ORDER_STATUS_WEIGHT = 0.04;
    
    public static final double STOCK_LEVEL_WEIGHT = 0.04;
}
