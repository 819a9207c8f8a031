package icu.wwj.benchmark.rmdb;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
@Getter
public enum TPCCTransaction {
    
    NEW_ORDER("NewOrder", true),
    
    PAYMENT("Payment", true),
    
    DELIVERY("Delivery", true),
    
    ORDER_STATUS("OrderStatus", false),
    
    STOCK_LEVEL("StockLevel", false);
    
    private final String displayName;
    
    private final boolean readWrite;
}
