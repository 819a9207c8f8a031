package icu.wwj.benchmark.rmdb;

class StockLevel {
    
    final int w_id;
    
    final int threshold;
    
    int low_stock;
    
    StockLevel(int w_id, int threshold) {
        this.w_id = w_id;
        this.threshold = threshold;
    }
}
