package icu.wwj.benchmark.rmdb;

import icu.wwj.benchmark.rmdb.config.Configurations;

class Delivery {
    
    /* terminal input data */
    final int w_id;
    int o_carrier_id;
    String ol_delivery_d;
    
    /* terminal output data, -1 for districts without a pending order */
    final int[] delivered_o_id = new int[Configurations.DISTRICTS_PER_WAREHOUSE];
    
    Delivery(int w_id) {
        this.w_id = w_id;
    }
    
    int deliveredCount() {
        int result = 0;
        for (int each : delivered_o_id) {
            if (each >= 0) {
                result++;
            }
        }
        return result;
    }
}
