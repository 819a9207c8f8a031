package icu.wwj.benchmark.rmdb;

class OrderStatus {
    
    final int w_id;
    
    final int d_id;
    
    final int c_id;
    
    int o_id;
    
    String o_entry_d;
    
    int o_carrier_id;
    
    int ol_cnt;
    
    final int[] ol_supply_w_id = new int[15];
    final int[] ol_i_id = new int[15];
    final int[] ol_quantity = new int[15];
    final double[] ol_amount = new double[15];
    final String[] ol_delivery_d = new String[15];
    
    OrderStatus(int w_id, int d_id, int c_id) {
        this.w_id = w_id;
        this.d_id = d_id;
        this.c_id = c_id;
    }
}
