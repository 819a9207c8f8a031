package icu.wwj.benchmark.rmdb;

class Payment {
    /* terminal input data */
    final int w_id;
    final int d_id;
    int c_id;
    int c_d_id;
    int c_w_id;
    String c_last;
    double h_amount;
    
    /* terminal output data */
    String w_name;
    String d_name;
    String c_first;
    String c_middle;
    String c_credit;
    double c_discount;
    double c_balance;
    double c_ytd_payment;
    int c_payment_cnt;
    String c_data;
    String h_date;
    
    Payment(int w_id, int d_id) {
        this.w_id = w_id;
        this.d_id = d_id;
    }
}
