package icu.wwj.benchmark.rmdb;

import icu.wwj.benchmark.rmdb.config.BenchmarkConfiguration;
import icu.wwj.benchmark.rmdb.config.Configurations;
import icu.wwj.benchmark.rmdb.protocol.RMDBSession;
import icu.wwj.benchmark.rmdb.protocol.Row;
import icu.wwj.benchmark.rmdb.protocol.Statement;
import icu.wwj.benchmark.rmdb.protocol.TransactionFailure;
import io.vertx.core.Future;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

public class PaymentExecutor implements TransactionExecutor {
    
    static final String BAD_CREDIT = "BC";
    
    static final int C_DATA_MAX_LENGTH = 300;
    
    private static final String CUSTOMER_COLUMNS = "c_id, c_first, c_middle, c_last, c_credit, c_discount, " +
            "c_balance, c_ytd_payment, c_payment_cnt, c_data ";
    
    private final BenchmarkConfiguration configuration;
    
    private final jTPCCRandom random;
    
    private final RMDBSession session;
    
    private final Statement stmtPaymentSelectWarehouse;
    
    private final Statement stmtPaymentUpdateWarehouse;
    
    private final Statement stmtPaymentSelectDistrict;
    
    private final Statement stmtPaymentUpdateDistrict;
    
    private final Statement stmtPaymentSelectCustomer;
    
    private final Statement stmtPaymentSelectCustomerListByLast;
    
    private final Statement stmtPaymentUpdateCustomer;
    
    private final Statement stmtPaymentUpdateCustomerWithData;
    
    private final Statement stmtPaymentInsertHistory;
    
    public PaymentExecutor(BenchmarkConfiguration configuration, jTPCCRandom random, RMDBSession session) {
        this.configuration = configuration;
        this.random = random;
        this.session = session;
        stmtPaymentSelectWarehouse = session.statement(
                "SELECT w_name, w_ytd " +
                        "FROM warehouse " +
                        "WHERE w_id = ?");
        stmtPaymentUpdateWarehouse = session.statement(
                "UPDATE warehouse " +
                        "SET w_ytd = w_ytd+? " +
                        "WHERE w_id = ?");
        stmtPaymentSelectDistrict = session.statement(
                "SELECT d_name, d_ytd " +
                        "FROM district " +
                        "WHERE d_w_id = ? AND d_id = ?");
        stmtPaymentUpdateDistrict = session.statement(
                "UPDATE district " +
                        "SET d_ytd = d_ytd+? " +
                        "WHERE d_w_id = ? AND d_id = ?");
        stmtPaymentSelectCustomer = session.statement(
                "SELECT " + CUSTOMER_COLUMNS +
                        "FROM customer " +
                        "WHERE c_w_id = ? AND c_d_id = ? AND c_id = ?");
        stmtPaymentSelectCustomerListByLast = session.statement(
                "SELECT " + CUSTOMER_COLUMNS +
                        "FROM customer " +
                        "WHERE c_w_id = ? AND c_d_id = ? AND c_last = ? " +
                        "ORDER BY c_first");
        stmtPaymentUpdateCustomer = session.statement(
                "UPDATE customer " +
                        "SET c_balance = ?, c_ytd_payment = ?, c_payment_cnt = ? " +
                        "WHERE c_w_id = ? AND c_d_id = ? AND c_id = ?");
        stmtPaymentUpdateCustomerWithData = session.statement(
                "UPDATE customer " +
                        "SET c_balance = ?, c_ytd_payment = ?, c_payment_cnt = ?, c_data = ? " +
                        "WHERE c_w_id = ? AND c_d_id = ? AND c_id = ?");
        stmtPaymentInsertHistory = session.statement(
                "INSERT INTO history VALUES (?, ?, ?, ?, ?, ?, ?, ?)");
    }
    
    @Override
    public Future<Boolean> execute(int warehouseId) {
        return process(generatePayment(warehouseId));
    }
    
    Future<Boolean> process(Payment generated) {
        generated.h_date = NewOrderExecutor.TIMESTAMP_FORMATTER.format(LocalDateTime.now());
        return session.begin().compose(transaction -> transaction.complete(Future.succeededFuture(generated)
                // Select and update the WAREHOUSE.
                .compose(payment -> stmtPaymentSelectWarehouse.execute(payment.w_id).map(rows -> {
                    Row row = rows.fetchOne();
                    if (null == row) {
                        throw TransactionFailure.missing("Warehouse for W_ID=%d not found", payment.w_id);
                    }
                    payment.w_name = row.getString(0);
                    return payment;
                }))
                .compose(payment -> stmtPaymentUpdateWarehouse.execute(payment.h_amount, payment.w_id).map(payment))
                // Select and update the DISTRICT.
                .compose(payment -> stmtPaymentSelectDistrict.execute(payment.w_id, payment.d_id).map(rows -> {
                    Row row = rows.fetchOne();
                    if (null == row) {
                        throw TransactionFailure.missing("District for W_ID=%d D_ID=%d not found", payment.w_id, payment.d_id);
                    }
                    payment.d_name = row.getString(0);
                    return payment;
                }))
                .compose(payment -> stmtPaymentUpdateDistrict.execute(payment.h_amount, payment.w_id, payment.d_id).map(payment))
                .compose(this::selectCustomer)
                .compose(this::updateCustomer)
                // Insert the HISTORY row.
                .compose(payment -> stmtPaymentInsertHistory.execute(
                        payment.c_id,
                        payment.c_d_id,
                        payment.c_w_id,
                        payment.d_id,
                        payment.w_id,
                        payment.h_date,
                        payment.h_amount,
                        historyData(payment.w_name, payment.d_name)))));
    }
    
    private Future<Payment> selectCustomer(Payment payment) {
        if (null == payment.c_last) {
            return stmtPaymentSelectCustomer.execute(payment.c_w_id, payment.c_d_id, payment.c_id).map(rows -> {
                Row row = rows.fetchOne();
                if (null == row) {
                    throw TransactionFailure.missing("Customer for C_W_ID=%d C_D_ID=%d C_ID=%d not found", payment.c_w_id, payment.c_d_id, payment.c_id);
                }
                return fillCustomer(payment, row);
            });
        }
        // C_LAST is given instead of C_ID (40%), take the middle one of the matches.
        return stmtPaymentSelectCustomerListByLast.execute(payment.c_w_id, payment.c_d_id, payment.c_last).map(rows -> {
            List<Row> customers = rows.fetchAll();
            if (customers.isEmpty()) {
                throw TransactionFailure.missing("Customer(s) for C_W_ID=%d C_D_ID=%d C_LAST=%s not found", payment.c_w_id, payment.c_d_id, payment.c_last);
            }
            return fillCustomer(payment, selectMedianCustomer(customers));
        });
    }
    
    /**
     * Customer at index {@code count / 2} of the matches sorted by first name.
     *
     * @param customers rows whose second column is c_first
     * @return median customer
     */
    static Row selectMedianCustomer(List<Row> customers) {
        List<Row> sorted = new ArrayList<>(customers);
        sorted.sort(Comparator.comparing(row -> row.getString(1)));
        return sorted.get(sorted.size() / 2);
    }
    
    private static Payment fillCustomer(Payment payment, Row row) {
        payment.c_id = row.getInteger(0);
        payment.c_first = row.getString(1);
        payment.c_middle = row.getString(2);
        payment.c_last = row.getString(3);
        payment.c_credit = row.getString(4);
        payment.c_discount = row.getDouble(5);
        payment.c_balance = row.getDouble(6);
        payment.c_ytd_payment = row.getDouble(7);
        payment.c_payment_cnt = row.getInteger(8);
        payment.c_data = row.getString(9);
        return payment;
    }
    
    private Future<Payment> updateCustomer(Payment payment) {
        payment.c_balance -= payment.h_amount;
        payment.c_ytd_payment += payment.h_amount;
        payment.c_payment_cnt++;
        if (!BAD_CREDIT.equals(payment.c_credit)) {
            // Customer with good credit, don't update C_DATA.
            return stmtPaymentUpdateCustomer.execute(payment.c_balance, payment.c_ytd_payment, payment.c_payment_cnt,
                    payment.c_w_id, payment.c_d_id, payment.c_id).map(payment);
        }
        // Customer with bad credit, need to do the C_DATA work.
        payment.c_data = badCreditData(payment);
        return stmtPaymentUpdateCustomerWithData.execute(payment.c_balance, payment.c_ytd_payment, payment.c_payment_cnt, payment.c_data,
                payment.c_w_id, payment.c_d_id, payment.c_id).map(payment);
    }
    
    static String badCreditData(Payment payment) {
        StringBuilder result = new StringBuilder(String.format(Locale.ROOT, "C_ID=%d C_D_ID=%d C_W_ID=%d D_ID=%d W_ID=%d H_AMOUNT=%.2f ",
                payment.c_id, payment.c_d_id, payment.c_w_id, payment.d_id, payment.w_id, payment.h_amount))
                .append(null == payment.c_data ? "" : payment.c_data);
        if (result.length() > C_DATA_MAX_LENGTH) {
            result.setLength(C_DATA_MAX_LENGTH);
        }
        return result.toString();
    }
    
    static String historyData(String w_name, String d_name) {
        return truncate(w_name, 10) + "    " + truncate(d_name, 10);
    }
    
    private static String truncate(String value, int maxLength) {
        return value.length() > maxLength ? value.substring(0, maxLength) : value;
    }
    
    Payment generatePayment(int warehouseId) {
        // 2.5.1.1 & 2.5.1.2
        Payment payment = new Payment(warehouseId, random.nextInt(1, Configurations.DISTRICTS_PER_WAREHOUSE));
        payment.c_w_id = payment.w_id;
        payment.c_d_id = payment.d_id;
        if (random.nextInt(1, 100) <= 85) {
            if (random.nextInt(1, 100) <= 15) {
                payment.c_d_id = random.nextInt(1, Configurations.DISTRICTS_PER_WAREHOUSE);
            }
        } else {
            while (payment.c_w_id == payment.w_id && configuration.getWarehouses() > 1) {
                payment.c_w_id = random.nextInt(1, configuration.getWarehouses());
            }
            payment.c_d_id = random.nextInt(1, Configurations.DISTRICTS_PER_WAREHOUSE);
        }
        if (random.nextInt(1, 100) <= 60) {
            payment.c_last = null;
            payment.c_id = random.getCustomerID();
        } else {
            payment.c_last = random.getCLast();
            payment.c_id = 0;
        }
        // 2.5.1.3
        payment.h_amount = (double) random.nextLong(100, 500000) / 100.0;
        return payment;
    }
}
