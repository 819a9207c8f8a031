package icu.wwj.benchmark.rmdb;

import icu.wwj.benchmark.rmdb.config.BenchmarkConfiguration;
import icu.wwj.benchmark.rmdb.protocol.FailureKind;
import icu.wwj.benchmark.rmdb.protocol.RMDBSession;
import icu.wwj.benchmark.rmdb.protocol.TransportFactory;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.eventbus.Message;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.eventbus.MessageProducer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One benchmark worker. Owns its session and random source and runs its transactions one after another once the
 * {@code start} event has been published.
 */
@Slf4j
public class Terminal extends AbstractVerticle {
    
    public static final String START_ADDRESS = "start";
    
    private final BenchmarkConfiguration configuration;
    
    private final int id;
    
    private final jTPCCRandom random;
    
    private final TransportFactory transportFactory;
    
    private final ResultReporter resultReporter;
    
    private final CancellationToken cancellationToken;
    
    private final String address;
    
    private final List<TransactionResult> results;
    
    private final Promise<List<TransactionResult>> resultPromise = Promise.promise();
    
    private final Map<TPCCTransaction, TransactionExecutor> executors = new EnumMap<>(TPCCTransaction.class);
    
    private RMDBSession session;
    
    private TransactionMixSelector mixSelector;
    
    private RetryPolicy retryPolicy;
    
    private MessageConsumer<String> transactionConsumer;
    
    private MessageProducer<String> resultProducer;
    
    private int warehouseId;
    
    public Terminal(BenchmarkConfiguration configuration, int id, TransportFactory transportFactory, ResultReporter resultReporter,
                    CancellationToken cancellationToken) {
        this.configuration = configuration;
        this.id = id;
        random = null == configuration.getSeed() ? new jTPCCRandom() : new jTPCCRandom(configuration.getSeed() + id);
        this.transportFactory = transportFactory;
        this.resultReporter = resultReporter;
        this.cancellationToken = cancellationToken;
        address = "Terminal-" + id;
        results = new ArrayList<>(configuration.getTransactionsPerTerminal());
    }
    
    /**
     * Results of this terminal, completed once it ran all its transactions, lost its connection or was cancelled.
     */
    public Future<List<TransactionResult>> getResult() {
        return resultPromise.future();
    }
    
    @Override
    public void start() {
        session = new RMDBSession(getVertx(), transportFactory, address);
        executors.put(TPCCTransaction.NEW_ORDER, new NewOrderExecutor(configuration, random, session));
        executors.put(TPCCTransaction.PAYMENT, new PaymentExecutor(configuration, random, session));
        executors.put(TPCCTransaction.DELIVERY, new DeliveryExecutor(random, session));
        executors.put(TPCCTransaction.ORDER_STATUS, new OrderStatusExecutor(random, session));
        executors.put(TPCCTransaction.STOCK_LEVEL, new StockLevelExecutor(random, session));
        mixSelector = TransactionMixSelector.of(configuration, random);
        retryPolicy = new RetryPolicy(getVertx(), id, cancellationToken);
        transactionConsumer = getVertx().eventBus().localConsumer(address);
        if (null != configuration.getResultFile()) {
            resultProducer = getVertx().eventBus().sender(ResultFileWriter.ADDRESS);
        }
        MessageConsumer<Long> startConsumer = getVertx().eventBus().localConsumer(START_ADDRESS);
        startConsumer.handler(msg -> {
            startConsumer.unregister();
            startExecutingTransactions();
        });
    }
    
    private void startExecutingTransactions() {
        transactionConsumer.handler(this::handleTPCCTransaction);
        if (configuration.isTerminalWarehouseFixed()) {
            warehouseId = random.nextInt(1, configuration.getWarehouses());
            log.info("Terminal-{} started. w_id = {}", id, warehouseId);
        } else {
            log.info("Terminal-{} started. w_id is not fixed", id);
        }
        sendNextTransaction();
    }
    
    private void handleTPCCTransaction(Message<String> message) {
        TPCCTransaction transaction = TPCCTransaction.valueOf(message.body());
        int w_id = configuration.isTerminalWarehouseFixed() ? warehouseId : random.nextInt(1, configuration.getWarehouses());
        TransactionExecutor executor = executors.get(transaction);
        retryPolicy.execute(transaction, () -> executor.execute(w_id)).onSuccess(this::onTransactionFinished);
    }
    
    private void onTransactionFinished(TransactionResult result) {
        results.add(result);
        resultReporter.record(result);
        if (null != resultProducer) {
            resultProducer.write(ResultFileWriter.toLine(result));
        }
        if (FailureKind.CONNECTION == result.getFailureKind()) {
            log.error("Terminal-{} stopped, no connection to the server", id);
            finish();
            return;
        }
        sendNextTransaction();
    }
    
    private void sendNextTransaction() {
        if (cancellationToken.isCancelled()) {
            log.info("Terminal-{} cancelled after {} transactions", id, results.size());
            finish();
            return;
        }
        if (results.size() >= configuration.getTransactionsPerTerminal()) {
            log.info("Terminal-{} finished {} transactions", id, results.size());
            finish();
            return;
        }
        getVertx().eventBus().send(address, mixSelector.next().name());
    }
    
    private void finish() {
        if (null != transactionConsumer) {
            transactionConsumer.unregister();
        }
        session.close()
                .onFailure(cause -> log.warn("Terminal-{} failed to close its connection", id, cause))
                .onComplete(__ -> resultPromise.tryComplete(Collections.unmodifiableList(results)));
    }
    
    @Override
    public void stop(Promise<Void> stopPromise) {
        resultPromise.tryComplete(Collections.unmodifiableList(new ArrayList<>(results)));
        session.close().onComplete(__ -> stopPromise.complete());
    }
}
