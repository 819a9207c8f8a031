package icu.wwj.benchmark.rmdb;

import ch.qos.logback.classic.Level;
import icu.wwj.benchmark.rmdb.config.BenchmarkConfiguration;
import icu.wwj.benchmark.rmdb.config.CommandLineOptions;
import icu.wwj.benchmark.rmdb.protocol.RMDBConnection;
import icu.wwj.benchmark.rmdb.protocol.RMDBSession;
import icu.wwj.benchmark.rmdb.protocol.TransportFactory;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonObject;
import io.vertx.core.logging.SLF4JLogDelegateFactory;
import io.vertx.core.net.NetClientOptions;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public final class TPCC {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(TPCC.class);
    
    private static final long SHUTDOWN_WAIT_SECONDS = 30L;
    
    private final BenchmarkConfiguration configuration;
    
    private final Vertx vertx;
    
    private final TransportFactory transportFactory;
    
    private final CancellationToken cancellationToken;
    
    private final ResultReporter resultReporter;
    
    private ResultFileWriter resultFileWriter;
    
    private LocalDateTime sessionStartLocalDateTime;
    
    private long sessionStartNanoTime;
    
    private LocalDateTime sessionStopLocalDateTime;
    
    private long sessionStopNanoTime;
    
    public TPCC(BenchmarkConfiguration configuration, Vertx vertx, TransportFactory transportFactory, CancellationToken cancellationToken) {
        this.configuration = configuration;
        this.vertx = vertx;
        vertx.exceptionHandler(cause -> LOGGER.error("Unhandled exception", cause));
        this.transportFactory = transportFactory;
        this.cancellationToken = cancellationToken;
        resultReporter = new ResultReporter(configuration.getTerminals());
    }
    
    /**
     * Deploy the terminals, start them together and merge their results once all of them returned.
     *
     * @return result of the run, partial if cancelled
     */
    public Future<BenchmarkResult> run() {
        LOGGER.info("Starting TPC-C with {} terminals, {} transactions per terminal.", configuration.getTerminals(), configuration.getTransactionsPerTerminal());
        if (null != configuration.getResultFile()) {
            resultFileWriter = new ResultFileWriter(vertx, configuration.getResultFile());
        }
        AtomicInteger idGenerator = new AtomicInteger();
        List<Terminal> terminals = new CopyOnWriteArrayList<>();
        return vertx.deployVerticle(() -> {
                    Terminal result = new Terminal(configuration, idGenerator.incrementAndGet(), transportFactory, resultReporter, cancellationToken);
                    terminals.add(result);
                    return result;
                }, new DeploymentOptions().setInstances(configuration.getTerminals()))
                .compose(deploymentId -> onTerminalsReady(deploymentId, terminals))
                .onFailure(cause -> LOGGER.error("Failed to run terminals, caused by:", cause))
                .eventually(__ -> closeResultFileWriter());
    }
    
    private Future<BenchmarkResult> onTerminalsReady(String deploymentId, List<Terminal> terminals) {
        LOGGER.info("Starting terminals.");
        sessionStartLocalDateTime = LocalDateTime.now();
        sessionStartNanoTime = System.nanoTime();
        vertx.eventBus().publish(Terminal.START_ADDRESS, sessionStartNanoTime);
        long realtimeReporter = configuration.getReportIntervalSeconds() > 0
                ? vertx.setPeriodic(TimeUnit.SECONDS.toMillis(configuration.getReportIntervalSeconds()), __ -> reportCurrentTPM())
                : -1L;
        List<Future<List<TransactionResult>>> terminalResults = new ArrayList<>(terminals.size());
        for (Terminal each : terminals) {
            terminalResults.add(each.getResult());
        }
        return Future.all(terminalResults).compose(__ -> {
            sessionStopNanoTime = System.nanoTime();
            sessionStopLocalDateTime = LocalDateTime.now();
            if (realtimeReporter >= 0L) {
                vertx.cancelTimer(realtimeReporter);
            }
            LOGGER.info("Stopping terminals.");
            List<List<TransactionResult>> results = new ArrayList<>(terminalResults.size());
            for (Future<List<TransactionResult>> each : terminalResults) {
                results.add(each.result());
            }
            long durationMillis = TimeUnit.NANOSECONDS.toMillis(sessionStopNanoTime - sessionStartNanoTime);
            BenchmarkResult result = BenchmarkResult.aggregate(results, durationMillis, cancellationToken.isCancelled());
            return vertx.undeploy(deploymentId).map(result);
        }).onSuccess(this::finalReport);
    }
    
    private Future<Void> closeResultFileWriter() {
        return null == resultFileWriter ? Future.succeededFuture() : resultFileWriter.close();
    }
    
    private void reportCurrentTPM() {
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - sessionStartNanoTime);
        if (elapsedMillis <= 0L) {
            return;
        }
        double tpmC = Math.round(100.0 * 60_000 * resultReporter.sumNewOrderCount() / elapsedMillis) / 100.0;
        double tpmTotal = Math.round(100.0 * 60_000 * resultReporter.sumTotalCount() / elapsedMillis) / 100.0;
        LOGGER.info("Current tpmTOTAL: {}\tCurrent tpmC: {}", tpmTotal, tpmC);
    }
    
    private void finalReport(BenchmarkResult result) {
        if (result.isCancelled()) {
            LOGGER.warn("Benchmark cancelled, the results below are partial");
        }
        LOGGER.info("Measured tpmC (NewOrders) = {}", String.format("%.2f", result.getTpmC()));
        LOGGER.info("Measured TPS              = {}", String.format("%.2f", result.getThroughput()));
        LOGGER.info("Session Start     = {}", sessionStartLocalDateTime);
        LOGGER.info("Session End       = {}", sessionStopLocalDateTime);
        LOGGER.info("Total Duration    = {} ms", result.getDurationMillis());
        LOGGER.info("Transaction Count = {}", result.getTotalTransactions());
        LOGGER.info("Successful        = {}", result.getSuccessfulTransactions());
        LOGGER.info("Failed            = {}", result.getFailedTransactions());
        LOGGER.info("Success Rate      = {}%", String.format("%.2f", result.getSuccessRate()));
        LOGGER.info("Average Response  = {} ms", String.format("%.2f", result.getAverageResponseMillis()));
        for (TPCCTransaction each : TPCCTransaction.values()) {
            long executed = result.getExecutedCounts().get(each);
            if (executed > 0L) {
                LOGGER.info("  {}: {} executed, {} succeeded ({}%)", each.getDisplayName(), executed, result.getSuccessfulCounts().get(each),
                        String.format("%.1f", executed * 100.0 / result.getTotalTransactions()));
            }
        }
    }
    
    public static void main(String[] args) {
        System.setProperty("vertx.logger-delegate-factory-class-name", SLF4JLogDelegateFactory.class.getName());
        System.exit(launch(args));
    }
    
    /**
     * Run the command line.
     *
     * @param args arguments
     * @return process exit code
     */
    static int launch(String[] args) {
        CommandLine commandLine;
        try {
            commandLine = CommandLineOptions.parse(args);
        } catch (final ParseException ex) {
            LOGGER.error("Invalid arguments: {}", ex.getMessage());
            CommandLineOptions.printUsage();
            return 1;
        }
        if (commandLine.hasOption(CommandLineOptions.HELP)) {
            CommandLineOptions.printUsage();
            return 0;
        }
        if (commandLine.hasOption(CommandLineOptions.VERBOSE)) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME)).setLevel(Level.DEBUG);
        }
        BenchmarkConfiguration configuration;
        try {
            configuration = new BenchmarkConfiguration(loadProperties(commandLine.getOptionValue(CommandLineOptions.PROPS, System.getProperty("props"))),
                    CommandLineOptions.toProperties(commandLine));
        } catch (final IOException | IllegalArgumentException ex) {
            LOGGER.error("Invalid configuration: {}", ex.getMessage());
            return 1;
        }
        if (configuration.getWarehouses() < 1) {
            LOGGER.error("Scale factor must be at least 1");
            return 1;
        }
        try {
            configuration.validate();
        } catch (final IllegalArgumentException ex) {
            LOGGER.error("Invalid configuration: {}", ex.getMessage());
            return 1;
        }
        boolean stats = commandLine.hasOption(CommandLineOptions.STATS);
        boolean benchmark = commandLine.hasOption(CommandLineOptions.BENCHMARK);
        if (!stats && !benchmark) {
            LOGGER.info("Use --benchmark for concurrent benchmark, or --stats for statistics");
            return 0;
        }
        CancellationToken cancellationToken = new CancellationToken();
        ShutdownHook shutdownHook = ShutdownHook.install(cancellationToken, TimeUnit.SECONDS.toMillis(SHUTDOWN_WAIT_SECONDS));
        Vertx vertx = Vertx.vertx(new VertxOptions(new JsonObject(configuration.getVertxOptions())));
        try {
            TransportFactory transportFactory = RMDBConnection.factory(configuration.getHost(), configuration.getPort(),
                    new NetClientOptions(new JsonObject(configuration.getNetClientOptions())), configuration.getRequestTimeoutMillis());
            if (stats) {
                printStatistics(vertx, transportFactory);
            }
            if (benchmark && !cancellationToken.isCancelled()) {
                runBenchmark(configuration, vertx, transportFactory, cancellationToken);
            }
            return 0;
        } catch (final InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.info("Operation cancelled by user");
            return 0;
        } catch (final Exception ex) {
            LOGGER.error("Error: {}", ex.getMessage(), ex);
            return 1;
        } finally {
            shutdownHook.done();
            vertx.close().onFailure(cause -> LOGGER.warn("Failed to close Vert.x", cause));
        }
    }
    
    private static Properties loadProperties(String path) throws IOException {
        Properties result = new Properties();
        if (null != path) {
            try (InputStream in = new FileInputStream(path)) {
                result.load(in);
            }
        }
        return result;
    }
    
    private static void printStatistics(Vertx vertx, TransportFactory transportFactory) throws InterruptedException, ExecutionException {
        RMDBSession session = new RMDBSession(vertx, transportFactory, "Statistics");
        Map<String, Long> statistics = await(new DatabaseStatistics(session).collect().eventually(__ -> session.close()));
        LOGGER.info("Database Statistics:");
        statistics.forEach((table, rows) -> LOGGER.info("  {}: {} rows", table, rows));
    }
    
    private static void runBenchmark(BenchmarkConfiguration configuration, Vertx vertx, TransportFactory transportFactory,
                                     CancellationToken cancellationToken) throws InterruptedException, ExecutionException {
        LOGGER.info("Starting TPC-C benchmark...");
        await(new TPCC(configuration, vertx, transportFactory, cancellationToken).run());
        LOGGER.info("TPC-C Finished");
    }
    
    private static <T> T await(Future<T> future) throws InterruptedException, ExecutionException {
        return future.toCompletionStage().toCompletableFuture().get();
    }
}
