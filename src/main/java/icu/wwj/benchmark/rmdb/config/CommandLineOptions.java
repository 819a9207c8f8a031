package icu.wwj.benchmark.rmdb.config;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.util.Properties;

/**
 * Command line flags and their mapping onto configuration properties.
 */
public final class CommandLineOptions {
    
    public static final String SCALE = "scale";
    
    public static final String HOST = "host";
    
    public static final String PORT = "port";
    
    public static final String STATS = "stats";
    
    public static final String BENCHMARK = "benchmark";
    
    public static final String THREADS = "threads";
    
    public static final String TRANSACTIONS = "transactions";
    
    public static final String RW_RATIO = "rw-ratio";
    
    public static final String TXN_PROBS = "txn-probs";
    
    public static final String SEED = "seed";
    
    public static final String PROPS = "props";
    
    public static final String VERBOSE = "verbose";
    
    public static final String HELP = "help";
    
    private static final String[] WEIGHT_PROPERTIES = {"newOrderWeight", "paymentWeight", "deliveryWeight", "orderStatusWeight", "stockLevelWeight"};
    
    private CommandLineOptions() {
    }
    
    public static Options buildOptions() {
        Options options = new Options();
        options.addOption("s", SCALE, true, "Scale factor (number of warehouses)");
        options.addOption(null, HOST, true, "RMDB server host");
        options.addOption(null, PORT, true, "RMDB server port");
        options.addOption(null, STATS, false, "Show database statistics");
        options.addOption(null, BENCHMARK, false, "Run concurrent benchmark");
        options.addOption(null, THREADS, true, "Number of concurrent terminals for benchmark");
        options.addOption(null, TRANSACTIONS, true, "Transactions per terminal");
        options.addOption(null, RW_RATIO, true, "Read-write ratio (0.0-1.0)");
        options.addOption(Option.builder().longOpt(TXN_PROBS).numberOfArgs(WEIGHT_PROPERTIES.length)
                .argName("NEWORDER PAYMENT DELIVERY ORDERSTATUS STOCKLEVEL").desc("Transaction type probabilities").build());
        options.addOption(null, SEED, true, "Base random seed, terminal i uses seed + i");
        options.addOption(null, PROPS, true, "Properties file");
        options.addOption("v", VERBOSE, false, "Enable verbose logging");
        options.addOption("h", HELP, false, "Print this help");
        return options;
    }
    
    public static CommandLine parse(String[] args) throws ParseException {
        CommandLineParser parser = new DefaultParser();
        return parser.parse(buildOptions(), args);
    }
    
    public static void printUsage() {
        HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp("tpcc-rmdb", buildOptions(), true);
    }
    
    /**
     * Configuration properties given on the command line.
     *
     * @param commandLine parsed command line
     * @return properties overriding every other source
     * @throws IllegalArgumentException if a flag has the wrong number of values
     */
    public static Properties toProperties(CommandLine commandLine) {
        Properties result = new Properties();
        copy(commandLine, SCALE, result, "warehouses");
        copy(commandLine, HOST, result, "host");
        copy(commandLine, PORT, result, "port");
        copy(commandLine, THREADS, result, "terminals");
        copy(commandLine, TRANSACTIONS, result, "transactionsPerTerminal");
        copy(commandLine, RW_RATIO, result, "readWriteRatio");
        copy(commandLine, SEED, result, "seed");
        if (commandLine.hasOption(TXN_PROBS)) {
            String[] values = commandLine.getOptionValues(TXN_PROBS);
            if (values.length != WEIGHT_PROPERTIES.length) {
                throw new IllegalArgumentException("--txn-probs takes %d values, got %d".formatted(WEIGHT_PROPERTIES.length, values.length));
            }
            for (int i = 0; i < values.length; i++) {
                result.setProperty(WEIGHT_PROPERTIES[i], values[i].trim());
            }
        }
        return result;
    }
    
    private static void copy(CommandLine commandLine, String option, Properties props, String key) {
        String value = commandLine.getOptionValue(option);
        if (null != value) {
            props.setProperty(key, value.trim());
        }
    }
}
