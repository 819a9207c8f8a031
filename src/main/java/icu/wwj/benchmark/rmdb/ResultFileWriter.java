package icu.wwj.benchmark.rmdb;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.eventbus.DeliveryOptions;
import io.vertx.core.eventbus.Message;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.file.AsyncFile;
import io.vertx.core.file.OpenOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends one CSV line per finished transaction. Terminals send lines to {@link #ADDRESS}.
 */
public class ResultFileWriter {
    
    public static final String ADDRESS = ResultFileWriter.class.getSimpleName();
    
    static final String HEADER = "terminal,timestamp,ttype,success,elapsed,attempts";
    
    private static final Logger LOGGER = LoggerFactory.getLogger(ResultFileWriter.class);
    
    private static final String FLUSH_HEADER = "flush";
    
    private final Vertx vertx;
    
    private final AsyncFile file;
    
    private final MessageConsumer<String> resultConsumer;
    
    public ResultFileWriter(Vertx vertx, String path) {
        this.vertx = vertx;
        file = vertx.fileSystem().openBlocking(path, new OpenOptions().setTruncateExisting(true));
        file.write(Buffer.buffer(HEADER + '\n'));
        resultConsumer = vertx.eventBus().localConsumer(ADDRESS, this::handleResult);
        LOGGER.info("Writing transaction results to {}", path);
    }
    
    static String toLine(TransactionResult result) {
        return result.getTerminalId() + "," + result.getTimestamp() + "," + result.getType().getDisplayName() + ","
                + (result.isSuccess() ? "1" : "0") + "," + result.getElapsedMillis() + "," + result.getAttempts();
    }
    
    private void handleResult(Message<String> result) {
        if (result.headers().contains(FLUSH_HEADER)) {
            result.reply(null);
            return;
        }
        file.write(Buffer.buffer(result.body() + '\n'));
    }
    
    /**
     * Close after every line sent before this call has been written.
     */
    public Future<Void> close() {
        return vertx.eventBus().request(ADDRESS, "", new DeliveryOptions().addHeader(FLUSH_HEADER, Boolean.TRUE.toString()))
                .compose(__ -> resultConsumer.unregister())
                .compose(__ -> file.close())
                .onSuccess(__ -> LOGGER.info("Result file writer closed."))
                .onFailure(cause -> LOGGER.error("Failed to close result file writer", cause));
    }
}
