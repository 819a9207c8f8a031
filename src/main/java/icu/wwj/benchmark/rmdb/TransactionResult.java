package icu.wwj.benchmark.rmdb;

import icu.wwj.benchmark.rmdb.protocol.FailureKind;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.io.Serializable;
import java.time.LocalDateTime;

@AllArgsConstructor
@Data
public class TransactionResult implements Serializable {
    
    private static final long serialVersionUID = 2611418470353265014L;
    
    private TPCCTransaction type;
    
    private boolean success;
    
    private long elapsedMillis;
    
    /**
     * Start of the first attempt.
     */
    private LocalDateTime timestamp;
    
    private int terminalId;
    
    private int attempts;
    
    /**
     * Kind of the last failure, null when the transaction committed or was rolled back on purpose.
     */
    private FailureKind failureKind;
}
