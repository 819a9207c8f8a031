package icu.wwj.benchmark.rmdb.protocol;

import lombok.Getter;

/**
 * Failure of a statement or of a transaction step, tagged with its kind.
 */
@Getter
public final class TransactionFailure extends RuntimeException {
    
    private static final long serialVersionUID = -3177011502934482745L;
    
    private final FailureKind kind;
    
    public TransactionFailure(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }
    
    public TransactionFailure(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
    
    public static TransactionFailure missing(String format, Object... args) {
        return new TransactionFailure(FailureKind.LOGIC, format.formatted(args));
    }
    
    /**
     * Kind of any throwable, {@link FailureKind#OTHER} for foreign ones.
     *
     * @param cause failure
     * @return kind
     */
    public static FailureKind kindOf(Throwable cause) {
        return cause instanceof TransactionFailure ? ((TransactionFailure) cause).getKind() : FailureKind.OTHER;
    }
}
