package dk.cloudcreate.essentials.fmodel.application;

/**
 * Root of the exceptions raised by the application layer (the orchestrators and the repositories they use)
 */
public class AggregateException extends RuntimeException {
    public AggregateException() {
    }

    public AggregateException(String message) {
        super(message);
    }

    public AggregateException(String message, Throwable cause) {
        super(message, cause);
    }

    public AggregateException(Throwable cause) {
        super(cause);
    }
}
