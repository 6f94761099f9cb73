package br.gc.stock.tracker.exceptions;

/**
 * A request to an external source failed after its retries were spent.
 */
public class FetchException extends StockTrackerException {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
