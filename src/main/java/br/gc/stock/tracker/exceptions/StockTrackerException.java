package br.gc.stock.tracker.exceptions;

/**
 * Base class of every failure raised by the tracker.
 */
public abstract class StockTrackerException extends RuntimeException {

    protected StockTrackerException(String message) {
        super(message);
    }

    protected StockTrackerException(String message, Throwable cause) {
        super(message, cause);
    }
}
