package br.gc.stock.tracker.exceptions;

public class NoHistoryInWindowException extends StockTrackerException {

    public NoHistoryInWindowException(String stockId, int days) {
        super("No historical data available for stock " + stockId + " in the last " + days + " days");
    }
}
