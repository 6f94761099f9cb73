package br.gc.stock.tracker.exceptions;

import lombok.Getter;

/**
 * No live stock has the requested code.
 */
@Getter
public class StockNotFoundException extends StockTrackerException {

    private final String code;

    public StockNotFoundException(String code) {
        super("Stock with code " + code + " not found");
        this.code = code;
    }
}
