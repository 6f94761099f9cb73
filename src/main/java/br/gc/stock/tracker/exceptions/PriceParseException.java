package br.gc.stock.tracker.exceptions;

import lombok.Getter;

/**
 * A source-formatted price could not be read as a number.
 */
@Getter
public class PriceParseException extends StockTrackerException {

    private final String rawValue;

    public PriceParseException(String rawValue, Throwable cause) {
        super("Not a numeric price: '" + rawValue + "'", cause);
        this.rawValue = rawValue;
    }
}
