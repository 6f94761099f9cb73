package br.gc.stock.tracker.query;

import br.gc.stock.tracker.entities.HistoricalEntry;

public enum HistoricalEntryField implements EntityField<HistoricalEntry> {
    ID("id"),
    STOCK_ID("stockId"),
    TRADING_DATE("tradingDate"),
    OPEN_PRICE("openPrice"),
    CLOSE_PRICE("closePrice"),
    VARIATION("variation"),
    MIN_PRICE("minPrice"),
    MAX_PRICE("maxPrice"),
    VOLUME("volume"),
    CREATED_AT("createdAt"),
    UPDATED_AT("updatedAt");

    private final String attribute;

    HistoricalEntryField(String attribute) {
        this.attribute = attribute;
    }

    @Override
    public String attribute() {
        return attribute;
    }
}
