package br.gc.stock.tracker.query;

import br.gc.stock.tracker.entities.Stock;

public enum StockField implements EntityField<Stock> {
    ID("id"),
    CODE("code"),
    NAME("name"),
    COMPANY("company"),
    URL("url"),
    URL_NEWS("urlNews"),
    CREATED_AT("createdAt"),
    UPDATED_AT("updatedAt");

    private final String attribute;

    StockField(String attribute) {
        this.attribute = attribute;
    }

    @Override
    public String attribute() {
        return attribute;
    }
}
