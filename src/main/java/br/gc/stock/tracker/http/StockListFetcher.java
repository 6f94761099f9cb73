package br.gc.stock.tracker.http;

import br.gc.stock.tracker.entities.Stock;

import java.util.List;

/**
 * Source of the listed stocks.
 */
public interface StockListFetcher {

    /**
     * @return unsaved stock candidates, one per code
     */
    List<Stock> fetchStocks();
}
