package br.gc.stock.tracker.services;

import br.gc.stock.tracker.entities.Stock;
import br.gc.stock.tracker.exceptions.StockNotFoundException;
import br.gc.stock.tracker.http.StockListFetcher;
import br.gc.stock.tracker.query.Condition;
import br.gc.stock.tracker.query.Filter;
import br.gc.stock.tracker.query.OrderBy;
import br.gc.stock.tracker.query.StockField;
import br.gc.stock.tracker.repositories.StockStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class StockService {

    private final StockStore stockStore;
    private final StockListFetcher stockListFetcher;

    /**
     * Imports the stock list from InfoMoney.
     *
     * @return stocks that were not stored before
     */
    public List<Stock> syncFromSource() {
        log.info("📥 Synchronising stock list");
        List<Stock> candidates = stockListFetcher.fetchStocks();
        List<Stock> created = stockStore.bulkCreateSkippingDuplicates(candidates);
        log.info("✅ Stock list synchronised: {} fetched, {} new", candidates.size(), created.size());
        return created;
    }

    /**
     * Stores the given stocks, skipping codes already stored.
     */
    public List<Stock> create(List<Stock> stocks) {
        if (stocks == null || stocks.isEmpty()) {
            throw new IllegalArgumentException("No stocks data provided");
        }
        return stockStore.bulkCreateSkippingDuplicates(stocks);
    }

    /**
     * Stocks matching every {@code field -> value} pair, where the field is named as in a request
     * parameter ({@code url_news} or {@code urlNews}). Pairs naming no stock attribute are ignored.
     * An unknown or missing {@code orderBy} falls back to ordering by code.
     */
    public List<Stock> list(Map<String, String> fieldValues, String orderBy, boolean descending) {
        Filter<Stock> filter = Filter.all();
        fieldValues.forEach((name, value) -> filter.andIfKnown(StockField.class, name, Condition.equalTo(value)));
        OrderBy<Stock> order = OrderBy.parse(StockField.class, orderBy, descending);
        return stockStore.findBy(filter, order.isSorted() ? order : OrderBy.asc(StockField.CODE));
    }

    public Optional<Stock> getByCode(String code) {
        return stockStore.findByCode(code);
    }

    public Stock requireByCode(String code) {
        return stockStore.findByCode(code).orElseThrow(() -> new StockNotFoundException(code));
    }

    public List<Stock> search(String nameFragment) {
        if (nameFragment == null || nameFragment.isBlank()) {
            throw new IllegalArgumentException("Search term must not be empty");
        }
        return stockStore.searchByName(nameFragment.trim());
    }

    /**
     * @return false when no live stock has the code
     */
    public boolean softDelete(String code) {
        return stockStore.findByCode(code)
                .map(stock -> {
                    boolean deleted = stockStore.softDelete(stock.getId());
                    if (deleted) {
                        log.info("Stock {} deleted", stock.getCode());
                    }
                    return deleted;
                })
                .orElse(false);
    }
}
