package br.gc.stock.tracker.services;

import br.gc.stock.tracker.entities.HistoricalEntry;
import br.gc.stock.tracker.entities.Stock;
import br.gc.stock.tracker.repositories.HistoricalEntryStore;
import br.gc.stock.tracker.repositories.HistoricalEntryStore.HistoryDateRange;
import br.gc.stock.tracker.services.HistoryIngestionService.IngestionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the price history, addressed by stock code.
 * Unknown codes raise {@link br.gc.stock.tracker.exceptions.StockNotFoundException}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HistoricalDataService {

    private final StockService stockService;
    private final HistoricalEntryStore historicalEntryStore;
    private final HistoryIngestionService historyIngestionService;
    private final PriceVariationCalculator priceVariationCalculator;

    public List<HistoricalEntry> getHistory(String stockCode) {
        Stock stock = stockService.requireByCode(stockCode);
        return historicalEntryStore.findByStock(stock.getId());
    }

    /**
     * Entries whose trading day lies in {@code [from, to]}.
     */
    public List<HistoricalEntry> getHistory(String stockCode, LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("start_date " + from + " is after end_date " + to);
        }
        Stock stock = stockService.requireByCode(stockCode);
        return historicalEntryStore.findByStockAndDateRange(stock.getId(), from, to);
    }

    public Optional<HistoricalEntry> getLatest(String stockCode) {
        Stock stock = stockService.requireByCode(stockCode);
        return historicalEntryStore.findLatest(stock.getId());
    }

    public Optional<HistoryDateRange> getDateRange(String stockCode) {
        Stock stock = stockService.requireByCode(stockCode);
        return historicalEntryStore.dateRange(stock.getId());
    }

    /**
     * Change of the quote over the {@code days} calendar days that end on the latest stored day.
     *
     * @return empty when the stock has no history
     */
    public Optional<PriceVariation> getPriceVariation(String stockCode, int days) {
        if (days < 0) {
            throw new IllegalArgumentException("days must not be negative, got " + days);
        }
        Stock stock = stockService.requireByCode(stockCode);
        Optional<HistoricalEntry> latest = historicalEntryStore.findLatest(stock.getId());
        if (latest.isEmpty()) {
            log.debug("No history stored for {}", stockCode);
            return Optional.empty();
        }
        LocalDate end = latest.get().getTradingDate().toLocalDate();
        List<HistoricalEntry> window = historicalEntryStore.findByStockAndDateRange(stock.getId(), end.minusDays(days), end);
        return priceVariationCalculator.calculate(latest, window, days);
    }

    public IngestionResult ingest(String stockCode, int pages) {
        return historyIngestionService.ingest(stockService.requireByCode(stockCode), pages);
    }

    public List<IngestionResult> ingestAll(int pages) {
        return historyIngestionService.ingestAll(pages);
    }
}
