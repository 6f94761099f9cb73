package br.gc.stock.tracker.services;

import br.gc.stock.tracker.config.StockTrackerProperties;
import br.gc.stock.tracker.entities.HistoricalEntry;
import br.gc.stock.tracker.entities.Stock;
import br.gc.stock.tracker.exceptions.FetchException;
import br.gc.stock.tracker.http.HistoryPageFetcher;
import br.gc.stock.tracker.http.RawHistoryEntry;
import br.gc.stock.tracker.repositories.HistoricalEntryStore;
import br.gc.stock.tracker.repositories.StockStore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pulls daily history pages for a stock and stores the days not stored yet.
 *
 * <h3>Guarantees:</h3>
 * <ul>
 *   <li>At most one entry per stock and calendar day, also within a single page</li>
 *   <li>Re-running with the same pages stores nothing new</li>
 *   <li>A page that cannot be fetched is reported and skipped; the other pages still land</li>
 *   <li>Each page is written in its own transaction</li>
 * </ul>
 * Storage failures are not recorded per page; they abort the run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HistoryIngestionService {

    private final HistoryPageFetcher historyPageFetcher;
    private final HistoricalEntryStore historicalEntryStore;
    private final StockStore stockStore;
    private final StockTrackerProperties properties;

    public IngestionResult ingest(Stock stock, int pageCount) {
        if (pageCount < 1) {
            throw new IllegalArgumentException("pageCount must be at least 1, got " + pageCount);
        }
        if (stock == null || stock.getId() == null) {
            throw new IllegalArgumentException("Stock must be persisted before ingesting its history");
        }

        ZoneId zone = properties.getIngestion().getZone();
        Set<LocalDate> knownDays = new HashSet<>();
        for (HistoricalEntry entry : historicalEntryStore.findByStock(stock.getId())) {
            knownDays.add(entry.getTradingDate().toLocalDate());
        }
        log.info("📥 Ingesting {} page(s) of history for {} ({} days already stored)",
                pageCount, stock.getCode(), knownDays.size());

        int saved = 0;
        int duplicates = 0;
        int pagesFetched = 0;
        List<String> errors = new ArrayList<>();

        for (int page = 0; page < pageCount; page++) {
            List<RawHistoryEntry> rawEntries;
            try {
                rawEntries = historyPageFetcher.fetchPage(stock.getCode(), page);
            } catch (FetchException e) {
                log.warn("History page {} of {} failed: {}", page, stock.getCode(), e.getMessage());
                errors.add("Failed to fetch page " + page + ": " + e.getMessage());
                continue;
            }
            pagesFetched++;

            List<HistoricalEntry> novel = new ArrayList<>();
            int pageDuplicates = 0;
            for (RawHistoryEntry raw : rawEntries) {
                LocalDateTime tradingDate = toTradingDate(raw.dateTimestamp(), zone);
                if (!knownDays.add(tradingDate.toLocalDate())) {
                    pageDuplicates++;
                    continue;
                }
                novel.add(toEntry(stock.getId(), tradingDate, raw));
            }

            if (!novel.isEmpty()) {
                historicalEntryStore.saveEntries(novel);
            }
            log.info("Page {} of {}: {} entries, {} duplicates skipped, {} saved",
                    page, stock.getCode(), rawEntries.size(), pageDuplicates, novel.size());
            saved += novel.size();
            duplicates += pageDuplicates;
        }

        boolean success = saved > 0 || duplicates > 0;
        if (success) {
            log.info("✅ History of {}: {} saved, {} duplicates skipped, {} page error(s)",
                    stock.getCode(), saved, duplicates, errors.size());
        } else {
            log.warn("⚠️ No history obtained for {} ({} page error(s))", stock.getCode(), errors.size());
        }
        return new IngestionResult(stock.getCode(), stock.getId(), saved, duplicates, pagesFetched, errors, success);
    }

    /**
     * Ingests every live stock, one after another.
     *
     * @return one result per stock, in stock code order
     */
    public List<IngestionResult> ingestAll(int pageCount) {
        if (pageCount < 1) {
            throw new IllegalArgumentException("pageCount must be at least 1, got " + pageCount);
        }
        List<Stock> stocks = stockStore.findAllOrderedByCode();
        log.info("Ingesting history for {} stocks", stocks.size());

        List<IngestionResult> results = new ArrayList<>(stocks.size());
        for (Stock stock : stocks) {
            results.add(ingest(stock, pageCount));
        }
        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        log.info("History ingestion finished: {} stocks, {} without data", results.size(), failed);
        return results;
    }

    static LocalDateTime toTradingDate(long epochSeconds, ZoneId zone) {
        return LocalDateTime.ofInstant(Instant.ofEpochSecond(epochSeconds), zone);
    }

    private static HistoricalEntry toEntry(String stockId, LocalDateTime tradingDate, RawHistoryEntry raw) {
        return HistoricalEntry.builder()
                .stockId(stockId)
                .tradingDate(tradingDate)
                .openPrice(raw.openPrice())
                .closePrice(raw.closePrice())
                .variation(raw.variation())
                .minPrice(raw.minPrice())
                .maxPrice(raw.maxPrice())
                .volume(raw.volume())
                .build();
    }

    @Data
    @AllArgsConstructor
    public static class IngestionResult {
        private String stockCode;
        private String stockId;
        private int entriesSaved;
        private int duplicatesSkipped;
        private int pagesFetched;
        private List<String> errors;
        private boolean success;
    }
}
