package br.gc.stock.tracker.controllers;

import br.gc.stock.tracker.config.StockTrackerProperties;
import br.gc.stock.tracker.entities.HistoricalEntry;
import br.gc.stock.tracker.repositories.HistoricalEntryStore.HistoryDateRange;
import br.gc.stock.tracker.services.HistoricalDataService;
import br.gc.stock.tracker.services.HistoryIngestionService.IngestionResult;
import br.gc.stock.tracker.services.PriceVariation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/historical-data")
@RequiredArgsConstructor
@Slf4j
public class HistoricalDataController {

    private final HistoricalDataService historicalDataService;
    private final StockTrackerProperties properties;

    /**
     * Whole history, or the days in {@code [start_date, end_date]} when both are given (ISO dates).
     */
    @GetMapping("/{code}")
    public List<HistoricalEntry> getHistory(
            @PathVariable String code,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        if (startDate == null && endDate == null) {
            return historicalDataService.getHistory(code);
        }
        if (startDate == null || endDate == null) {
            throw new IllegalArgumentException("start_date and end_date must be given together");
        }
        return historicalDataService.getHistory(code, startDate, endDate);
    }

    @GetMapping("/{code}/latest")
    public ResponseEntity<HistoricalEntry> getLatest(@PathVariable String code) {
        return ResponseEntity.of(historicalDataService.getLatest(code));
    }

    @GetMapping("/{code}/variation")
    public ResponseEntity<PriceVariation> getVariation(@PathVariable String code,
                                                       @RequestParam(defaultValue = "30") int days) {
        return ResponseEntity.of(historicalDataService.getPriceVariation(code, days));
    }

    @GetMapping("/{code}/date-range")
    public Map<String, Object> getDateRange(@PathVariable String code) {
        Optional<HistoryDateRange> range = historicalDataService.getDateRange(code);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("stock_code", code.toUpperCase(Locale.ROOT));
        body.put("oldest_date", range.map(HistoryDateRange::firstTradingDate).orElse(null));
        body.put("newest_date", range.map(HistoryDateRange::lastTradingDate).orElse(null));
        body.put("entries", range.map(HistoryDateRange::entries).orElse(0L));
        body.put("has_data", range.isPresent());
        return body;
    }

    /**
     * Ingests history for one stock, or for every stock when {@code stock_code} is absent.
     */
    @PostMapping("/fetch")
    public List<IngestionResult> fetchHistory(
            @RequestParam(name = "stock_code", required = false) String stockCode,
            @RequestParam(required = false) Integer pages) {

        int pageCount = pages != null ? pages : properties.getIngestion().getDefaultPages();
        log.info("📥 REST: Ingesting {} page(s) of history for {}", pageCount, stockCode != null ? stockCode : "all stocks");
        if (stockCode != null) {
            return List.of(historicalDataService.ingest(stockCode, pageCount));
        }
        return historicalDataService.ingestAll(pageCount);
    }
}
