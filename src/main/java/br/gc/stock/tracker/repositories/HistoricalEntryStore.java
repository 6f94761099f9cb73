package br.gc.stock.tracker.repositories;

import br.gc.stock.tracker.entities.HistoricalEntry;
import br.gc.stock.tracker.query.Condition;
import br.gc.stock.tracker.query.Filter;
import br.gc.stock.tracker.query.HistoricalEntryField;
import br.gc.stock.tracker.query.OrderBy;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

/**
 * Daily history per stock. Date arguments are calendar days and ranges include both ends.
 */
@Component
public class HistoricalEntryStore extends EntityStore<HistoricalEntry> {

    // timestamp columns keep microseconds; LocalTime.MAX would round into the next day
    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59, 999_999_000);

    public HistoricalEntryStore(HistoricalEntryRepository historicalEntryRepository) {
        super(historicalEntryRepository, "historical entry");
    }

    @Transactional(readOnly = true)
    public List<HistoricalEntry> findByStock(String stockId) {
        return findBy(byStock(stockId), OrderBy.asc(HistoricalEntryField.TRADING_DATE));
    }

    @Transactional(readOnly = true)
    public List<HistoricalEntry> findByStockAndDateRange(String stockId, LocalDate from, LocalDate to) {
        return findBy(byStock(stockId).and(HistoricalEntryField.TRADING_DATE,
                        Condition.between(from.atStartOfDay(), to.atTime(END_OF_DAY))),
                OrderBy.asc(HistoricalEntryField.TRADING_DATE));
    }

    @Transactional(readOnly = true)
    public Optional<HistoricalEntry> findLatest(String stockId) {
        return findOneBy(byStock(stockId), OrderBy.desc(HistoricalEntryField.TRADING_DATE));
    }

    @Transactional(readOnly = true)
    public Optional<HistoricalEntry> findOldest(String stockId) {
        return findOneBy(byStock(stockId), OrderBy.asc(HistoricalEntryField.TRADING_DATE));
    }

    /**
     * First and last trading day stored for the stock, or empty when it has no history.
     */
    @Transactional(readOnly = true)
    public Optional<HistoryDateRange> dateRange(String stockId) {
        Optional<HistoricalEntry> oldest = findOldest(stockId);
        if (oldest.isEmpty()) {
            return Optional.empty();
        }
        HistoricalEntry latest = findLatest(stockId).orElse(oldest.get());
        return Optional.of(new HistoryDateRange(
                oldest.get().getTradingDate(),
                latest.getTradingDate(),
                count(byStock(stockId))));
    }

    @Transactional(readOnly = true)
    public Optional<HistoricalEntry> findByDate(String stockId, LocalDate day) {
        LocalDateTime start = day.atStartOfDay();
        return findOneBy(byStock(stockId).and(HistoricalEntryField.TRADING_DATE,
                Condition.between(start, day.atTime(END_OF_DAY))));
    }

    /**
     * Writes one batch of entries in a single transaction.
     */
    @Transactional
    public List<HistoricalEntry> saveEntries(List<HistoricalEntry> entries) {
        return createMany(entries);
    }

    private static Filter<HistoricalEntry> byStock(String stockId) {
        return Filter.where(HistoricalEntryField.STOCK_ID, Condition.equalTo(stockId));
    }

    public record HistoryDateRange(LocalDateTime firstTradingDate, LocalDateTime lastTradingDate, long entries) {
    }
}
