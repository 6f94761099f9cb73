package br.gc.stock.tracker.services;

import br.gc.stock.tracker.entities.HistoricalEntry;
import br.gc.stock.tracker.exceptions.NoHistoryInWindowException;
import br.gc.stock.tracker.exceptions.PriceParseException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Variation of the {@code variation} quote over a trailing window of days.
 * <p>
 * Pure computation: the caller loads the latest entry and the window.
 */
@Component
public class PriceVariationCalculator {

    private static final int SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * @param latest most recent entry of the stock, if any
     * @param window entries of the stock; those outside {@code [latest day - days, latest day]} are ignored
     * @return empty when there is no latest entry
     * @throws NoHistoryInWindowException when no entry falls in the window
     * @throws PriceParseException        when a quote of the window edges is not numeric
     */
    public Optional<PriceVariation> calculate(Optional<HistoricalEntry> latest, List<HistoricalEntry> window, int days) {
        if (days < 0) {
            throw new IllegalArgumentException("days must not be negative, got " + days);
        }
        if (latest.isEmpty()) {
            return Optional.empty();
        }
        HistoricalEntry newest = latest.get();
        LocalDate end = newest.getTradingDate().toLocalDate();
        LocalDate start = end.minusDays(days);

        List<HistoricalEntry> inWindow = window.stream()
                .filter(e -> {
                    LocalDate day = e.getTradingDate().toLocalDate();
                    return !day.isBefore(start) && !day.isAfter(end);
                })
                .sorted(Comparator.comparing(HistoricalEntry::getTradingDate))
                .toList();
        if (inWindow.isEmpty()) {
            throw new NoHistoryInWindowException(newest.getStockId(), days);
        }

        HistoricalEntry first = inWindow.get(0);
        BigDecimal startValue = parseDecimal(first.getVariation());
        BigDecimal endValue = parseDecimal(newest.getVariation());
        BigDecimal absolute = endValue.subtract(startValue);
        BigDecimal percentage = startValue.signum() == 0
                ? BigDecimal.ZERO
                : absolute.multiply(HUNDRED).divide(startValue, SCALE, RoundingMode.HALF_UP);

        return Optional.of(new PriceVariation(
                newest.getStockId(),
                days,
                first.getTradingDate(),
                newest.getTradingDate(),
                startValue,
                endValue,
                absolute.setScale(SCALE, RoundingMode.HALF_UP),
                percentage.setScale(SCALE, RoundingMode.HALF_UP)));
    }

    /**
     * Reads a Brazilian-formatted decimal: "1.234,56" and "12,50" as well as plain "12.50".
     */
    public static BigDecimal parseDecimal(String raw) {
        if (raw == null) {
            throw new PriceParseException(null, null);
        }
        String text = raw.trim();
        if (text.indexOf(',') >= 0) {
            text = text.replace(".", "").replace(',', '.');
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new PriceParseException(raw, e);
        }
    }
}
