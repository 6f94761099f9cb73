package br.gc.stock.tracker.services;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Change of the closing quote between the first and the last entry of a window.
 *
 * @param absolute   end minus start, two decimals
 * @param percentage absolute change relative to start, two decimals; zero when start is zero
 */
public record PriceVariation(
        String stockId,
        int days,
        LocalDateTime startDate,
        LocalDateTime endDate,
        BigDecimal startValue,
        BigDecimal endValue,
        BigDecimal absolute,
        BigDecimal percentage) {
}
