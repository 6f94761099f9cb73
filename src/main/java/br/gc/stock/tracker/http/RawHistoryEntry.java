package br.gc.stock.tracker.http;

/**
 * One row of the InfoMoney history table, values exactly as the site formats them.
 *
 * @param dateDisplay   day as displayed, e.g. "03/04/2025"
 * @param dateTimestamp Unix epoch seconds of the trading day
 */
public record RawHistoryEntry(
        String dateDisplay,
        long dateTimestamp,
        String openPrice,
        String closePrice,
        String variation,
        String minPrice,
        String maxPrice,
        String volume) {
}
