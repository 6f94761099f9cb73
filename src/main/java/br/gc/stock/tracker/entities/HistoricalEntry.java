package br.gc.stock.tracker.entities;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One trading day of price history for a stock.
 * <p>
 * Prices are kept exactly as the source formats them ("12,34", "-" for missing), so nothing
 * is lost on ingestion; numeric interpretation happens only when a variation is computed.
 * Only the calendar day of {@code tradingDate} is significant, and there is at most one
 * live entry per stock and day.
 */
@Entity
@Table(name = "historical_stock_data", indexes = {
    @Index(name = "idx_history_stock_id", columnList = "stock_id"),
    @Index(name = "idx_history_trading_date", columnList = "trading_date")
})
@Getter
@Setter
@ToString
@SuperBuilder
@NoArgsConstructor
public class HistoricalEntry extends BaseEntity {

    @Column(name = "stock_id", nullable = false, length = 36)
    private String stockId;

    @JsonIgnore
    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "stock_id", insertable = false, updatable = false)
    private Stock stock;

    @Column(name = "trading_date", nullable = false)
    private LocalDateTime tradingDate;

    @Column(name = "open_price", nullable = false, length = 20)
    private String openPrice;

    @Column(name = "close_price", nullable = false, length = 20)
    private String closePrice;

    /**
     * Closing quote of the day, decimal-formatted by the source.
     */
    @Column(name = "variation", nullable = false, length = 20)
    private String variation;

    @Column(name = "min_price", nullable = false, length = 20)
    private String minPrice;

    @Column(name = "max_price", nullable = false, length = 20)
    private String maxPrice;

    @Column(name = "volume", nullable = false, length = 20)
    private String volume;

    @Override
    public List<String> missingRequiredAttributes() {
        List<String> missing = new ArrayList<>();
        if (stockId == null) {
            missing.add("stockId");
        }
        if (tradingDate == null) {
            missing.add("tradingDate");
        }
        if (openPrice == null) {
            missing.add("openPrice");
        }
        if (closePrice == null) {
            missing.add("closePrice");
        }
        if (variation == null) {
            missing.add("variation");
        }
        if (minPrice == null) {
            missing.add("minPrice");
        }
        if (maxPrice == null) {
            missing.add("maxPrice");
        }
        if (volume == null) {
            missing.add("volume");
        }
        return missing;
    }
}
