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
 * NewsArticle Entity - an InfoMoney article, optionally tied to a stock.
 *
 * <h3>Lifecycle:</h3>
 * <ul>
 *   <li>Created with only {@code url} (and {@code stockId}) from a stock's news index page</li>
 *   <li>Enriched later with title, content and published date from the article page</li>
 * </ul>
 * An article needs enrichment while {@code publishedDate} is null. The same URL may be seen on
 * several fetch passes, so it is not unique; duplicates are rejected when URLs are saved.
 */
@Entity
@Table(name = "infomoney_news", indexes = {
    @Index(name = "idx_news_stock_id", columnList = "stock_id")
})
@Getter
@Setter
@ToString
@SuperBuilder
@NoArgsConstructor
public class NewsArticle extends BaseEntity {

    @Column(name = "url", nullable = false, length = 2048)
    private String url;

    @Column(name = "title")
    private String title;

    @ToString.Exclude
    @Column(name = "content", columnDefinition = "TEXT")
    private String content;

    @Column(name = "published_date")
    private LocalDateTime publishedDate;

    @Column(name = "stock_id", length = 36)
    private String stockId;

    @JsonIgnore
    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "stock_id", insertable = false, updatable = false)
    private Stock stock;

    public boolean needsEnrichment() {
        return publishedDate == null;
    }

    @Override
    public List<String> missingRequiredAttributes() {
        List<String> missing = new ArrayList<>();
        if (url == null || url.isBlank()) {
            missing.add("url");
        }
        return missing;
    }
}
