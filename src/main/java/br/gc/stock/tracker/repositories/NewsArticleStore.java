package br.gc.stock.tracker.repositories;

import br.gc.stock.tracker.entities.NewsArticle;
import br.gc.stock.tracker.query.Condition;
import br.gc.stock.tracker.query.Filter;
import br.gc.stock.tracker.query.NewsArticleField;
import br.gc.stock.tracker.query.OrderBy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Component
@Slf4j
public class NewsArticleStore extends EntityStore<NewsArticle> {

    public NewsArticleStore(NewsArticleRepository newsArticleRepository) {
        super(newsArticleRepository, "news article");
    }

    @Transactional(readOnly = true)
    public Optional<NewsArticle> findByUrl(String url) {
        return findOneBy(Filter.where(NewsArticleField.URL, url));
    }

    @Transactional(readOnly = true)
    public List<NewsArticle> findByStock(String stockId) {
        return findBy(Filter.where(NewsArticleField.STOCK_ID, stockId),
                OrderBy.desc(NewsArticleField.PUBLISHED_DATE));
    }

    /**
     * Articles still lacking a publication date, least recently touched first. A failed
     * enrichment attempt touches the row (see {@link #markEnrichmentFailed}), which moves it
     * behind the articles not tried yet.
     */
    @Transactional(readOnly = true)
    public List<NewsArticle> findNeedingEnrichment() {
        return findBy(Filter.where(NewsArticleField.PUBLISHED_DATE, Condition.isNull()),
                OrderBy.asc(NewsArticleField.UPDATED_AT));
    }

    @Transactional(readOnly = true)
    public List<NewsArticle> findWithoutContent() {
        return findBy(Filter.where(NewsArticleField.CONTENT, Condition.isNull()),
                OrderBy.asc(NewsArticleField.CREATED_AT));
    }

    /**
     * Stores URL-only articles for a stock. URLs already stored for the stock, and repeats within
     * {@code urls}, are skipped.
     *
     * @return the articles created
     */
    @Transactional
    public List<NewsArticle> saveNewsUrls(String stockId, Collection<String> urls) {
        Set<String> candidates = new LinkedHashSet<>();
        for (String url : urls) {
            if (url != null && !url.isBlank()) {
                candidates.add(url.trim());
            }
        }
        if (candidates.isEmpty()) {
            return List.of();
        }

        Set<String> known = new HashSet<>();
        Filter<NewsArticle> stored = Filter.where(NewsArticleField.URL, Condition.in(candidates));
        if (stockId != null) {
            stored.and(NewsArticleField.STOCK_ID, Condition.equalTo(stockId));
        }
        findBy(stored).forEach(article -> known.add(article.getUrl()));

        List<NewsArticle> fresh = new ArrayList<>();
        for (String url : candidates) {
            if (!known.contains(url)) {
                fresh.add(NewsArticle.builder().url(url).stockId(stockId).build());
            }
        }
        log.debug("News URLs for stock {}: {} new, {} already stored", stockId, fresh.size(), known.size());
        return createMany(fresh);
    }

    /**
     * Fills in what was read from the article page on every live article with this URL; the same
     * article may be listed under several stocks. Null arguments leave the stored value as is.
     *
     * @return the enriched articles, empty when no live article has this URL
     */
    @Transactional
    public List<NewsArticle> enrich(String url, String title, String content, LocalDateTime publishedDate) {
        List<NewsArticle> enriched = new ArrayList<>();
        for (NewsArticle article : findBy(Filter.where(NewsArticleField.URL, url))) {
            update(article.getId(), a -> {
                if (title != null) {
                    a.setTitle(title);
                }
                if (content != null) {
                    a.setContent(content);
                }
                if (publishedDate != null) {
                    a.setPublishedDate(publishedDate);
                }
            }).ifPresent(enriched::add);
        }
        return enriched;
    }

    /**
     * Records a failed enrichment attempt by touching {@code updated_at} of every live article
     * with this URL, so the next pending batch starts with articles not tried yet.
     *
     * @return number of articles touched
     */
    @Transactional
    public int markEnrichmentFailed(String url) {
        int touched = 0;
        for (NewsArticle article : findBy(Filter.where(NewsArticleField.URL, url))) {
            if (update(article.getId(), a -> a.setUpdatedAt(LocalDateTime.now())).isPresent()) {
                touched++;
            }
        }
        return touched;
    }
}
