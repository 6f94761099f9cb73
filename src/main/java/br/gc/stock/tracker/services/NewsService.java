package br.gc.stock.tracker.services;

import br.gc.stock.tracker.entities.NewsArticle;
import br.gc.stock.tracker.entities.Stock;
import br.gc.stock.tracker.exceptions.StockTrackerException;
import br.gc.stock.tracker.http.NewsSource;
import br.gc.stock.tracker.http.NewsSource.ArticleDetails;
import br.gc.stock.tracker.query.Filter;
import br.gc.stock.tracker.query.NewsArticleField;
import br.gc.stock.tracker.query.OrderBy;
import br.gc.stock.tracker.repositories.NewsArticleStore;
import br.gc.stock.tracker.repositories.StockStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * InfoMoney news for the tracked stocks.
 *
 * <h3>Pipeline:</h3>
 * <ol>
 *   <li>{@link #discoverNewsUrls()} finds each stock's news index page</li>
 *   <li>{@link #fetchNewsListings()} stores the article URLs listed there</li>
 *   <li>{@link #enrichPendingArticles(int)} reads title, body and date of stored articles</li>
 * </ol>
 * A failure on one stock or article is logged and counted; the run goes on with the next one.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NewsService {

    private final NewsSource newsSource;
    private final StockStore stockStore;
    private final NewsArticleStore newsArticleStore;
    private final StockService stockService;

    // ========== Ingestion ==========

    public RunSummary discoverNewsUrls() {
        List<Stock> stocks = stockStore.findWithoutNewsUrl();
        log.info("📰 Discovering news pages for {} stocks", stocks.size());

        int found = 0;
        int failed = 0;
        for (Stock stock : stocks) {
            if (stock.getUrl() == null || stock.getUrl().isBlank()) {
                log.debug("Stock {} has no page to search", stock.getCode());
                continue;
            }
            try {
                Optional<String> newsUrl = newsSource.discoverNewsIndexUrl(stock.getUrl());
                if (newsUrl.isPresent()) {
                    stockStore.assignNewsUrl(stock.getId(), newsUrl.get());
                    found++;
                } else {
                    log.info("No news page linked for {}", stock.getCode());
                }
            } catch (StockTrackerException e) {
                failed++;
                log.error("Error discovering news page of {}: {}", stock.getCode(), e.getMessage());
            }
        }

        log.info("News page discovery done: {} found, {} failed", found, failed);
        return new RunSummary(stocks.size(), found, failed);
    }

    public RunSummary fetchNewsListings() {
        List<Stock> stocks = stockStore.findWithNewsUrl();
        log.info("📰 Fetching news listings for {} stocks", stocks.size());

        int saved = 0;
        int failed = 0;
        for (Stock stock : stocks) {
            try {
                List<String> urls = newsSource.listArticleUrls(stock.getUrlNews());
                List<NewsArticle> created = newsArticleStore.saveNewsUrls(stock.getId(), urls);
                saved += created.size();
                log.info("{}: {} articles listed, {} new", stock.getCode(), urls.size(), created.size());
            } catch (StockTrackerException e) {
                failed++;
                log.error("Error fetching news listing of {}: {}", stock.getCode(), e.getMessage());
            }
        }

        log.info("News listings done: {} new articles, {} stocks failed", saved, failed);
        return new RunSummary(stocks.size(), saved, failed);
    }

    /**
     * Reads up to {@code batchSize} article pages that still lack a publication date, least
     * recently tried first. Every stored article with the page's URL is filled in. A page that
     * cannot be read is moved behind the untried ones, so repeated runs drain the backlog.
     */
    public RunSummary enrichPendingArticles(int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1, got " + batchSize);
        }
        Set<String> pendingUrls = new LinkedHashSet<>();
        for (NewsArticle article : newsArticleStore.findNeedingEnrichment()) {
            pendingUrls.add(article.getUrl());
        }
        List<String> batch = pendingUrls.stream().limit(batchSize).toList();
        log.info("📰 Enriching {} of {} pending article pages", batch.size(), pendingUrls.size());

        int enriched = 0;
        int failed = 0;
        for (String url : batch) {
            try {
                ArticleDetails details = newsSource.fetchArticle(url);
                newsArticleStore.enrich(url, details.title(), details.content(), details.publishedDate());
                enriched++;
            } catch (StockTrackerException e) {
                failed++;
                log.error("Error enriching article {}: {}", url, e.getMessage());
                newsArticleStore.markEnrichmentFailed(url);
            }
        }

        log.info("Article enrichment done: {} enriched, {} failed", enriched, failed);
        return new RunSummary(batch.size(), enriched, failed);
    }

    // ========== Reads ==========

    public List<NewsArticle> getAll() {
        return newsArticleStore.findBy(Filter.all(), OrderBy.desc(NewsArticleField.CREATED_AT));
    }

    public Optional<NewsArticle> getById(String id) {
        return newsArticleStore.findById(id);
    }

    public StockNews getByStockCode(String stockCode) {
        Stock stock = stockService.requireByCode(stockCode);
        return new StockNews(stock.getCode(), stock.getName(), stock.getCompany(),
                newsArticleStore.findByStock(stock.getId()));
    }

    /**
     * @param processed stocks or articles looked at
     * @param changed   pages found, articles created or articles enriched
     * @param failed    items whose processing raised an error
     */
    public record RunSummary(int processed, int changed, int failed) {
    }

    public record StockNews(String stockCode, String stockName, String stockCompany, List<NewsArticle> news) {
    }
}
