package br.gc.stock.tracker.controllers;

import br.gc.stock.tracker.config.StockTrackerProperties;
import br.gc.stock.tracker.entities.NewsArticle;
import br.gc.stock.tracker.services.NewsService;
import br.gc.stock.tracker.services.NewsService.RunSummary;
import br.gc.stock.tracker.services.NewsService.StockNews;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/news")
@RequiredArgsConstructor
@Slf4j
public class NewsController {

    private final NewsService newsService;
    private final StockTrackerProperties properties;

    @GetMapping
    public List<NewsArticle> getNews() {
        return newsService.getAll();
    }

    @GetMapping("/stock/{code}")
    public StockNews getNewsByStock(@PathVariable String code) {
        return newsService.getByStockCode(code);
    }

    @GetMapping("/{id}")
    public ResponseEntity<NewsArticle> getArticle(@PathVariable String id) {
        return ResponseEntity.of(newsService.getById(id));
    }

    @PostMapping("/discover")
    public RunSummary discoverNewsPages() {
        log.info("📰 REST: Discovering news pages");
        return newsService.discoverNewsUrls();
    }

    @PostMapping("/fetch")
    public RunSummary fetchListings() {
        log.info("📰 REST: Fetching news listings");
        return newsService.fetchNewsListings();
    }

    @PostMapping("/enrich")
    public RunSummary enrichArticles(@RequestParam(name = "batch_size", required = false) Integer batchSize) {
        int size = batchSize != null ? batchSize : properties.getIngestion().getNewsEnrichmentBatchSize();
        log.info("📰 REST: Enriching up to {} articles", size);
        return newsService.enrichPendingArticles(size);
    }
}
