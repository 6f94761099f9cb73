package br.gc.stock.tracker.services;

import br.gc.stock.tracker.config.StockTrackerProperties;
import br.gc.stock.tracker.exceptions.StockTrackerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * DailyRefreshScheduler - runs every ingestion flow once a day, in dependency order:
 * stock list, news pages, news listings, article enrichment, price history.
 * <p>
 * Only active with {@code stock-tracker.scheduler.enabled=true}. A step that fails is logged and
 * the following steps still run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "stock-tracker.scheduler", name = "enabled", havingValue = "true")
public class DailyRefreshScheduler {

    private final StockService stockService;
    private final NewsService newsService;
    private final HistoryIngestionService historyIngestionService;
    private final StockTrackerProperties properties;

    private final AtomicBoolean refreshInProgress = new AtomicBoolean(false);

    @Scheduled(cron = "${stock-tracker.scheduler.cron:0 0 0 * * *}",
            zone = "${stock-tracker.scheduler.zone:America/Sao_Paulo}")
    public void dailyRefresh() {
        if (!refreshInProgress.compareAndSet(false, true)) {
            log.warn("⏭️ Daily refresh still running, skipping this trigger");
            return;
        }
        try {
            runRefresh();
        } finally {
            refreshInProgress.set(false);
        }
    }

    boolean isRefreshInProgress() {
        return refreshInProgress.get();
    }

    void runRefresh() {
        log.info("🔄 Daily refresh started");
        int historyPages = properties.getScheduler().getHistoryPages();
        int batchSize = properties.getIngestion().getNewsEnrichmentBatchSize();

        int failedSteps = 0;
        failedSteps += step("stock list", stockService::syncFromSource);
        failedSteps += step("news page discovery", newsService::discoverNewsUrls);
        failedSteps += step("news listings", newsService::fetchNewsListings);
        failedSteps += step("news enrichment", () -> newsService.enrichPendingArticles(batchSize));
        failedSteps += step("price history", () -> historyIngestionService.ingestAll(historyPages));

        if (failedSteps == 0) {
            log.info("✅ Daily refresh finished");
        } else {
            log.warn("⚠️ Daily refresh finished with {} failed step(s)", failedSteps);
        }
    }

    private int step(String name, Runnable action) {
        long started = System.currentTimeMillis();
        try {
            action.run();
            log.info("Refresh step '{}' done in {} ms", name, System.currentTimeMillis() - started);
            return 0;
        } catch (StockTrackerException e) {
            log.error("Refresh step '{}' failed: {}", name, e.getMessage(), e);
            return 1;
        } catch (RuntimeException e) {
            log.error("Refresh step '{}' failed unexpectedly", name, e);
            return 1;
        }
    }
}
