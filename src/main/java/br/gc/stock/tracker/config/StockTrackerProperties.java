package br.gc.stock.tracker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.ZoneId;

@Data
@Component
@ConfigurationProperties(prefix = "stock-tracker")
public class StockTrackerProperties {

    private Infomoney infomoney = new Infomoney();
    private Ingestion ingestion = new Ingestion();
    private Scheduler scheduler = new Scheduler();

    @Data
    public static class Infomoney {
        private String siteUrl = "https://www.infomoney.com.br";
        private String historyUrl = "https://www.infomoney.com.br/wp-json/infomoney/v1/quotes/history";
        private String stockListUrl = "https://api.infomoney.com.br/ativos/top-alta-baixa-por-ativo/acao";
        private int itemsPerPage = 50;
        private int stockListPageSize = 15;
        private int stockListMaxPages = 40;
        private int connectTimeoutMs = 10_000;
        private int readTimeoutMs = 30_000;

        /**
         * Attempts per request, including the first one.
         */
        private int maxAttempts = 3;
        private long retryBackoffMs = 1_000;

        /**
         * Upper bound of the random pause before each request to the site.
         */
        private long requestJitterMs = 2_000;
    }

    @Data
    public static class Ingestion {
        /**
         * Zone used to turn source timestamps into trading days. Range queries use the same zone.
         */
        private ZoneId zone = ZoneId.of("America/Sao_Paulo");
        private int defaultPages = 1;
        private int newsEnrichmentBatchSize = 10;
    }

    @Data
    public static class Scheduler {
        private boolean enabled = false;
        private String cron = "0 0 0 * * *";
        private String zone = "America/Sao_Paulo";
        private int historyPages = 2;
    }
}
