package br.gc.stock.tracker.http;

import br.gc.stock.tracker.config.StockTrackerProperties;
import br.gc.stock.tracker.entities.Stock;
import br.gc.stock.tracker.exceptions.FetchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pages through the InfoMoney "top high/low by asset" XML feed, which lists every traded stock.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class InfomoneyStockListClient implements StockListFetcher {

    private final InfomoneyHttpClient http;
    private final StockTrackerProperties properties;

    @Override
    public List<Stock> fetchStocks() {
        StockTrackerProperties.Infomoney config = properties.getInfomoney();
        Map<String, Stock> stocks = new LinkedHashMap<>();
        int totalPages = config.getStockListMaxPages();

        for (int page = 1; page <= totalPages; page++) {
            try {
                Document document = Jsoup.parse(http.get(pageUrl(page), config.getSiteUrl() + "/"), "", Parser.xmlParser());
                if (page == 1) {
                    totalPages = totalPages(document, totalPages);
                }
                for (Stock stock : parseQuotes(document)) {
                    stocks.putIfAbsent(stock.getCode(), stock);
                }
                log.info("Processed stock list page {}/{}, {} stocks so far", page, totalPages, stocks.size());
            } catch (FetchException e) {
                log.error("Skipping stock list page {}: {}", page, e.getMessage());
            }
        }

        log.info("Stock list complete: {} unique stocks", stocks.size());
        return new ArrayList<>(stocks.values());
    }

    String pageUrl(int page) {
        return UriComponentsBuilder.fromHttpUrl(properties.getInfomoney().getStockListUrl())
                .queryParam("sector", "Todos")
                .queryParam("orderAtributte", "Volume")
                .queryParam("pageIndex", page)
                .queryParam("pageSize", properties.getInfomoney().getStockListPageSize())
                .toUriString();
    }

    /**
     * Stocks of one feed page. Quotes without a code are ignored.
     */
    List<Stock> parseQuotes(Document document) {
        List<Stock> stocks = new ArrayList<>();
        for (Element quote : document.getElementsByTag("QuoteHighLow")) {
            String code = childText(quote, "StockCode");
            if (code == null) {
                continue;
            }
            String name = childText(quote, "StockName");
            stocks.add(Stock.builder()
                    .code(code)
                    .name(name != null ? name : code)
                    .company(name)
                    .url(properties.getInfomoney().getSiteUrl() + "/" + code)
                    .build());
        }
        return stocks;
    }

    private static int totalPages(Document document, int fallback) {
        Element total = document.getElementsByTag("TotalPages").first();
        if (total == null) {
            return fallback;
        }
        try {
            int pages = Integer.parseInt(total.text().trim());
            log.info("Stock list has {} pages", pages);
            return Math.min(pages, fallback);
        } catch (NumberFormatException e) {
            log.warn("Unreadable TotalPages value '{}', keeping {}", total.text(), fallback);
            return fallback;
        }
    }

    private static String childText(Element parent, String tag) {
        Element child = parent.getElementsByTag(tag).first();
        if (child == null) {
            return null;
        }
        String text = child.text().trim();
        return text.isEmpty() ? null : text;
    }
}
