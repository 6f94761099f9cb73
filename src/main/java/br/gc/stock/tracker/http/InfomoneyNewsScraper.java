package br.gc.stock.tracker.http;

import br.gc.stock.tracker.config.StockTrackerProperties;
import br.gc.stock.tracker.exceptions.FetchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Scrapes InfoMoney HTML pages.
 *
 * <h3>Page structure relied on:</h3>
 * <ul>
 *   <li>Stock page: {@code a.href-title} whose href contains "tudo-sobre" is the news index</li>
 *   <li>News index: every {@code div[data-ds-component=card-sm]} holds one article link</li>
 *   <li>Article: {@code h1} title, {@code article[data-ds-component=article]} body and the
 *       {@code time[datetime]} of the {@code author-small} block</li>
 * </ul>
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class InfomoneyNewsScraper implements NewsSource {

    private static final String NEWS_INDEX_MARKER = "tudo-sobre";

    private final InfomoneyHttpClient http;
    private final StockTrackerProperties properties;

    @Override
    public Optional<String> discoverNewsIndexUrl(String stockPageUrl) {
        return findNewsIndexUrl(load(stockPageUrl));
    }

    @Override
    public List<String> listArticleUrls(String newsIndexUrl) {
        return extractArticleUrls(load(newsIndexUrl));
    }

    @Override
    public ArticleDetails fetchArticle(String articleUrl) {
        return extractArticle(load(articleUrl), properties.getIngestion().getZone());
    }

    private Document load(String url) {
        String html = http.get(url, properties.getInfomoney().getSiteUrl() + "/");
        return Jsoup.parse(html, url);
    }

    static Optional<String> findNewsIndexUrl(Document page) {
        for (Element link : page.select("a.href-title[href]")) {
            String href = link.absUrl("href");
            if (href.isEmpty()) {
                href = link.attr("href");
            }
            if (href.contains(NEWS_INDEX_MARKER)) {
                return Optional.of(href);
            }
        }
        return Optional.empty();
    }

    static List<String> extractArticleUrls(Document page) {
        Set<String> urls = new LinkedHashSet<>();
        for (Element card : page.select("div[data-ds-component=card-sm]")) {
            Element link = card.selectFirst("a[href]");
            if (link == null) {
                log.debug("News card without a link on {}", page.location());
                continue;
            }
            String href = link.absUrl("href");
            urls.add(href.isEmpty() ? link.attr("href") : href);
        }
        return new ArrayList<>(urls);
    }

    /**
     * Reads the article page. The published instant is converted to local time in {@code zone}.
     *
     * @throws FetchException when the body or the publication time is missing
     */
    static ArticleDetails extractArticle(Document page, ZoneId zone) {
        Element article = page.selectFirst("article[data-ds-component=article]");
        if (article == null) {
            throw new FetchException("No article body on " + page.location());
        }
        Element time = page.selectFirst("div[data-ds-component=author-small] time[datetime]");
        if (time == null) {
            throw new FetchException("No publication time on " + page.location());
        }
        Element heading = page.selectFirst("h1");
        String title = heading != null ? heading.text().trim() : null;

        return new ArticleDetails(title, article.text().trim(), parsePublished(time.attr("datetime"), zone));
    }

    static LocalDateTime parsePublished(String value, ZoneId zone) {
        String text = value.trim();
        try {
            return OffsetDateTime.parse(text).atZoneSameInstant(zone).toLocalDateTime();
        } catch (DateTimeParseException offsetMissing) {
            try {
                return LocalDateTime.parse(text);
            } catch (DateTimeParseException e) {
                throw new FetchException("Unreadable publication time '" + value + "'", e);
            }
        }
    }
}
