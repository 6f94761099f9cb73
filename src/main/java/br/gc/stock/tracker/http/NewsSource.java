package br.gc.stock.tracker.http;

import br.gc.stock.tracker.exceptions.FetchException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Where news about a stock is found. All methods throw {@link FetchException} when the page
 * cannot be retrieved or does not have the expected structure.
 */
public interface NewsSource {

    /**
     * @param stockPageUrl the stock's profile page
     * @return the stock's news index page, if the profile links one
     */
    Optional<String> discoverNewsIndexUrl(String stockPageUrl);

    /**
     * @return article URLs listed on a news index page, in page order
     */
    List<String> listArticleUrls(String newsIndexUrl);

    ArticleDetails fetchArticle(String articleUrl);

    record ArticleDetails(String title, String content, LocalDateTime publishedDate) {
    }
}
