package br.gc.stock.tracker.repositories;

import br.gc.stock.tracker.entities.NewsArticle;
import br.gc.stock.tracker.entities.Stock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@ActiveProfiles("test")
@Import({StockStore.class, NewsArticleStore.class})
class NewsArticleStoreTest {

    private static final String ARTICLE_1 = "https://www.infomoney.com.br/mercados/bb-seguridade-lucro-1t25/";
    private static final String ARTICLE_2 = "https://www.infomoney.com.br/mercados/bb-seguridade-dividendos/";

    @Autowired
    private StockStore stockStore;

    @Autowired
    private NewsArticleStore newsArticleStore;

    private Stock stock;

    @BeforeEach
    void setUp() {
        stock = stockStore.create(Stock.builder().code("BBSE3").name("BB Seguridade").build());
    }

    @Test
    void testSaveNewsUrlsSkipsRepeatsWithinCall() {
        List<NewsArticle> created = newsArticleStore.saveNewsUrls(stock.getId(), List.of(ARTICLE_1, ARTICLE_2, ARTICLE_1, " "));

        assertEquals(2, created.size());
        assertEquals(ARTICLE_1, created.get(0).getUrl());
        assertTrue(created.stream().allMatch(NewsArticle::needsEnrichment));
    }

    @Test
    void testSaveNewsUrlsSkipsUrlsAlreadyStored() {
        newsArticleStore.saveNewsUrls(stock.getId(), List.of(ARTICLE_1));

        List<NewsArticle> created = newsArticleStore.saveNewsUrls(stock.getId(), List.of(ARTICLE_1, ARTICLE_2));

        assertEquals(1, created.size());
        assertEquals(ARTICLE_2, created.get(0).getUrl());
        assertEquals(2, newsArticleStore.findByStock(stock.getId()).size());
    }

    @Test
    void testEnrichFillsArticleAndClearsPendingState() {
        newsArticleStore.saveNewsUrls(stock.getId(), List.of(ARTICLE_1, ARTICLE_2));
        LocalDateTime published = LocalDateTime.of(2025, 4, 29, 19, 5);

        List<NewsArticle> enrichedArticles = newsArticleStore.enrich(ARTICLE_1, "Lucro sobe", "Texto da materia", published);

        assertEquals(1, enrichedArticles.size());
        NewsArticle enriched = enrichedArticles.get(0);

        assertEquals("Lucro sobe", enriched.getTitle());
        assertEquals(published, enriched.getPublishedDate());
        assertFalse(enriched.needsEnrichment());

        List<NewsArticle> pending = newsArticleStore.findNeedingEnrichment();
        assertEquals(1, pending.size());
        assertEquals(ARTICLE_2, pending.get(0).getUrl());
        assertEquals(1, newsArticleStore.findWithoutContent().size());
    }

    @Test
    void testEnrichUnknownUrl() {
        assertTrue(newsArticleStore.enrich("https://example.com/none", "t", "c", LocalDateTime.now()).isEmpty());
    }

    @Test
    void testEnrichFillsArticleListedUnderSeveralStocks() {
        Stock other = stockStore.create(Stock.builder().code("BBAS3").name("Banco do Brasil").build());
        newsArticleStore.saveNewsUrls(stock.getId(), List.of(ARTICLE_1));
        newsArticleStore.saveNewsUrls(other.getId(), List.of(ARTICLE_1));
        assertEquals(2, newsArticleStore.findNeedingEnrichment().size());

        List<NewsArticle> enriched = newsArticleStore.enrich(ARTICLE_1, "Lucro sobe", "Texto",
                LocalDateTime.of(2025, 4, 29, 19, 5));

        assertEquals(2, enriched.size());
        assertTrue(newsArticleStore.findNeedingEnrichment().isEmpty());
        assertEquals("Lucro sobe", newsArticleStore.findByStock(other.getId()).get(0).getTitle());
    }

    @Test
    void testFailedEnrichmentMovesArticleBehindUntriedOnes() {
        newsArticleStore.saveNewsUrls(stock.getId(), List.of(ARTICLE_1, ARTICLE_2));

        assertEquals(1, newsArticleStore.markEnrichmentFailed(ARTICLE_1));

        List<NewsArticle> pending = newsArticleStore.findNeedingEnrichment();
        assertEquals(List.of(ARTICLE_2, ARTICLE_1), pending.stream().map(NewsArticle::getUrl).toList());
        assertTrue(pending.get(1).needsEnrichment());
    }

    @Test
    void testMarkEnrichmentFailedOnUnknownUrl() {
        assertEquals(0, newsArticleStore.markEnrichmentFailed("https://example.com/none"));
    }

    @Test
    void testFindByUrlIgnoresDeletedArticles() {
        NewsArticle created = newsArticleStore.saveNewsUrls(stock.getId(), List.of(ARTICLE_1)).get(0);

        assertTrue(newsArticleStore.findByUrl(ARTICLE_1).isPresent());
        assertTrue(newsArticleStore.softDelete(created.getId()));
        assertTrue(newsArticleStore.findByUrl(ARTICLE_1).isEmpty());
    }
}
