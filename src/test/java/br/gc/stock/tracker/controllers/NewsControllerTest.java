package br.gc.stock.tracker.controllers;

import br.gc.stock.tracker.config.StockTrackerProperties;
import br.gc.stock.tracker.entities.NewsArticle;
import br.gc.stock.tracker.exceptions.StockNotFoundException;
import br.gc.stock.tracker.services.NewsService;
import br.gc.stock.tracker.services.NewsService.RunSummary;
import br.gc.stock.tracker.services.NewsService.StockNews;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(NewsController.class)
@Import(StockTrackerProperties.class)
class NewsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private StockTrackerProperties properties;

    @MockBean
    private NewsService newsService;

    @Test
    void getNewsByStock_shouldReturnStockAndArticles() throws Exception {
        NewsArticle article = NewsArticle.builder()
                .id("n1")
                .url("https://www.infomoney.com.br/mercados/a/")
                .title("BB Seguridade lucra mais")
                .publishedDate(LocalDateTime.of(2025, 4, 29, 19, 5))
                .stockId("s1")
                .build();
        when(newsService.getByStockCode("BBSE3"))
                .thenReturn(new StockNews("BBSE3", "BB SEGURIDADE ON", "BB SEGURIDADE ON", List.of(article)));

        mockMvc.perform(get("/api/news/stock/BBSE3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stockCode").value("BBSE3"))
                .andExpect(jsonPath("$.news[0].title").value("BB Seguridade lucra mais"))
                .andExpect(jsonPath("$.news[0].publishedDate").value("2025-04-29T19:05:00"));
    }

    @Test
    void getNewsByStock_forUnknownStock_shouldReturn404() throws Exception {
        when(newsService.getByStockCode("XXXX3")).thenThrow(new StockNotFoundException("XXXX3"));

        mockMvc.perform(get("/api/news/stock/XXXX3"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getArticle_whenMissing_shouldReturn404() throws Exception {
        when(newsService.getById("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/news/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getNews_shouldReturnAllArticles() throws Exception {
        when(newsService.getAll()).thenReturn(List.of(
                NewsArticle.builder().id("n1").url("https://www.infomoney.com.br/a/").stockId("s1").build()));

        mockMvc.perform(get("/api/news"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].url").value("https://www.infomoney.com.br/a/"));
    }

    @Test
    void discoverAndFetch_shouldReturnRunSummaries() throws Exception {
        when(newsService.discoverNewsUrls()).thenReturn(new RunSummary(3, 2, 1));
        when(newsService.fetchNewsListings()).thenReturn(new RunSummary(2, 14, 0));

        mockMvc.perform(post("/api/news/discover"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.processed").value(3))
                .andExpect(jsonPath("$.changed").value(2))
                .andExpect(jsonPath("$.failed").value(1));
        mockMvc.perform(post("/api/news/fetch"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.changed").value(14));
    }

    @Test
    void enrich_withoutBatchSize_shouldUseConfiguredDefault() throws Exception {
        int configured = properties.getIngestion().getNewsEnrichmentBatchSize();
        when(newsService.enrichPendingArticles(configured)).thenReturn(new RunSummary(configured, configured, 0));

        mockMvc.perform(post("/api/news/enrich"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.changed").value(configured));
    }

    @Test
    void enrich_withInvalidBatchSize_shouldReturnBadRequest() throws Exception {
        when(newsService.enrichPendingArticles(0))
                .thenThrow(new IllegalArgumentException("batchSize must be at least 1, got 0"));

        mockMvc.perform(post("/api/news/enrich").param("batch_size", "0"))
                .andExpect(status().isBadRequest());
    }
}
