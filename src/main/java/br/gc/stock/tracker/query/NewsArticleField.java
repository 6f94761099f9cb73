package br.gc.stock.tracker.query;

import br.gc.stock.tracker.entities.NewsArticle;

public enum NewsArticleField implements EntityField<NewsArticle> {
    ID("id"),
    URL("url"),
    TITLE("title"),
    CONTENT("content"),
    PUBLISHED_DATE("publishedDate"),
    STOCK_ID("stockId"),
    CREATED_AT("createdAt"),
    UPDATED_AT("updatedAt");

    private final String attribute;

    NewsArticleField(String attribute) {
        this.attribute = attribute;
    }

    @Override
    public String attribute() {
        return attribute;
    }
}
