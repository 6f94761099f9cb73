package br.gc.stock.tracker.repositories;

import br.gc.stock.tracker.entities.NewsArticle;
import org.springframework.stereotype.Repository;

@Repository
public interface NewsArticleRepository extends SoftDeleteRepository<NewsArticle> {
}
