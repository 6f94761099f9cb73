package br.gc.stock.tracker.repositories;

import br.gc.stock.tracker.entities.Stock;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StockRepository extends SoftDeleteRepository<Stock> {

    List<Stock> findByNameContainingIgnoreCaseAndDeletedAtIsNull(String nameFragment);
}
