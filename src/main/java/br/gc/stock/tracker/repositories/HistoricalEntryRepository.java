package br.gc.stock.tracker.repositories;

import br.gc.stock.tracker.entities.HistoricalEntry;
import org.springframework.stereotype.Repository;

/**
 * Repository for daily price history. Lookups go through {@link HistoricalEntryStore}.
 */
@Repository
public interface HistoricalEntryRepository extends SoftDeleteRepository<HistoricalEntry> {
}
