package br.gc.stock.tracker.repositories;

import br.gc.stock.tracker.entities.Stock;
import br.gc.stock.tracker.query.Condition;
import br.gc.stock.tracker.query.Filter;
import br.gc.stock.tracker.query.OrderBy;
import br.gc.stock.tracker.query.StockField;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Component
@Slf4j
public class StockStore extends EntityStore<Stock> {

    /**
     * Attributes of a stored stock that an import may complete. Everything else is left as stored.
     */
    static final List<MergeRule<Stock>> IMPORT_MERGE_RULES = List.of(
            MergeRule.fillIfBlank(Stock::getCompany, Stock::setCompany)
    );

    private final StockRepository stockRepository;

    public StockStore(StockRepository stockRepository) {
        super(stockRepository, "stock");
        this.stockRepository = stockRepository;
    }

    @Transactional(readOnly = true)
    public Optional<Stock> findByCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        return findOneBy(Filter.where(StockField.CODE, code.trim().toUpperCase(Locale.ROOT)));
    }

    @Transactional(readOnly = true)
    public List<Stock> findAllOrderedByCode() {
        return findBy(Filter.all(), OrderBy.asc(StockField.CODE));
    }

    @Transactional(readOnly = true)
    public List<Stock> searchByName(String fragment) {
        return execute("search stock", () -> stockRepository.findByNameContainingIgnoreCaseAndDeletedAtIsNull(fragment));
    }

    @Transactional(readOnly = true)
    public List<Stock> findWithoutNewsUrl() {
        return findBy(Filter.where(StockField.URL_NEWS, Condition.isNull()), OrderBy.asc(StockField.CODE));
    }

    @Transactional(readOnly = true)
    public List<Stock> findWithNewsUrl() {
        return findBy(Filter.where(StockField.URL_NEWS, Condition.isNotNull()), OrderBy.asc(StockField.CODE));
    }

    @Transactional
    public Optional<Stock> assignNewsUrl(String stockId, String newsUrl) {
        return update(stockId, stock -> stock.setUrlNews(newsUrl));
    }

    /**
     * Imports stocks keyed by {@code code}.
     * <ul>
     *   <li>Records without a code are skipped</li>
     *   <li>Later records with a code already seen in the batch are dropped</li>
     *   <li>Records matching a stored stock are folded into it through {@link #IMPORT_MERGE_RULES}</li>
     *   <li>Only code, name, company and URLs are taken from a record; id and audit columns are
     *   always assigned here</li>
     * </ul>
     *
     * @return only the stocks that were created
     */
    @Transactional
    public List<Stock> bulkCreateSkippingDuplicates(List<Stock> records) {
        Map<String, Stock> unique = new LinkedHashMap<>();
        int withoutCode = 0;
        for (Stock record : records) {
            String code = codeOf(record);
            if (code == null) {
                withoutCode++;
                continue;
            }
            unique.putIfAbsent(code, importable(code, record));
        }
        if (withoutCode > 0) {
            log.warn("Skipped {} stock records without a code", withoutCode);
        }
        if (unique.isEmpty()) {
            return List.of();
        }

        Map<String, Stock> existing = new LinkedHashMap<>();
        for (Stock stock : findBy(Filter.where(StockField.CODE, Condition.in(unique.keySet())))) {
            existing.putIfAbsent(stock.getCode(), stock);
        }

        List<Stock> toCreate = new ArrayList<>();
        int merged = 0;
        for (Map.Entry<String, Stock> entry : unique.entrySet()) {
            Stock stored = existing.get(entry.getKey());
            if (stored == null) {
                toCreate.add(entry.getValue());
                continue;
            }
            boolean changed = false;
            for (MergeRule<Stock> rule : IMPORT_MERGE_RULES) {
                changed |= rule.merge(stored, entry.getValue());
            }
            if (changed) {
                execute("update stock", () -> repository.save(stored));
                merged++;
            }
        }

        List<Stock> created = createMany(toCreate);
        log.info("Stock import: {} created, {} already stored ({} enriched)",
                created.size(), existing.size(), merged);
        return created;
    }

    private static Stock importable(String code, Stock record) {
        return Stock.builder()
                .code(code)
                .name(record.getName())
                .company(record.getCompany())
                .url(record.getUrl())
                .urlNews(record.getUrlNews())
                .build();
    }

    private static String codeOf(Stock record) {
        String code = record.getCode();
        if (code == null || code.isBlank()) {
            return null;
        }
        return code.trim().toUpperCase(Locale.ROOT);
    }
}
