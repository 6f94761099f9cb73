package br.gc.stock.tracker.controllers;

import br.gc.stock.tracker.entities.Stock;
import br.gc.stock.tracker.services.StockService;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * REST API for the tracked stocks
 */
@RestController
@RequestMapping("/api/stocks")
@RequiredArgsConstructor
@Slf4j
public class StockController {

    private final StockService stockService;

    /**
     * {@code name} searches by name fragment. Without it, any other parameter naming a stock
     * attribute ({@code code}, {@code company}, {@code url_news}, ...) must match exactly and
     * unknown parameters are ignored. {@code order_by} and {@code desc} set the ordering.
     */
    @GetMapping
    public List<Stock> getStocks(@RequestParam Map<String, String> params) {
        Map<String, String> filters = new LinkedHashMap<>(params);
        String name = filters.remove("name");
        String orderBy = filters.remove("order_by");
        boolean descending = Boolean.parseBoolean(filters.remove("desc"));
        if (name != null) {
            return stockService.search(name);
        }
        return stockService.list(filters, orderBy, descending);
    }

    @GetMapping("/{code}")
    public ResponseEntity<Stock> getStock(@PathVariable String code) {
        return ResponseEntity.of(stockService.getByCode(code));
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> createStocks(@RequestBody CreateStocksRequest request) {
        List<Stock> stocks = request.stocks() == null ? List.of() : request.stocks().stream()
                .filter(Objects::nonNull)
                .map(NewStock::toStock)
                .toList();
        List<Stock> created = stockService.create(stocks);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Added " + created.size() + " new stocks",
                "stocks", created
        ));
    }

    @PostMapping("/fetch")
    public ResponseEntity<Map<String, Object>> fetchStocks() {
        log.info("📥 REST: Synchronising stock list");
        List<Stock> created = stockService.syncFromSource();
        return ResponseEntity.ok(Map.of(
                "success", true,
                "source", "InfoMoney",
                "stocks_added", created.size()
        ));
    }

    @DeleteMapping("/{code}")
    public ResponseEntity<Void> deleteStock(@PathVariable String code) {
        if (!stockService.softDelete(code)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    public record CreateStocksRequest(List<NewStock> stocks) {
    }

    /**
     * Attributes a client may set on a new stock. Anything else in the payload is dropped.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NewStock(String code, String name, String company, String url) {

        Stock toStock() {
            return Stock.builder().code(code).name(name).company(company).url(url).build();
        }
    }
}
