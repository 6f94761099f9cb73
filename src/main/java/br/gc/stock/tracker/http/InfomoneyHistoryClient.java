package br.gc.stock.tracker.http;

import br.gc.stock.tracker.config.StockTrackerProperties;
import br.gc.stock.tracker.exceptions.FetchException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads the quote history table the InfoMoney asset pages load through their WordPress endpoint.
 * <p>
 * The endpoint answers a form post with an array of rows:
 * {@code [{"display": "03/04/2025", "timestamp": 1743649200}, open, close, variation, min, max, volume]}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class InfomoneyHistoryClient implements HistoryPageFetcher {

    private static final int ROW_WIDTH = 7;

    private final InfomoneyHttpClient http;
    private final ObjectMapper objectMapper;
    private final StockTrackerProperties properties;

    @Override
    public List<RawHistoryEntry> fetchPage(String stockCode, int pageIndex) {
        StockTrackerProperties.Infomoney config = properties.getInfomoney();

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("page", String.valueOf(pageIndex));
        form.add("numberItems", String.valueOf(config.getItemsPerPage()));
        form.add("symbol", stockCode);

        String referer = config.getSiteUrl() + "/cotacoes/b3/acao/" + stockCode.toLowerCase(Locale.ROOT) + "/historico/";
        log.info("Fetching history of {} (page {})", stockCode, pageIndex);
        String body = http.postForm(config.getHistoryUrl(), form, referer);

        List<RawHistoryEntry> entries = parse(body);
        log.debug("History page {} of {}: {} entries", pageIndex, stockCode, entries.size());
        return entries;
    }

    /**
     * Rows that do not have the expected shape are skipped.
     *
     * @throws FetchException when the body is not a JSON array
     */
    List<RawHistoryEntry> parse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new FetchException("History response is not JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new FetchException("History response is not a JSON array");
        }

        List<RawHistoryEntry> entries = new ArrayList<>(root.size());
        for (JsonNode row : root) {
            RawHistoryEntry entry = toEntry(row);
            if (entry == null) {
                log.warn("Skipping malformed history row: {}", row);
                continue;
            }
            entries.add(entry);
        }
        return entries;
    }

    private static RawHistoryEntry toEntry(JsonNode row) {
        if (!row.isArray() || row.size() < ROW_WIDTH) {
            return null;
        }
        JsonNode date = row.get(0);
        if (!date.isObject() || !date.hasNonNull("timestamp")) {
            return null;
        }
        JsonNode timestamp = date.get("timestamp");
        long epochSeconds;
        if (timestamp.canConvertToLong()) {
            epochSeconds = timestamp.asLong();
        } else {
            try {
                epochSeconds = Long.parseLong(timestamp.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return new RawHistoryEntry(
                date.path("display").asText(null),
                epochSeconds,
                text(row.get(1)),
                text(row.get(2)),
                text(row.get(3)),
                text(row.get(4)),
                text(row.get(5)),
                text(row.get(6)));
    }

    private static String text(JsonNode value) {
        return value == null || value.isNull() ? "-" : value.asText();
    }
}
