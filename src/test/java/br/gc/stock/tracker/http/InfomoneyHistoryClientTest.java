package br.gc.stock.tracker.http;

import br.gc.stock.tracker.config.StockTrackerProperties;
import br.gc.stock.tracker.exceptions.FetchException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("InfomoneyHistoryClient")
class InfomoneyHistoryClientTest {

    private static final String HISTORY_URL = "https://www.infomoney.com.br/wp-json/infomoney/v1/quotes/history";

    private MockRestServiceServer server;
    private InfomoneyHistoryClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        StockTrackerProperties properties = new StockTrackerProperties();
        properties.getInfomoney().setMaxAttempts(1);
        properties.getInfomoney().setRequestJitterMs(0);
        client = new InfomoneyHistoryClient(new InfomoneyHttpClient(restTemplate, properties), new ObjectMapper(), properties);
    }

    @Test
    @DisplayName("posts the page form and maps the rows")
    void fetchPagePostsFormAndParsesRows() {
        server.expect(requestTo(HISTORY_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().string("page=2&numberItems=50&symbol=BBSE3"))
                .andExpect(header(HttpHeaders.REFERER, "https://www.infomoney.com.br/cotacoes/b3/acao/bbse3/historico/"))
                .andRespond(withSuccess("""
                        [[{"display":"03/04/2025","timestamp":1743649200},"36,10","36,52","1,16","35,90","36,70","12.345.678"]]
                        """, MediaType.APPLICATION_JSON));

        List<RawHistoryEntry> entries = client.fetchPage("BBSE3", 2);

        assertThat(entries).containsExactly(new RawHistoryEntry(
                "03/04/2025", 1743649200L, "36,10", "36,52", "1,16", "35,90", "36,70", "12.345.678"));
        server.verify();
    }

    @Test
    @DisplayName("accepts a numeric string timestamp and null cells")
    void parseToleratesStringTimestampAndNulls() {
        List<RawHistoryEntry> entries = client.parse("""
                [[{"display":"02/04/2025","timestamp":"1743562800"},null,"36,10","n/d",null,null,"-"]]
                """);

        assertThat(entries).singleElement().satisfies(entry -> {
            assertThat(entry.dateTimestamp()).isEqualTo(1743562800L);
            assertThat(entry.openPrice()).isEqualTo("-");
            assertThat(entry.closePrice()).isEqualTo("36,10");
            assertThat(entry.minPrice()).isEqualTo("-");
        });
    }

    @Test
    @DisplayName("skips rows that do not have the expected shape")
    void parseSkipsMalformedRows() {
        List<RawHistoryEntry> entries = client.parse("""
                [
                  "not a row",
                  [{"display":"01/04/2025"},"1","2","3","4","5","6"],
                  [{"display":"01/04/2025","timestamp":"yesterday"},"1","2","3","4","5","6"],
                  ["01/04/2025","1","2","3","4","5","6"],
                  [{"display":"01/04/2025","timestamp":1743476400},"1","2"],
                  [{"display":"01/04/2025","timestamp":1743476400},"1","2","3","4","5","6"]
                ]
                """);

        assertThat(entries).extracting(RawHistoryEntry::dateTimestamp).containsExactly(1743476400L);
    }

    @Test
    @DisplayName("rejects a body that is not a JSON array")
    void parseRejectsNonArrays() {
        assertThatThrownBy(() -> client.parse("<html>blocked</html>"))
                .isInstanceOf(FetchException.class)
                .hasMessageStartingWith("History response is not JSON");
        assertThatThrownBy(() -> client.parse("{\"error\":\"rate limited\"}"))
                .isInstanceOf(FetchException.class)
                .hasMessage("History response is not a JSON array");
    }

    @Test
    @DisplayName("an empty array is an empty page")
    void parseEmptyArray() {
        assertThat(client.parse("[]")).isEmpty();
    }
}
