package br.gc.stock.tracker.repositories;

import br.gc.stock.tracker.entities.Stock;
import br.gc.stock.tracker.exceptions.StorageException;
import br.gc.stock.tracker.query.Condition;
import br.gc.stock.tracker.query.Filter;
import br.gc.stock.tracker.query.OrderBy;
import br.gc.stock.tracker.query.StockField;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

@DataJpaTest
@ActiveProfiles("test")
@Import(StockStore.class)
class StockStoreTest {

    @Autowired
    private StockStore stockStore;

    private Stock stock(String code, String name) {
        return Stock.builder().code(code).name(name).url("https://infomoney.com.br/" + code).build();
    }

    @Test
    void create_assignsIdAndTimestamps() {
        Stock created = stockStore.create(stock("BBSE3", "BB Seguridade"));

        assertThat(created.getId()).isNotBlank();
        assertThat(created.getCreatedAt()).isNotNull();
        assertThat(created.getUpdatedAt()).isEqualTo(created.getCreatedAt());
        assertThat(created.getDeletedAt()).isNull();
    }

    @Test
    void create_missingRequiredAttribute_isConstraintViolation() {
        Stock noName = Stock.builder().code("XPTO3").build();

        assertThatThrownBy(() -> stockStore.create(noName))
                .isInstanceOfSatisfying(StorageException.class,
                        e -> assertThat(e.getKind()).isEqualTo(StorageException.Kind.CONSTRAINT_VIOLATION))
                .hasMessageContaining("name");
        assertThat(stockStore.count(Filter.all())).isZero();
    }

    @Test
    void createMany_rejectsWholeBatchWhenOneRecordIsIncomplete() {
        List<Stock> batch = List.of(stock("PETR4", "Petrobras"), Stock.builder().name("No code").build());

        assertThatThrownBy(() -> stockStore.createMany(batch)).isInstanceOf(StorageException.class);
        assertThat(stockStore.findAll()).isEmpty();
    }

    @Test
    void findBy_supportsEveryOperator() {
        stockStore.createMany(List.of(
                stock("PETR4", "Petrobras"),
                stock("VALE3", "Vale"),
                Stock.builder().code("ITUB4").name("Itau").urlNews("https://www.infomoney.com.br/tudo-sobre/itau").build()));

        assertThat(codes(Filter.where(StockField.CODE, Condition.notEqualTo("PETR4")))).containsExactly("ITUB4", "VALE3");
        assertThat(codes(Filter.where(StockField.CODE, Condition.in(List.of("VALE3", "PETR4"))))).containsExactly("PETR4", "VALE3");
        assertThat(codes(Filter.where(StockField.CODE, Condition.notIn(List.of("VALE3"))))).containsExactly("ITUB4", "PETR4");
        assertThat(codes(Filter.where(StockField.URL_NEWS, Condition.isNotNull()))).containsExactly("ITUB4");
        assertThat(codes(Filter.where(StockField.URL_NEWS, Condition.isNull()))).containsExactly("PETR4", "VALE3");
        assertThat(codes(Filter.where(StockField.CODE, Condition.atLeast("PETR4")))).containsExactly("PETR4", "VALE3");
        assertThat(codes(Filter.where(StockField.CODE, Condition.atMost("PETR4")))).containsExactly("ITUB4", "PETR4");
        assertThat(codes(Filter.where(StockField.CODE, Condition.between("ITUB4", "PETR4")))).containsExactly("ITUB4", "PETR4");
        assertThat(codes(Filter.where(StockField.CODE, Condition.in(List.of())))).isEmpty();
    }

    @Test
    void softDelete_hidesRowFromEveryRead() {
        Stock created = stockStore.create(stock("BBSE3", "BB Seguridade"));

        assertThat(stockStore.softDelete(created.getId())).isTrue();

        assertThat(stockStore.findById(created.getId())).isEmpty();
        assertThat(stockStore.findByCode("BBSE3")).isEmpty();
        assertThat(stockStore.findAll()).isEmpty();
        assertThat(stockStore.exists(Filter.where(StockField.CODE, "BBSE3"))).isFalse();
        assertThat(stockStore.searchByName("seguridade")).isEmpty();
    }

    @Test
    void softDelete_isIdempotent() {
        Stock created = stockStore.create(stock("BBSE3", "BB Seguridade"));

        assertThat(stockStore.softDelete(created.getId())).isTrue();
        assertThat(stockStore.softDelete(created.getId())).isFalse();
        assertThat(stockStore.softDelete("missing-id")).isFalse();
    }

    @Test
    void delete_removesRowPhysically() {
        Stock created = stockStore.create(stock("BBSE3", "BB Seguridade"));

        assertThat(stockStore.delete(created.getId())).isTrue();
        assertThat(stockStore.delete(created.getId())).isFalse();
        assertThat(stockStore.findById(created.getId())).isEmpty();
    }

    @Test
    void update_appliesChangesToLiveRowsOnly() {
        Stock created = stockStore.create(stock("BBSE3", "BB Seguridade"));

        Optional<Stock> updated = stockStore.update(created.getId(), s -> s.setCompany("BB Seguridade Participacoes"));

        assertThat(updated).isPresent();
        assertThat(stockStore.findByCode("bbse3")).get()
                .extracting(Stock::getCompany).isEqualTo("BB Seguridade Participacoes");

        stockStore.softDelete(created.getId());
        assertThat(stockStore.update(created.getId(), s -> s.setCompany("ignored"))).isEmpty();
        assertThat(stockStore.update("missing-id", s -> s.setCompany("ignored"))).isEmpty();
    }

    @Test
    void findOneBy_returnsFirstMatchWithoutFailingOnSeveral() {
        stockStore.createMany(List.of(stock("PETR3", "Petrobras"), stock("PETR4", "Petrobras")));

        Optional<Stock> first = stockStore.findOneBy(Filter.where(StockField.NAME, "Petrobras"), OrderBy.desc(StockField.CODE));

        assertThat(first).get().extracting(Stock::getCode).isEqualTo("PETR4");
        assertThat(stockStore.findOneBy(Filter.where(StockField.NAME, "Vale"))).isEmpty();
    }

    @Test
    void bulkCreate_skipsKnownCodesAndEnrichesBlankCompany() {
        stockStore.create(stock("BBSE3", "BB Seguridade"));

        List<Stock> batch = new ArrayList<>();
        batch.add(Stock.builder().code("BBSE3").name("Other name").company("BB Seguridade SA").build());
        batch.add(stock("PETR4", "Petrobras"));
        batch.add(stock("petr4", "Petrobras duplicate"));
        batch.add(Stock.builder().code(" ").name("Without code").build());

        List<Stock> created = stockStore.bulkCreateSkippingDuplicates(batch);

        assertThat(created).extracting(Stock::getCode).containsExactly("PETR4");
        assertThat(created.get(0).getName()).isEqualTo("Petrobras");

        Stock stored = stockStore.findByCode("BBSE3").orElseThrow();
        assertThat(stored.getName()).isEqualTo("BB Seguridade");
        assertThat(stored.getCompany()).isEqualTo("BB Seguridade SA");
        assertThat(stockStore.findAll()).hasSize(2);
    }

    @Test
    void bulkCreate_neverOverwritesFilledCompany() {
        stockStore.create(Stock.builder().code("VALE3").name("Vale").company("Vale SA").build());

        List<Stock> created = stockStore.bulkCreateSkippingDuplicates(
                List.of(Stock.builder().code("VALE3").name("Vale").company("Companhia Vale do Rio Doce").build()));

        assertThat(created).isEmpty();
        assertThat(stockStore.findByCode("VALE3").orElseThrow().getCompany()).isEqualTo("Vale SA");
    }

    @Test
    void bulkCreate_assignsItsOwnIdAndAuditColumns() {
        Stock petr = stockStore.create(stock("PETR4", "Petrobras"));
        Stock record = Stock.builder()
                .id(petr.getId())
                .code("HACK3")
                .name("Hack")
                .deletedAt(LocalDateTime.of(2020, 1, 1, 0, 0))
                .build();

        List<Stock> created = stockStore.bulkCreateSkippingDuplicates(List.of(record));

        assertThat(created).singleElement().satisfies(stock -> {
            assertThat(stock.getCode()).isEqualTo("HACK3");
            assertThat(stock.getId()).isNotEqualTo(petr.getId());
            assertThat(stock.getDeletedAt()).isNull();
        });
        assertThat(stockStore.findByCode("PETR4")).isPresent();
        assertThat(stockStore.findByCode("HACK3")).isPresent();
        assertThat(stockStore.findAll()).hasSize(2);
    }

    @Test
    void codesAreUppercasedIndependentlyOfDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            List<Stock> created = stockStore.bulkCreateSkippingDuplicates(List.of(stock("itub4", "Itau Unibanco")));

            assertThat(created).extracting(Stock::getCode).containsExactly("ITUB4");
            assertThat(stockStore.findByCode("itub4")).get().extracting(Stock::getName).isEqualTo("Itau Unibanco");
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void newsUrlQueriesAndAssignment() {
        Stock petr = stockStore.create(stock("PETR4", "Petrobras"));
        stockStore.create(stock("VALE3", "Vale"));

        stockStore.assignNewsUrl(petr.getId(), "https://www.infomoney.com.br/tudo-sobre/petrobras/");

        assertThat(stockStore.findWithNewsUrl()).extracting(Stock::getCode).containsExactly("PETR4");
        assertThat(stockStore.findWithoutNewsUrl()).extracting(Stock::getCode).containsExactly("VALE3");
        assertThat(stockStore.searchByName("PETRO")).extracting(Stock::getCode).containsExactly("PETR4");
    }

    private List<String> codes(Filter<Stock> filter) {
        return stockStore.findBy(filter, OrderBy.asc(StockField.CODE)).stream().map(Stock::getCode).toList();
    }
}
