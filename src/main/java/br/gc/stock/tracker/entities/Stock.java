package br.gc.stock.tracker.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Stock Entity
 *
 * A B3 listed equity. {@code code} is the exchange ticker (e.g. "BBSE3") and is unique among
 * live rows; uniqueness is kept by the bulk import, not by a constraint.
 * {@code urlNews} stays empty until the news index page has been discovered.
 */
@Entity
@Table(name = "stocks", indexes = {
    @Index(name = "idx_stocks_code", columnList = "code")
})
@Getter
@Setter
@ToString
@SuperBuilder
@NoArgsConstructor
public class Stock extends BaseEntity {

    @Column(name = "code", nullable = false)
    private String code;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "company")
    private String company;

    @Column(name = "url")
    private String url;

    @Column(name = "url_news")
    private String urlNews;

    @Override
    public List<String> missingRequiredAttributes() {
        List<String> missing = new ArrayList<>();
        if (code == null || code.isBlank()) {
            missing.add("code");
        }
        if (name == null || name.isBlank()) {
            missing.add("name");
        }
        return missing;
    }
}
