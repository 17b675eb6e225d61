package io.riskwatch.ingestion;

import io.riskwatch.ingestion.api.dto.RawItem;
import io.riskwatch.ingestion.api.dto.SearchQuery;
import io.riskwatch.ingestion.api.dto.SourceSearchResult;
import io.riskwatch.ingestion.api.exception.ErrorCategory;
import io.riskwatch.ingestion.api.exception.SourceFetchException;
import io.riskwatch.ingestion.api.service.source.FeedEntry;
import io.riskwatch.ingestion.api.service.source.RssFeedReader;
import io.riskwatch.ingestion.api.service.source.RssSourceAdapter;
import io.riskwatch.ingestion.api.service.source.SourceAdapterRegistry;
import io.riskwatch.ingestion.config.SourceConfig;
import io.riskwatch.ingestion.config.SourceConfig.FeedConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RssSourceAdapterTest {

    private static final SearchQuery QUERY =
            new SearchQuery("iberdrola", LocalDate.of(2024, 3, 8), LocalDate.of(2024, 3, 15));

    @Mock
    private RssFeedReader feedReader;

    private RssSourceAdapter adapter;

    @BeforeEach
    void setUp() {
        SourceConfig config = new SourceConfig("expansion", "rss", true, List.of(
                new FeedConfig("https://e.com/empresas.xml", "empresas"),
                new FeedConfig("https://e.com/mercados.xml", "mercados")
        ));
        adapter = new RssSourceAdapter(config, feedReader);
    }

    @Test
    @DisplayName("Should keep entries mentioning the query within the date range")
    void shouldFilterByQueryAndDate() throws Exception {
        when(feedReader.read("https://e.com/empresas.xml", "empresas")).thenReturn(List.of(
                entry("Iberdrola recibe una multa", "", "2024-03-14T09:00:00Z", "empresas"),
                entry("Resultados del sector", "La eléctrica IBERDROLA gana", "2024-03-10T09:00:00Z", "empresas"),
                entry("Iberdrola en 2023", "", "2024-01-02T09:00:00Z", "empresas"),
                entry("Telefónica amplía capital", "", "2024-03-14T09:00:00Z", "empresas")
        ));
        when(feedReader.read("https://e.com/mercados.xml", "mercados")).thenReturn(List.of(
                entry("Iberdrola sin fecha", "", null, "mercados")
        ));

        SourceSearchResult result = adapter.search(QUERY);

        assertThat(result.items()).extracting(RawItem::title)
                .containsExactly("Iberdrola recibe una multa", "Resultados del sector", "Iberdrola sin fecha");
        assertThat(result.summary().totalResults()).isEqualTo(3);
        assertThat(result.summary().errors()).isEmpty();

        RawItem first = result.items().get(0);
        assertThat(first.section()).isEqualTo("empresas");
        assertThat(first.publishedAt()).isEqualTo("2024-03-14T09:00:00Z");
        assertThat(first.attributes()).containsEntry("outlet", "expansion");
    }

    @Test
    @DisplayName("Should report a failing feed and still return the others")
    void shouldIsolateFailingFeed() throws Exception {
        when(feedReader.read("https://e.com/empresas.xml", "empresas"))
                .thenThrow(new SourceFetchException("Feed not found (404)", ErrorCategory.NOT_FOUND));
        when(feedReader.read("https://e.com/mercados.xml", "mercados")).thenReturn(List.of(
                entry("Iberdrola cae en bolsa", "", "2024-03-12T09:00:00Z", "mercados")
        ));

        SourceSearchResult result = adapter.search(QUERY);

        assertThat(result.isFailed()).isFalse();
        assertThat(result.items()).hasSize(1);
        assertThat(result.summary().errors()).containsExactly("empresas: NOT_FOUND - Feed not found (404)");
    }

    @Test
    void shouldDescribeItself() {
        assertThat(adapter.name()).isEqualTo("expansion");
        assertThat(new SourceAdapterRegistry(List.of(adapter)).describe())
                .containsEntry("expansion", "rss, 2 feeds");
    }

    private static FeedEntry entry(String title, String description, String published, String category) {
        return new FeedEntry(title, "https://e.com/" + title.hashCode(), description, null,
                published != null ? Instant.parse(published) : null, category);
    }
}
