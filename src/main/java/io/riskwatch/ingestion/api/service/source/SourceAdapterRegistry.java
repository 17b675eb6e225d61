package io.riskwatch.ingestion.api.service.source;

import io.riskwatch.ingestion.config.IngestionConfig;
import io.riskwatch.ingestion.config.SourceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class SourceAdapterRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SourceAdapterRegistry.class);

    private final Map<String, SourceAdapter> adapters = new LinkedHashMap<>();

    @Autowired
    public SourceAdapterRegistry(IngestionConfig config, RssFeedReader feedReader) {
        for (SourceConfig source : config.getEnabledSources()) {
            if (source.isRss()) {
                adapters.put(source.name(), new RssSourceAdapter(source, feedReader));
            } else {
                logger.warn("Source {} has unsupported type '{}', skipping", source.name(), source.type());
            }
        }
        logger.info("Registered {} source adapters: {}", adapters.size(), adapters.keySet());
    }

    public SourceAdapterRegistry(Collection<SourceAdapter> adapters) {
        adapters.forEach(adapter -> this.adapters.put(adapter.name(), adapter));
    }

    /**
     * @param names adapter names; null or empty selects all. Unknown names are ignored with a warning.
     */
    public List<SourceAdapter> select(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return List.copyOf(adapters.values());
        }
        return names.stream()
                .filter(name -> {
                    boolean known = adapters.containsKey(name);
                    if (!known) logger.warn("Unknown source requested: {}", name);
                    return known;
                })
                .map(adapters::get)
                .toList();
    }

    public Map<String, String> describe() {
        Map<String, String> descriptions = new LinkedHashMap<>();
        adapters.forEach((name, adapter) -> descriptions.put(name, adapter.description()));
        return descriptions;
    }
}
