package com.faqchat.service.data;

import com.faqchat.config.DatasetConfig;
import com.faqchat.exception.DatasetException;
import com.faqchat.model.QaEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current Q&A snapshot and replaces it wholesale on reload.
 */
@Slf4j
@Service
public class DataLoaderService {

    private final DatasetConfig datasetConfig;
    private final QaDatasetParser parser;
    private final ResourceLoader resourceLoader;
    private final Clock clock;

    private final AtomicReference<DatasetSnapshot> current = new AtomicReference<>();
    private final AtomicLong versions = new AtomicLong();

    public DataLoaderService(DatasetConfig datasetConfig,
                             QaDatasetParser parser,
                             ResourceLoader resourceLoader,
                             Clock clock) {
        this.datasetConfig = datasetConfig;
        this.parser = parser;
        this.resourceLoader = resourceLoader;
        this.clock = clock;
    }

    /**
     * Load the configured dataset and swap it in. A failed load keeps the previous snapshot.
     */
    public synchronized DatasetSnapshot loadDataset() {
        String location = datasetConfig.getPath();
        log.info("Loading Q&A dataset from: {}", location);

        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new DatasetException(DatasetException.Kind.UNREADABLE,
                    "Dataset file not found: " + location);
        }

        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            return install(parser.parse(reader, location), location);
        } catch (IOException e) {
            throw new DatasetException(DatasetException.Kind.UNREADABLE,
                    "Failed to open dataset " + location, e);
        }
    }

    public DatasetSnapshot install(List<QaEntry> entries, String source) {
        if (entries == null || entries.isEmpty()) {
            throw DatasetException.emptyDataset(source);
        }
        DatasetSnapshot snapshot = new DatasetSnapshot(
                versions.incrementAndGet(), source, clock.instant(), entries);
        current.set(snapshot);

        log.info("Dataset v{} installed ({} entries, {} categories)",
                snapshot.getVersion(), snapshot.size(), snapshot.getCategories().size());
        return snapshot;
    }

    public DatasetSnapshot getSnapshot() {
        DatasetSnapshot snapshot = current.get();
        if (snapshot == null) {
            throw DatasetException.notLoaded();
        }
        return snapshot;
    }

    public boolean isDataLoaded() {
        return current.get() != null;
    }

    public String getFaqMarker() {
        return datasetConfig.getFaqMarker();
    }

    /**
     * Get dataset statistics
     */
    public Map<String, Object> getStatistics() {
        DatasetSnapshot snapshot = current.get();
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("loaded", snapshot != null);
        stats.put("path", datasetConfig.getPath());
        if (snapshot != null) {
            stats.put("version", snapshot.getVersion());
            stats.put("entries", snapshot.size());
            stats.put("categories", snapshot.getCategories().size());
            stats.put("loadedAt", snapshot.getLoadedAt().toString());
        }
        return stats;
    }

    /**
     * Entry and FAQ counts per category label
     */
    public Map<String, Map<String, Integer>> getCategorySummary() {
        DatasetSnapshot snapshot = getSnapshot();
        Map<String, Map<String, Integer>> summary = new LinkedHashMap<>();

        for (String label : snapshot.categoryLabels()) {
            List<QaEntry> entries = snapshot.inCategory(label);
            int faqCount = (int) entries.stream()
                    .filter(e -> datasetConfig.getFaqMarker().equals(e.getRemarks()))
                    .count();

            Map<String, Integer> counts = new LinkedHashMap<>();
            counts.put("totalCount", entries.size());
            counts.put("faqCount", faqCount);
            counts.put("generalCount", entries.size() - faqCount);
            summary.put(label, counts);
        }
        return summary;
    }
}
