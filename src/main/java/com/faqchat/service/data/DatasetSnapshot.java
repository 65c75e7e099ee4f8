package com.faqchat.service.data;

import com.faqchat.model.QaEntry;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable view of one loaded dataset. Shared by all concurrent readers without locking;
 * a reload installs a new instance instead of mutating this one.
 */
@Getter
public final class DatasetSnapshot {

    private final long version;
    private final String source;
    private final Instant loadedAt;
    private final List<QaEntry> entries;

    // lower-cased label -> label as first seen in the dataset
    private final Map<String, String> categories;

    public DatasetSnapshot(long version, String source, Instant loadedAt, List<QaEntry> entries) {
        this.version = version;
        this.source = source;
        this.loadedAt = loadedAt;
        this.entries = List.copyOf(entries);

        Map<String, String> labels = new LinkedHashMap<>();
        for (QaEntry entry : this.entries) {
            if (entry.hasCategory()) {
                labels.putIfAbsent(key(entry.getCategory()), entry.getCategory().trim());
            }
        }
        this.categories = Collections.unmodifiableMap(labels);
    }

    public int size() {
        return entries.size();
    }

    public List<String> categoryLabels() {
        return List.copyOf(categories.values());
    }

    public Optional<String> findCategory(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(categories.get(key(label)));
    }

    public Optional<QaEntry> findById(int id) {
        if (id < 1 || id > entries.size()) {
            return Optional.empty();
        }
        return Optional.of(entries.get(id - 1));
    }

    public List<QaEntry> inCategory(String label) {
        return entries.stream()
                .filter(e -> e.inCategory(label))
                .collect(Collectors.toList());
    }

    /**
     * Featured questions for a category: rows whose remarks carry the FAQ marker, or every row of the
     * category when none is marked. Ordered by display order, then dataset order.
     */
    public List<QaEntry> featuredFor(String label, String faqMarker) {
        List<QaEntry> all = inCategory(label);
        List<QaEntry> marked = all.stream()
                .filter(e -> faqMarker != null && faqMarker.equals(e.getRemarks()))
                .collect(Collectors.toList());

        return (marked.isEmpty() ? all : marked).stream()
                .sorted(Comparator.comparingInt(QaEntry::getDisplayOrder)
                        .thenComparingInt(QaEntry::getId))
                .collect(Collectors.toList());
    }

    private static String key(String label) {
        return label.trim().toLowerCase(Locale.ROOT);
    }
}
