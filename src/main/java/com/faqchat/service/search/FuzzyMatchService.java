package com.faqchat.service.search;

import com.faqchat.config.ChatbotConfig;
import com.faqchat.dto.internal.MatchResult;
import com.faqchat.model.QaEntry;
import com.faqchat.service.data.DataLoaderService;
import com.faqchat.service.data.DatasetSnapshot;
import com.faqchat.util.SimilarityMetrics;
import com.faqchat.util.TextNormalizer;
import com.faqchat.util.TextNormalizer.NormalizedText;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Fuzzy question matching: token-overlap (Jaccard) blended with a Levenshtein ratio
 * (default 70:30). Stateless per call; normalized candidates are cached per dataset version.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FuzzyMatchService {

    private static final Comparator<MatchResult> RANKING =
            Comparator.comparingDouble(MatchResult::getScore).reversed()
                    .thenComparingInt(r -> r.getEntry().getId());

    private final DataLoaderService dataLoaderService;
    private final TextNormalizer normalizer;
    private final ChatbotConfig chatbotConfig;

    private final AtomicReference<CandidateIndex> index = new AtomicReference<>();

    public List<MatchResult> search(String query, String category) {
        return search(query, category, chatbotConfig.getThreshold(), chatbotConfig.getTopK());
    }

    public List<MatchResult> search(String query, String category, double threshold) {
        return search(query, category, threshold, chatbotConfig.getTopK());
    }

    public List<MatchResult> search(String query, String category, double threshold, int topK) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be within [0, 1]: " + threshold);
        }
        if (query == null || query.isBlank()) {
            return List.of();
        }

        NormalizedText normalizedQuery = normalizer.normalize(query);
        if (normalizedQuery.isEmpty()) {
            return List.of();
        }

        long startTime = System.nanoTime();
        List<Candidate> candidates = filterByCategory(indexFor(dataLoaderService.getSnapshot()), category);
        Set<String> queryTokens = normalizedQuery.tokenSet();
        double tokenWeight = chatbotConfig.getTokenWeight();

        List<MatchResult> results = candidates.stream()
                .map(c -> score(normalizedQuery, queryTokens, c, tokenWeight))
                .filter(r -> r.getScore() >= threshold)
                .sorted(RANKING)
                .limit(Math.max(topK, 0))
                .collect(Collectors.toList());

        long duration = (System.nanoTime() - startTime) / 1_000_000;
        log.debug("Fuzzy search: {} of {} candidates kept in {}ms", results.size(), candidates.size(), duration);

        return results;
    }

    private MatchResult score(NormalizedText query, Set<String> queryTokens,
                              Candidate candidate, double tokenWeight) {
        Set<String> candidateTokens = candidate.text().tokenSet();

        double overlap = SimilarityMetrics.jaccard(queryTokens, candidateTokens);
        double sequence = SimilarityMetrics.levenshteinRatio(query.text(), candidate.text().text());
        double blended = tokenWeight * overlap + (1.0 - tokenWeight) * sequence;

        Set<String> matched = new LinkedHashSet<>(queryTokens);
        matched.retainAll(candidateTokens);

        return MatchResult.builder()
                .entry(candidate.entry())
                .score(Math.max(0.0, Math.min(1.0, blended)))
                .matchedTerms(Set.copyOf(matched))
                .build();
    }

    private List<Candidate> filterByCategory(CandidateIndex candidateIndex, String category) {
        if (category == null || category.isBlank()) {
            return candidateIndex.candidates();
        }

        List<Candidate> filtered = candidateIndex.candidates().stream()
                .filter(c -> c.entry().inCategory(category))
                .collect(Collectors.toList());

        if (filtered.isEmpty()) {
            log.debug("No entries in category '{}', searching all categories", category);
            return candidateIndex.candidates();
        }
        return filtered;
    }

    private CandidateIndex indexFor(DatasetSnapshot snapshot) {
        CandidateIndex cached = index.get();
        if (cached != null && cached.version() == snapshot.getVersion()) {
            return cached;
        }

        List<Candidate> candidates = snapshot.getEntries().stream()
                .map(e -> new Candidate(e, normalizer.normalize(e.getQuestion())))
                .collect(Collectors.toList());
        CandidateIndex built = new CandidateIndex(snapshot.getVersion(), List.copyOf(candidates));
        index.set(built);

        log.info("Search index built for dataset v{} ({} questions)", snapshot.getVersion(), candidates.size());
        return built;
    }

    private record Candidate(QaEntry entry, NormalizedText text) {
    }

    private record CandidateIndex(long version, List<Candidate> candidates) {
    }
}
