package com.faqchat.service.search;

import com.faqchat.config.ChatbotConfig;
import com.faqchat.dto.internal.CitationSet;
import com.faqchat.dto.internal.MatchResult;
import com.faqchat.dto.request.SearchRequest;
import com.faqchat.dto.response.SearchResponse;
import com.faqchat.model.InteractionEvent;
import com.faqchat.model.QaEntry;
import com.faqchat.service.citation.CitationService;
import com.faqchat.service.notification.NotificationSink;
import com.faqchat.util.TextTruncator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Question answering on top of the match engine: best answer, confidence, citations.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchService {

    public static final String NO_MATCH_ANSWER =
            "申し訳ございません。該当する回答が見つかりませんでした。お問い合わせフォームからご質問ください。";

    private static final int PREVIEW_LENGTH = 100;

    private final FuzzyMatchService fuzzyMatchService;
    private final CitationService citationService;
    private final NotificationSink notificationSink;
    private final ChatbotConfig chatbotConfig;
    private final Clock clock;

    /**
     * Stateless search; reports the interaction to the notification sink.
     */
    public SearchResponse search(SearchRequest request) {
        SearchResponse response = answer(request.getQuestion(), request.getCategory());

        notificationSink.notify(InteractionEvent.builder()
                .conversationId(request.getConversationId())
                .kind(InteractionEvent.Kind.SEARCH)
                .question(request.getQuestion())
                .answerPreview(TextTruncator.truncate(response.getAnswer(), PREVIEW_LENGTH))
                .confidence(response.getConfidence())
                .category(response.getCategory())
                .timestamp(clock.instant())
                .build());
        return response;
    }

    /**
     * Best match for {@code question}, or the fallback answer with confidence 0 when nothing
     * clears the threshold. No notification is sent.
     */
    public SearchResponse answer(String question, String category) {
        long start = System.currentTimeMillis();
        List<MatchResult> matches = fuzzyMatchService.search(question, category);

        if (matches.isEmpty()) {
            log.info("No match for query ({} ms)", System.currentTimeMillis() - start);
            return SearchResponse.builder()
                    .question(question)
                    .answer(NO_MATCH_ANSWER)
                    .confidence(0.0)
                    .found(false)
                    .suggestInquiry(true)
                    .citations(CitationSet.empty())
                    .build();
        }

        MatchResult best = matches.get(0);
        QaEntry entry = best.getEntry();
        CitationSet citations = citationService.compose(matches);

        log.info("Answered with entry #{} score={} ({} candidates, {} ms)",
                entry.getId(), String.format("%.3f", best.getScore()), matches.size(),
                System.currentTimeMillis() - start);

        return SearchResponse.builder()
                .question(entry.getQuestion())
                .answer(entry.getAnswer())
                .confidence(best.getScore())
                .category(entry.getCategory())
                .source(entry.getReference())
                .found(true)
                .suggestInquiry(best.getScore() < chatbotConfig.getInquirySuggestionBelow())
                .citations(citations)
                .build();
    }
}
