package com.faqchat.service.citation;

import com.faqchat.config.ChatbotConfig;
import com.faqchat.dto.internal.Citation;
import com.faqchat.dto.internal.CitationSet;
import com.faqchat.dto.internal.MatchResult;
import com.faqchat.dto.internal.SourceType;
import com.faqchat.model.QaEntry;
import com.faqchat.util.TextTruncator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns ranked matches into displayable sources. Pure: no network access, no randomness.
 */
@Service
@RequiredArgsConstructor
public class CitationService {

    private static final Pattern URL = Pattern.compile("https?://[^\\s)）]+");
    private static final int MAX_LABEL_LENGTH = 50;

    private final ChatbotConfig chatbotConfig;

    public CitationSet compose(List<MatchResult> matches) {
        return compose(matches, chatbotConfig.getMaxCitationItems());
    }

    public CitationSet compose(List<MatchResult> matches, int maxItems) {
        if (matches == null || matches.isEmpty()) {
            return CitationSet.empty();
        }

        // first occurrence of an entry wins, match order preserved
        Map<Integer, MatchResult> distinct = new LinkedHashMap<>();
        for (MatchResult match : matches) {
            distinct.putIfAbsent(match.getEntry().getId(), match);
        }

        int total = distinct.size();
        int showing = Math.min(total, Math.max(maxItems, 0));

        List<Citation> items = new ArrayList<>(showing);
        for (MatchResult match : distinct.values()) {
            if (items.size() == showing) {
                break;
            }
            items.add(toCitation(match, items.size() + 1));
        }

        return CitationSet.builder()
                .items(List.copyOf(items))
                .totalSources(total)
                .showing(showing)
                .hasMore(total > showing)
                .build();
    }

    public Citation toCitation(MatchResult match, int position) {
        QaEntry entry = match.getEntry();
        String url = extractUrl(entry.getReference());
        SourceType type = classify(entry, url);

        return Citation.builder()
                .id("source_" + position)
                .entryId(entry.getId())
                .title(entry.getQuestion())
                .excerpt(TextTruncator.truncate(entry.getAnswer(), chatbotConfig.getExcerptLength()))
                .sourceLabel(sourceLabel(entry.getReference(), url, type))
                .sourceType(type)
                .url(url)
                .section(entry.getCategory())
                .confidence(match.getScore())
                .verified(entry.hasReference())
                .build();
    }

    SourceType classify(QaEntry entry, String url) {
        if (url == null) {
            return SourceType.INTERNAL_DATA;
        }

        String lower = url.toLowerCase(Locale.ROOT);
        if (!isOfficialHost(lower)) {
            return SourceType.UNKNOWN;
        }
        if (lower.contains("faq") || "よくある質問".equals(entry.getRemarks())) {
            return SourceType.FAQ;
        }
        if (lower.contains(".pdf") || lower.contains("manual")) {
            return SourceType.PDF_MANUAL;
        }
        if (lower.contains("doc") || lower.contains("guide")) {
            return SourceType.DOCUMENTATION;
        }
        if (lower.contains("blog") || lower.contains("news")) {
            return SourceType.BLOG_POST;
        }
        return SourceType.OFFICIAL_WEBSITE;
    }

    private boolean isOfficialHost(String url) {
        String host;
        try {
            host = URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (host == null) {
            return false;
        }
        return chatbotConfig.getOfficialHosts().stream()
                .map(h -> h.toLowerCase(Locale.ROOT))
                .anyMatch(h -> host.equals(h) || host.endsWith("." + h));
    }

    private String extractUrl(String reference) {
        if (reference == null) {
            return null;
        }
        Matcher matcher = URL.matcher(reference);
        if (!matcher.find()) {
            return null;
        }
        return matcher.group().replaceAll("[.,;]+$", "");
    }

    private String sourceLabel(String reference, String url, SourceType type) {
        if (reference == null || reference.isBlank()) {
            return type.label();
        }
        String text = url != null ? reference.substring(0, reference.indexOf(url)) : reference;
        text = text.strip().replaceAll("[-:：(（]+$", "").strip();
        if (text.isEmpty()) {
            return type.label();
        }
        int length = text.codePointCount(0, text.length());
        return length <= MAX_LABEL_LENGTH
                ? text
                : text.substring(text.offsetByCodePoints(0, length - MAX_LABEL_LENGTH));
    }
}
