package com.faqchat.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CitationSet {

    @Builder.Default
    private List<Citation> items = List.of();

    private int totalSources;

    private int showing;

    private boolean hasMore;

    public static CitationSet empty() {
        return CitationSet.builder().build();
    }
}
