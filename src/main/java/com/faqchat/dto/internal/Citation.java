package com.faqchat.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Citation {

    private String id;

    private Integer entryId;

    private String title;

    private String excerpt;

    private String sourceLabel;

    private SourceType sourceType;

    private String url;

    private String section;  // category of the cited entry

    private Double confidence;

    private boolean verified;
}
