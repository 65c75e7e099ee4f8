package com.faqchat.dto.internal;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SourceType {
    INTERNAL_DATA("内部データ"),
    OFFICIAL_WEBSITE("公式サイト"),
    PDF_MANUAL("PDFマニュアル"),
    FAQ("よくある質問"),
    DOCUMENTATION("ドキュメント"),
    BLOG_POST("ブログ記事"),
    UNKNOWN("参考資料");

    private final String label;

    SourceType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
