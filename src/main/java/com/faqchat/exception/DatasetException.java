package com.faqchat.exception;

import lombok.Getter;

/**
 * Load-time failure of the Q&A dataset. Fatal to the search path, never to a single request.
 */
@Getter
public class DatasetException extends ChatbotException {

    public enum Kind {
        MALFORMED_ROW,
        EMPTY_DATASET,
        UNREADABLE,
        NOT_LOADED
    }

    private final Kind kind;

    public DatasetException(Kind kind, String message) {
        super(ErrorCode.DATASET_ERROR, message);
        this.kind = kind;
    }

    public DatasetException(Kind kind, String message, Throwable cause) {
        super(ErrorCode.DATASET_ERROR, message, cause);
        this.kind = kind;
    }

    public static DatasetException malformedRow(int line, int columns) {
        return new DatasetException(Kind.MALFORMED_ROW,
                "Row " + line + " has " + columns + " column(s), question and answer are required");
    }

    public static DatasetException emptyDataset(String source) {
        return new DatasetException(Kind.EMPTY_DATASET, "No usable Q&A rows in " + source);
    }

    public static DatasetException notLoaded() {
        return new DatasetException(Kind.NOT_LOADED, "Q&A dataset is not loaded");
    }
}
