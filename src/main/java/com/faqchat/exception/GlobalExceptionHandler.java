package com.faqchat.exception;

import com.faqchat.dto.response.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Maps failures to friendly bodies. System faults get an {@code errorId} that is logged together
 * with the stack trace; raw diagnostics never reach the client.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String FALLBACK_MESSAGE =
            "申し訳ございません。しばらくしてから再度お試しいただくか、お問い合わせフォームをご利用ください。";

    /**
     * Dataset missing or failed to load: the search path is unavailable
     */
    @ExceptionHandler(DatasetException.class)
    public ResponseEntity<ErrorResponse> handleDatasetException(DatasetException e) {
        String errorId = newErrorId();
        log.error("[{}] Dataset unavailable ({}): {}", errorId, e.getKind(), e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorResponse.builder()
                .error("現在、回答データを読み込めないため検索をご利用いただけません。")
                .fallbackMessage(FALLBACK_MESSAGE)
                .errorId(errorId)
                .build());
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        log.info("Not found: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.builder()
                .error("指定された項目が見つかりませんでした。")
                .build());
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        log.debug("Validation failed: {}", e.getFieldErrors());
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .error("入力内容をご確認ください。")
                .fieldErrors(e.getFieldErrors())
                .build());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException e) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError error : e.getBindingResult().getFieldErrors()) {
            fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        log.debug("Request validation failed: {}", fieldErrors);
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .error("入力内容をご確認ください。")
                .fieldErrors(fieldErrors)
                .build());
    }

    /**
     * Unparseable body, including an unknown feedback rating
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleNotReadable(HttpMessageNotReadableException e) {
        log.debug("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .error("リクエストの形式が正しくありません。")
                .build());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.debug("Invalid argument: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .error("リクエストの形式が正しくありません。")
                .build());
    }

    @ExceptionHandler(ChatbotException.class)
    public ResponseEntity<ErrorResponse> handleChatbotException(ChatbotException e) {
        String errorId = newErrorId();
        log.error("[{}] {} : {}", errorId, e.getErrorCode(), e.getMessage(), e);
        return internalError(errorId);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        String errorId = newErrorId();
        log.error("[{}] Unexpected error", errorId, e);
        return internalError(errorId);
    }

    private static ResponseEntity<ErrorResponse> internalError(String errorId) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.builder()
                .error("システムエラーが発生しました。")
                .fallbackMessage(FALLBACK_MESSAGE)
                .errorId(errorId)
                .build());
    }

    static String newErrorId() {
        return "ERR_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
    }
}
