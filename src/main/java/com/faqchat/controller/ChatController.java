package com.faqchat.controller;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.faqchat.dto.request.FeedbackRequest;
import com.faqchat.dto.request.SearchRequest;
import com.faqchat.dto.response.SearchResponse;
import com.faqchat.service.data.DataLoaderService;
import com.faqchat.service.feedback.FeedbackService;
import com.faqchat.service.search.SearchService;
import com.faqchat.service.session.SessionStoreService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ChatController {

    private final SearchService searchService;
    private final FeedbackService feedbackService;
    private final DataLoaderService dataLoaderService;
    private final SessionStoreService sessionStore;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        log.debug("Health check requested");

        boolean loaded = dataLoaderService.isDataLoaded();

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", loaded ? "healthy" : "degraded");
        health.put("timestamp", Instant.now().toString());
        health.put("service", "FAQ Chat API");
        health.put("dataset", dataLoaderService.getStatistics());
        health.put("active_sessions", sessionStore.getSessionCount());

        return ResponseEntity.ok(health);
    }

    @PostMapping("/search")
    public ResponseEntity<SearchResponse> search(@Valid @RequestBody SearchRequest request) {
        log.info("Search received: {} (category: {})", request.getQuestion(), request.getCategory());
        return ResponseEntity.ok(searchService.search(request));
    }

    @PostMapping("/feedback")
    public ResponseEntity<Void> feedback(@Valid @RequestBody FeedbackRequest request) {
        feedbackService.submit(request);
        return ResponseEntity.accepted().build();
    }
}
