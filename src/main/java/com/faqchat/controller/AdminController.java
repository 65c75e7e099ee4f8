package com.faqchat.controller;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.faqchat.exception.DatasetException;
import com.faqchat.model.InteractionEvent;
import com.faqchat.service.data.DataLoaderService;
import com.faqchat.service.data.DatasetSnapshot;
import com.faqchat.service.notification.NotificationSink;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    static final String RELOAD_FAILED_MESSAGE =
            "Dataset reload failed. The previously loaded data is still being served.";

    private final DataLoaderService dataLoaderService;
    private final NotificationSink notificationSink;
    private final Clock clock;

    /**
     * Rebuilds the dataset from its configured source. A failed reload leaves the current
     * snapshot in place and reports what is still being served.
     */
    @PostMapping("/reload-data")
    public ResponseEntity<Map<String, Object>> reloadData() {
        DatasetSnapshot snapshot;
        try {
            snapshot = dataLoaderService.loadDataset();
        } catch (DatasetException e) {
            log.error("Dataset reload failed ({}), keeping current data: {}", e.getKind(), e.getMessage());

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "reload_failed");
            body.put("error", RELOAD_FAILED_MESSAGE);
            body.put("reason", e.getKind().name());
            body.put("dataset", dataLoaderService.getStatistics());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
        }
        log.info("Dataset reloaded by admin request: v{}", snapshot.getVersion());

        notificationSink.notify(InteractionEvent.builder()
                .kind(InteractionEvent.Kind.DATASET_RELOAD)
                .answerPreview(snapshot.getSource() + " (" + snapshot.size() + " entries)")
                .timestamp(clock.instant())
                .build());

        return ResponseEntity.ok(dataLoaderService.getStatistics());
    }

    @GetMapping("/categories")
    public ResponseEntity<Map<String, Object>> categories() {
        Map<String, Map<String, Integer>> summary = dataLoaderService.getCategorySummary();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("categories", summary);
        body.put("total", summary.size());
        return ResponseEntity.ok(body);
    }
}
