package com.faqchat.config;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.faqchat.exception.DatasetException;
import com.faqchat.service.data.DataLoaderService;
import com.faqchat.service.data.DatasetSnapshot;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInitializer implements ApplicationRunner {

    private final DataLoaderService dataLoaderService;
    private final DatasetConfig datasetConfig;

    @Override
    public void run(ApplicationArguments args) {
        log.info("\n{}", "=".repeat(70));
        log.info("INITIALIZING FAQ CHAT SERVICE");
        log.info("{}\n", "=".repeat(70));

        try {
            DatasetSnapshot snapshot = dataLoaderService.loadDataset();

            log.info("\n{}", "=".repeat(70));
            log.info("SYSTEM READY: {} Q&A entries, categories {}",
                    snapshot.size(), snapshot.categoryLabels());
            log.info("{}\n", "=".repeat(70));

        } catch (DatasetException e) {
            log.error("\n{}", "=".repeat(70));
            log.error("DATASET LOAD FAILED ({})", e.getKind());
            log.error("{}\n", "=".repeat(70));
            log.error("Error: {}", e.getMessage(), e);

            if (datasetConfig.isFailFast()) {
                throw e;
            }
            log.warn("Application started but search is unavailable until the dataset is reloaded");
        }
    }
}
