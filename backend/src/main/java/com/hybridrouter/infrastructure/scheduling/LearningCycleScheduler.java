package com.hybridrouter.infrastructure.scheduling;

import com.hybridrouter.application.learning.LearningCycleService;
import com.hybridrouter.application.learning.exception.LearningCycleInProgressException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class LearningCycleScheduler {

    private final LearningCycleService learningCycleService;

    @Scheduled(cron = "${router.learning.cron:0 30 3 * * *}")
    public void runDailyCycle() {
        try {
            learningCycleService.runCycle();
        } catch (LearningCycleInProgressException e) {
            log.info("[LearningCycle] Scheduled run skipped: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("[LearningCycle] Scheduled run failed, previous snapshots stay active", e);
        }
    }
}
