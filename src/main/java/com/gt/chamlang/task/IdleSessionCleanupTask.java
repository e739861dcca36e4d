package com.gt.chamlang.task;

import com.gt.chamlang.session.PracticeSessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class IdleSessionCleanupTask {

    private static final Logger log = LoggerFactory.getLogger(IdleSessionCleanupTask.class);

    private static final long CLEANUP_SCHEDULE_MS = 5 * 60 * 1000;

    private final PracticeSessionService practiceSessionService;

    @Autowired
    public IdleSessionCleanupTask(PracticeSessionService practiceSessionService) {
        this.practiceSessionService = practiceSessionService;
    }

    @Scheduled(fixedDelay = CLEANUP_SCHEDULE_MS, initialDelay = CLEANUP_SCHEDULE_MS)
    public void evictIdleSessions() {
        int evictedCnt = practiceSessionService.evictIdleSessions();

        if (evictedCnt > 0) {
            log.info("Evicted {} idle practice sessions.", evictedCnt);
        }
    }
}
