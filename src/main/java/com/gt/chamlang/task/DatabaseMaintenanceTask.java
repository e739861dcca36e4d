package com.gt.chamlang.task;

import com.gt.chamlang.session.PracticeSessionDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Component
public class DatabaseMaintenanceTask {

    private static final Logger log = LoggerFactory.getLogger(DatabaseMaintenanceTask.class);

    private final PracticeSessionDao practiceSessionDao;
    private final Clock clock;
    private final int purgeSessionsAfterDays;

    public DatabaseMaintenanceTask(PracticeSessionDao practiceSessionDao,
                                   Clock clock,
                                   @Value("${chamlang.maintenance.purgeSessionsAfterDays:365}") int purgeSessionsAfterDays) {
        this.practiceSessionDao = practiceSessionDao;
        this.clock = clock;

        this.purgeSessionsAfterDays = purgeSessionsAfterDays;
    }

    @Scheduled(cron = "@daily")
    public void performDatabaseMaintenance() {
        purgeOldPracticeSessions();
    }

    int purgeOldPracticeSessions() {
        if (purgeSessionsAfterDays <= 0) {
            log.info("Practice session purge is disabled.");
            return 0;
        }

        Instant cutoff = clock.instant().minus(purgeSessionsAfterDays, ChronoUnit.DAYS);

        int rowsDeleted = practiceSessionDao.purgeSessionsCompletedBefore(cutoff);

        log.info("Purged old practice sessions. {} row deleted.", rowsDeleted);

        return rowsDeleted;
    }
}
