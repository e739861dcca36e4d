package com.gt.chamlang.task;

import com.gt.chamlang.session.PracticeSessionService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class IdleSessionCleanupTaskTests {

    @Mock private PracticeSessionService practiceSessionService;

    @Test
    public void testEvictIdleSessions() {
        when(practiceSessionService.evictIdleSessions()).thenReturn(2);

        new IdleSessionCleanupTask(practiceSessionService).evictIdleSessions();

        verify(practiceSessionService, times(1)).evictIdleSessions();
    }
}
