package com.gt.chamlang.scheduling;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;

@ExtendWith(SpringExtension.class)
public class EasinessFactorTests {

    @Test
    public void testUpdate() {
        assertEquals(2.5, EasinessFactor.update(2.5, 5), 1e-9);
        assertEquals(2.2, EasinessFactor.update(2.1, 5), 1e-9);
        assertEquals(2.1, EasinessFactor.update(2.1, 4), 1e-9);
        assertEquals(1.96, EasinessFactor.update(2.1, 3), 1e-9);
        assertEquals(1.78, EasinessFactor.update(2.1, 2), 1e-9);
        assertEquals(1.3, EasinessFactor.update(1.4, 2), 1e-9);
    }

    @Test
    public void testClamp() {
        assertEquals(1.3, EasinessFactor.clamp(0.2), 1e-9);
        assertEquals(2.5, EasinessFactor.clamp(3.1), 1e-9);
        assertEquals(2.5, EasinessFactor.clamp(Double.NaN), 1e-9);
        assertEquals(1.9, EasinessFactor.clamp(1.9), 1e-9);
    }

    @Test
    public void testQualityAfterCycle() {
        assertEquals(4, EasinessFactor.qualityAfterCycle(3));
        assertEquals(4, EasinessFactor.qualityAfterCycle(5));
        assertEquals(5, EasinessFactor.qualityAfterCycle(6));
        assertEquals(5, EasinessFactor.qualityAfterCycle(30));
    }
}
