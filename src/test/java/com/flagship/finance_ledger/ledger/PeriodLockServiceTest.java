package com.flagship.finance_ledger.ledger;

import com.flagship.finance_ledger.common.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.YearMonth;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class PeriodLockServiceTest {

    @Autowired
    private PeriodLockService periodLockService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM period_locks");
    }

    @Test
    @DisplayName("Lock and unlock toggle the period")
    void testLockUnlock() {
        assertFalse(periodLockService.isPeriodLocked("2025-10"));

        assertTrue(periodLockService.lockPeriod("2025-10").isSuccess());
        assertTrue(periodLockService.isPeriodLocked("2025-10"));
        assertFalse(periodLockService.isPeriodLocked("2025-11"));

        assertTrue(periodLockService.unlockPeriod("2025-10").isSuccess());
        assertFalse(periodLockService.isPeriodLocked("2025-10"));
    }

    @Test
    @DisplayName("Locking twice is harmless; locked periods are listed in order")
    void testLockedPeriods() {
        periodLockService.lockPeriod("2025-11");
        periodLockService.lockPeriod("2025-09");
        periodLockService.lockPeriod("2025-11");
        periodLockService.lockPeriod("2025-10");
        periodLockService.unlockPeriod("2025-10");

        assertEquals(List.of(YearMonth.of(2025, 9), YearMonth.of(2025, 11)), periodLockService.lockedPeriods());
    }

    @Test
    @DisplayName("Malformed periods cannot be locked and are never reported locked")
    void testMalformedPeriod() {
        assertEquals(ErrorKind.INVALID_INPUT, periodLockService.lockPeriod("2025-13").getErrorKind());
        assertEquals(ErrorKind.INVALID_INPUT, periodLockService.unlockPeriod("October").getErrorKind());
        assertFalse(periodLockService.isPeriodLocked("2025-13"));
        assertFalse(periodLockService.isPeriodLocked(null));
    }
}
