package com.sintajournals.scraper;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class UtilsTest {
    @Test
    void testRetryRendererActionSuccess() {
        int result = Utils.retryRendererAction(() -> 42, 3, "test action");
        assertEquals(42, result);
    }

    @Test
    void testRetryRendererActionRecoversAfterFailure() {
        AtomicInteger calls = new AtomicInteger();
        String result = Utils.retryRendererAction(() -> {
            if (calls.incrementAndGet() == 1) throw new IllegalStateException("flaky");
            return "ok";
        }, 2, "flaky action");
        assertEquals("ok", result);
        assertEquals(2, calls.get());
    }

    @Test
    void testRetryRendererActionFailure() {
        AtomicInteger calls = new AtomicInteger();
        Integer result = Utils.retryRendererAction(() -> {
            calls.incrementAndGet();
            throw new RuntimeException("fail");
        }, 1, "fail action");
        assertNull(result);
        assertEquals(1, calls.get());
    }

    @Test
    void testFileTimestamp() {
        assertEquals("20250104_083012", Utils.fileTimestamp(LocalDateTime.of(2025, 1, 4, 8, 30, 12)));
    }

    @Test
    void testDatePartition() {
        LocalDateTime time = LocalDateTime.of(2025, 3, 9, 23, 59);
        assertEquals("/user/sinta/journals/2025/03/09", Utils.datePartition("/user/sinta/journals", time));
        assertEquals("/user/sinta/journals/2025/03/09", Utils.datePartition("/user/sinta/journals/", time));
    }
}
