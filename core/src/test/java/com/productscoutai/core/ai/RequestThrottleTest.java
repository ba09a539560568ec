package com.productscoutai.core.ai;

import com.productscoutai.core.support.RecordingSleeper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class RequestThrottleTest {

    @Test
    void spaces_requests_by_sixty_seconds_over_rpm() throws Exception {
        AtomicLong now = new AtomicLong(0);
        RecordingSleeper sleeper = new RecordingSleeper();
        RequestThrottle t = new RequestThrottle(60, sleeper, now::get);

        t.acquire();                       // 첫 요청은 대기 없음
        now.addAndGet(Duration.ofMillis(400).toNanos());
        t.acquire();                       // 1s 간격 중 600ms 남음
        now.addAndGet(Duration.ofSeconds(5).toNanos());
        t.acquire();                       // 이미 충분히 지남

        assertThat(sleeper.sleeps).containsExactly(Duration.ofMillis(600));
    }

    @Test
    void zero_rpm_means_unlimited() throws Exception {
        RecordingSleeper sleeper = new RecordingSleeper();
        RequestThrottle t = new RequestThrottle(0, sleeper, () -> 0L);
        for (int i = 0; i < 5; i++) t.acquire();
        assertThat(sleeper.sleeps).isEmpty();
    }
}
