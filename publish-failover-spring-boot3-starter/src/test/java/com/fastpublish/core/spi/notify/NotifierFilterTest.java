package com.fastpublish.core.spi.notify;

import com.fastpublish.core.notify.NotifyContexts;
import com.fastpublish.model.ctx.NotifyContext;
import com.fastpublish.model.enums.Severity;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class NotifierFilterTest {

    private final NotifyContext ctx = NotifyContexts.ctxForBackoffSaturated("amqp://a", 5, TimeUnit.SECONDS);

    @Test
    void atLeastDropsLowerSeverities() {
        NotifierFilter filter = NotifierFilter.atLeast(Severity.ERROR);

        assertThat(filter.allow(ctx, Severity.INFO)).isFalse();
        assertThat(filter.allow(ctx, Severity.WARNING)).isFalse();
        assertThat(filter.allow(ctx, Severity.ERROR)).isTrue();
        assertThat(filter.allow(ctx, Severity.CRITICAL)).isTrue();
    }

    @Test
    void andShortCircuitsOnTheFirstRejection() {
        AtomicInteger asked = new AtomicInteger();
        NotifierFilter counting = (c, s) -> {
            asked.incrementAndGet();
            return true;
        };
        NotifierFilter filter = NotifierFilter.atLeast(Severity.WARNING).and(counting);

        assertThat(filter.allow(ctx, Severity.INFO)).isFalse();
        assertThat(asked).hasValue(0);
        assertThat(filter.allow(ctx, Severity.WARNING)).isTrue();
        assertThat(asked).hasValue(1);
    }
}
