package com.fastpublish.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

public final class PublishMetrics {
    private final Counter attempt;
    private final Counter success;
    private final Counter failed;
    private final Counter failover;
    private final Counter notifySuppressed;
    private final Counter notifySent;
    private final Counter notifyFailed;
    private final DistributionSummary attempts;
    private final Timer backoffWait;

    private PublishMetrics(MeterRegistry reg) {
        this.attempt  = Counter.builder("publish.attempt").description("publish attempts").register(reg);
        this.success  = Counter.builder("publish.success").description("messages delivered").register(reg);
        this.failed   = Counter.builder("publish.failure").description("failed publish attempts").register(reg);
        this.failover = Counter.builder("publish.failover").description("sends that exhausted all attempts").register(reg);
        this.attempts = DistributionSummary.builder("publish.attempts")
                .description("attempt count per send").baseUnit("times").register(reg);
        this.notifySuppressed = Counter.builder("publish.notify.suppressed").description("notify suppressed").register(reg);
        this.notifySent   = Counter.builder("publish.notify.sent").description("notify sent").register(reg);
        this.notifyFailed = Counter.builder("publish.notify.failed").description("notify failed").register(reg);
        this.backoffWait = Timer.builder("publish.backoff.wait").description("time suspended before an attempt").register(reg);
    }

    public static PublishMetrics create(MeterRegistry reg) { return new PublishMetrics(reg); }

    /** 独立的内存注册表, 未接入 Spring 时使用 */
    public static PublishMetrics standalone() { return new PublishMetrics(new SimpleMeterRegistry()); }

    public void incAttempt(){  attempt.increment(); }
    public void incSuccess(){  success.increment(); }
    public void incFailed(){   failed.increment(); }
    public void incFailover(){ failover.increment(); }
    public void incNotifySuppressed(){ notifySuppressed.increment();}
    public void incNotifyFailed(){ notifyFailed.increment();}
    public void incNotifySent(){ notifySent.increment();}
    public void recordAttempts(int n){ attempts.record(n); }
    public void recordBackoffNanos(long nanos){ backoffWait.record(nanos, TimeUnit.NANOSECONDS); }
}
