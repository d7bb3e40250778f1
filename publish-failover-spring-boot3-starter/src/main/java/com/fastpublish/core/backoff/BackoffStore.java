package com.fastpublish.core.backoff;

import com.fastpublish.core.spi.Producer;
import com.fastpublish.model.ProducerKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * producer 退避状态表：
 * - 按 producer 实例身份存储当前退避时长
 * - 失败时指数放大 next = min(2 * (prev + 1), max), 成功时归零
 * - 超过 inactivityResetDelay 未被触碰的条目在读取时惰性清除, 不启动后台线程
 * - 线程安全, 同一 producer 的读改写通过 ConcurrentHashMap.compute 原子完成
 */
public class BackoffStore {

    private static final Logger log = LoggerFactory.getLogger(BackoffStore.class);

    private final ConcurrentHashMap<ProducerKey, BackoffEntry> entries = new ConcurrentHashMap<>();

    /** 不活跃过期阈值（纳秒）, <=0 表示不过期 */
    private final long inactivityNanos;

    /** 单调时钟, 测试可替换 */
    private final LongSupplier nanoClock;

    public BackoffStore(long inactivityResetDelay, TimeUnit unit, LongSupplier nanoClock) {
        Objects.requireNonNull(unit, "unit");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.inactivityNanos = inactivityResetDelay <= 0 ? 0 : unit.toNanos(inactivityResetDelay);
    }

    /**
     * 当前退避时长, 无条目或已过期返回 0
     * 不刷新 lastTouched
     */
    public long delayFor(Producer producer) {
        ProducerKey key = ProducerKey.of(producer);
        BackoffEntry entry = entries.get(key);
        if (entry == null) {
            return 0;
        }
        if (entry.isExpired(nanoClock.getAsLong(), inactivityNanos)) {
            evict(key, entry);
            return 0;
        }
        return entry.delay();
    }

    /**
     * 失败后放大退避
     * @param maxRetryDelay 上限, 在这里截断而不是在使用时截断
     * @return 放大后的退避时长
     */
    public long escalate(Producer producer, long maxRetryDelay) {
        return escalate(producer, maxRetryDelay, null);
    }

    /**
     * 同上; 若本次调用把退避从上限以下推到上限, 在更新完成后执行 onSaturated
     * 同一 producer 并发失败时只有一个调用方会触发, 归零后再次打满会再触发
     */
    public long escalate(Producer producer, long maxRetryDelay, Runnable onSaturated) {
        long cap = Math.max(0, maxRetryDelay);
        long[] prev = new long[1];
        BackoffEntry updated = entries.compute(ProducerKey.of(producer), (k, old) -> {
            long now = nanoClock.getAsLong();
            prev[0] = old == null || old.isExpired(now, inactivityNanos) ? 0 : old.delay();
            return new BackoffEntry(grow(prev[0], cap), now);
        });
        if (onSaturated != null && cap > 0 && prev[0] < cap && updated.delay() >= cap) {
            onSaturated.run();
        }
        return updated.delay();
    }

    /**
     * 成功后归零, 条目保留以便统一走不活跃过期
     */
    public void decay(Producer producer) {
        entries.compute(ProducerKey.of(producer), (k, old) -> new BackoffEntry(0, nanoClock.getAsLong()));
    }

    /**
     * 当前存活条目的只读快照（按实例身份）, 顺带清除过期条目
     */
    public Map<Producer, Long> snapshot() {
        long now = nanoClock.getAsLong();
        Map<Producer, Long> view = new IdentityHashMap<>();
        entries.forEach((key, entry) -> {
            if (entry.isExpired(now, inactivityNanos)) {
                evict(key, entry);
            } else {
                view.put(key.producer(), entry.delay());
            }
        });
        return Collections.unmodifiableMap(view);
    }

    /**
     * 主动清理过期条目
     * @return 清除数量
     */
    public int sweep() {
        long now = nanoClock.getAsLong();
        int removed = 0;
        for (Map.Entry<ProducerKey, BackoffEntry> e : entries.entrySet()) {
            if (e.getValue().isExpired(now, inactivityNanos) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * 2 * (prev + 1) 保证从 0 起步也能得到正数; prev >= cap / 2 时必然超过上限, 直接取 cap 防止溢出
     */
    static long grow(long prev, long cap) {
        if (prev >= cap / 2) {
            return cap;
        }
        return Math.min(2 * (prev + 1), cap);
    }

    private void evict(ProducerKey key, BackoffEntry expired) {
        // 条件删除: 并发刷新过的条目不会被误删
        if (entries.remove(key, expired)) {
            log.debug("[Backoff] entry expired after inactivity, producer={}", key);
        }
    }
}
