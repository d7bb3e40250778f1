package com.fastpublish.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;

public class PublishMeterRegistryProvider {

    private final CompositeMeterRegistry composite;

    public PublishMeterRegistryProvider(List<MeterRegistry> discovered) {
        this.composite = new CompositeMeterRegistry();

        // 合入业务方注册表, 组合注册表展开后合入
        if (discovered != null) {
            for (MeterRegistry mr : discovered) {
                if (mr instanceof CompositeMeterRegistry c) {
                    c.getRegistries().forEach(this.composite::add);
                } else {
                    this.composite.add(mr);
                }
            }
        }
        // 保底 Simple
        if (this.composite.getRegistries().isEmpty()) {
            this.composite.add(new SimpleMeterRegistry());
        }
    }

    public MeterRegistry getRegistry() { return composite; }
}
