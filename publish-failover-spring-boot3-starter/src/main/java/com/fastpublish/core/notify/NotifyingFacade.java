package com.fastpublish.core.notify;

import com.fastpublish.model.ctx.NotifyContext;
import com.fastpublish.model.enums.Severity;
import org.springframework.beans.factory.ObjectProvider;

import java.util.function.Supplier;

public class NotifyingFacade {
    private final Supplier<AsyncNotifyingService> delegate;

    public NotifyingFacade(ObjectProvider<AsyncNotifyingService> p) {
        // 未启用notify则为 null
        this.delegate = p::getIfAvailable;
    }

    private NotifyingFacade(Supplier<AsyncNotifyingService> delegate) {
        this.delegate = delegate;
    }

    public static NotifyingFacade of(AsyncNotifyingService service) {
        return new NotifyingFacade(() -> service);
    }

    public static NotifyingFacade disabled() {
        return new NotifyingFacade(() -> null);
    }

    public void fire(NotifyContext ctx, Severity sev) {
        AsyncNotifyingService s = delegate.get();
        if (s != null) s.fire(ctx, sev);
    }
}
