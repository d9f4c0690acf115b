package com.my.jamla.adapter.out.health;

import com.my.jamla.adapter.in.scheduler.DigestScheduler;
import com.my.jamla.adapter.out.persistence.SqliteSubscriptionStore;
import com.my.jamla.domain.service.ChannelWatchService;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class SubscriptionReadinessCheck implements HealthCheck {

    private final SqliteSubscriptionStore store;
    private final DigestScheduler scheduler;
    private final ChannelWatchService channelWatchService;

    public SubscriptionReadinessCheck(SqliteSubscriptionStore store,
                                      DigestScheduler scheduler,
                                      ChannelWatchService channelWatchService) {
        this.store = store;
        this.scheduler = scheduler;
        this.channelWatchService = channelWatchService;
    }

    @Override
    public HealthCheckResponse call() {
        boolean storeOk = store.isReachable();
        DigestScheduler.State schedulerState = scheduler.state();
        boolean schedulerOk = schedulerState != DigestScheduler.State.TERMINATED;
        return HealthCheckResponse.named("subscription-readiness")
                .withData("storeReachable", storeOk)
                .withData("schedulerState", schedulerState.name())
                .withData("watchedChannels", channelWatchService.watchedChannelIds().size())
                .status(storeOk && schedulerOk)
                .build();
    }
}
