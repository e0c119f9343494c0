package io.github.casevault.service;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

@ApplicationScoped
public class SessionCleanupJob {

    private static final Logger LOG = Logger.getLogger(SessionCleanupJob.class);

    @Inject SessionService sessionService;

    @Scheduled(
            every = "${casevault.sessions.cleanup-interval:15m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void purgeExpiredSessions() {
        long purged = sessionService.purgeExpired();
        if (purged > 0) {
            LOG.infof("Purged %d expired sessions", purged);
        }
    }
}
