package com.example.reelreply.monitoring;

import com.example.reelreply.config.AutoReplyProperties;
import com.example.reelreply.content.ContentApiClient;
import com.example.reelreply.content.PostResult;
import com.example.reelreply.credential.CredentialProvider;
import com.example.reelreply.domain.Comment;
import com.example.reelreply.domain.ContentItem;
import com.example.reelreply.domain.Rule;
import com.example.reelreply.monitoring.event.MonitoringCycleCompletedEvent;
import com.example.reelreply.rules.RuleStore;
import com.example.reelreply.stats.MonitoringStatisticsTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one monitoring pass: load rules, fetch reels, fetch comments for every reel with an
 * enabled rule, reply where a comment matches and the account has not replied yet.
 *
 * Failures for one reel or one comment are logged and skipped. Failures that prevent the
 * pass itself (no credential, reels cannot be listed) are recorded as the last error.
 * Nothing is thrown out of {@link #runCycle(String)}.
 *
 * A reel that exceeds the item timeout is abandoned: its worker is interrupted and stops
 * before the next comment, but a reply call already on the wire may still complete.
 */
@Slf4j
@Service
public class MonitoringCycleExecutor {

    private final RuleStore ruleStore;
    private final ContentApiClient contentApiClient;
    private final CredentialProvider credentialProvider;
    private final ReplyStateResolver replyStateResolver;
    private final MonitoringErrorClassifier errorClassifier;
    private final MonitoringStatisticsTracker statisticsTracker;
    private final ApplicationEventPublisher eventPublisher;
    private final Executor contentExecutor;
    private final Clock clock;
    private final Duration itemTimeout;

    public MonitoringCycleExecutor(RuleStore ruleStore,
                                   ContentApiClient contentApiClient,
                                   CredentialProvider credentialProvider,
                                   ReplyStateResolver replyStateResolver,
                                   MonitoringErrorClassifier errorClassifier,
                                   MonitoringStatisticsTracker statisticsTracker,
                                   ApplicationEventPublisher eventPublisher,
                                   @Qualifier("contentExecutor") Executor contentExecutor,
                                   AutoReplyProperties properties,
                                   Clock clock) {
        this.ruleStore = ruleStore;
        this.contentApiClient = contentApiClient;
        this.credentialProvider = credentialProvider;
        this.replyStateResolver = replyStateResolver;
        this.errorClassifier = errorClassifier;
        this.statisticsTracker = statisticsTracker;
        this.eventPublisher = eventPublisher;
        this.contentExecutor = contentExecutor;
        this.clock = clock;
        this.itemTimeout = Duration.ofSeconds(Math.max(1, properties.getMonitoring().getItemTimeoutSeconds()));
    }

    public CycleResult runCycle(String trigger) {
        Instant startedAt = clock.instant();
        long start = System.nanoTime();
        CycleCounters counters = new CycleCounters();
        CycleResult result;

        try {
            if (!credentialProvider.isCredentialAvailable()) {
                throw new CredentialUnavailableException("No usable access token is configured");
            }

            Map<String, Rule> rules = enabledRules(ruleStore.loadRules());
            counters.enabledRules = rules.size();

            if (rules.isEmpty()) {
                log.debug("No enabled rules found, skipping content fetch");
            } else {
                String accountId = contentApiClient.accountId();
                counters.apiCalls.incrementAndGet();
                List<ContentItem> items = contentApiClient.listContentItems();
                counters.itemsFetched = items.size();
                log.debug("Fetched {} reels to evaluate against {} enabled rules", items.size(), rules.size());
                processItems(items, rules, accountId, counters);
            }

            statisticsTracker.recordCheck();
            result = counters.toResult(trigger, startedAt, elapsedSince(start), null, null);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            MonitoringErrorType type = errorClassifier.classify(e);
            String message = errorClassifier.describe(type, e);
            if (type == MonitoringErrorType.RATE_LIMIT) {
                log.warn("Monitoring cycle ({}) hit the rate limit: {}", trigger, e.getMessage());
            } else {
                log.error("Monitoring cycle ({}) failed [{}]: {}", trigger, type, e.getMessage());
            }
            recordError(type, message);
            result = counters.toResult(trigger, startedAt, elapsedSince(start), type, message);
        }

        try {
            eventPublisher.publishEvent(new MonitoringCycleCompletedEvent(result));
        } catch (RuntimeException e) {
            log.error("Cycle completion observer failed: {}", e.getMessage(), e);
        }
        return result;
    }

    private void recordError(MonitoringErrorType type, String message) {
        try {
            statisticsTracker.recordError(type, message);
        } catch (RuntimeException e) {
            log.error("Could not record monitoring error '{}': {}", message, e.getMessage(), e);
        }
    }

    private Map<String, Rule> enabledRules(Map<String, Rule> allRules) {
        Map<String, Rule> enabled = new LinkedHashMap<>();
        allRules.forEach((targetId, rule) -> {
            if (!rule.enabled()) {
                return;
            }
            if (!rule.isValid()) {
                log.warn("Skipping rule for reel {}: enabled but has no reply text", targetId);
                return;
            }
            enabled.put(targetId, rule);
        });
        return enabled;
    }

    private void processItems(List<ContentItem> items, Map<String, Rule> rules, String accountId,
                              CycleCounters counters) throws InterruptedException {
        List<ItemTask> tasks = new ArrayList<>();
        for (ContentItem item : items) {
            Rule rule = rules.get(item.id());
            if (rule == null) {
                log.debug("Reel {} has no enabled rule configured; skipping", item.id());
                continue;
            }
            counters.itemsProcessed.incrementAndGet();
            AtomicBoolean abandoned = new AtomicBoolean();
            FutureTask<Void> future = new FutureTask<>(
                    () -> processItem(item, rule, accountId, counters, abandoned), null);
            try {
                contentExecutor.execute(future);
            } catch (RejectedExecutionException e) {
                counters.itemFailures.incrementAndGet();
                log.error("No worker available for reel {}: {}", item.id(), e.getMessage());
                continue;
            }
            tasks.add(new ItemTask(item, future, abandoned));
        }

        for (ItemTask task : tasks) {
            try {
                task.future().get(itemTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                task.abandoned().set(true);
                task.future().cancel(true);
                counters.itemFailures.incrementAndGet();
                log.error("Processing reel {} did not finish within {}s, abandoning it",
                        task.item().id(), itemTimeout.toSeconds());
            } catch (ExecutionException e) {
                counters.itemFailures.incrementAndGet();
                log.error("Processing reel {} failed: {}", task.item().id(), e.getCause().getMessage());
            }
        }
    }

    private void processItem(ContentItem item, Rule rule, String accountId, CycleCounters counters,
                             AtomicBoolean abandoned) {
        List<Comment> comments;
        try {
            counters.apiCalls.incrementAndGet();
            comments = contentApiClient.listComments(item.id());
        } catch (Exception e) {
            if (abandoned.get()) {
                return;
            }
            counters.itemFailures.incrementAndGet();
            logFailure("Failed to fetch comments for reel " + item.id(), e);
            return;
        }

        counters.commentsScanned.addAndGet(comments.size());
        log.debug("Processing {} comments for reel {}", comments.size(), item.id());
        for (Comment comment : comments) {
            if (abandoned.get() || Thread.currentThread().isInterrupted()) {
                log.warn("Stopped processing reel {}: abandoned after timeout", item.id());
                return;
            }
            processComment(item, comment, rule, accountId, counters);
        }
    }

    private void processComment(ContentItem item, Comment comment, Rule rule, String accountId,
                                CycleCounters counters) {
        try {
            if (accountId != null && accountId.equals(comment.authorId())) {
                log.debug("Skipping comment {} on reel {}: authored by the account", comment.id(), item.id());
                return;
            }
            if (replyStateResolver.hasAccountReplied(comment, accountId)) {
                log.debug("Skipping comment {} on reel {}: already replied", comment.id(), item.id());
                return;
            }
            if (!rule.matches(comment.text())) {
                log.debug("Comment {} on reel {} did not match rule keywords", comment.id(), item.id());
                return;
            }
        } catch (UnpopulatedRepliesException e) {
            log.error("Skipping comment {} on reel {}: {}", comment.id(), item.id(), e.getMessage());
            return;
        }

        try {
            counters.apiCalls.incrementAndGet();
            contentApiClient.postReply(comment.id(), rule.replyText());
        } catch (Exception e) {
            counters.replyFailures.incrementAndGet();
            logFailure("Failed to reply to comment " + comment.id(), e);
            return;
        }
        counters.repliesSent.incrementAndGet();
        statisticsTracker.recordReply();
        log.info("Auto-replied to comment {} on reel {}", comment.id(), item.id());

        if (rule.hasPrivateReply()) {
            try {
                counters.apiCalls.incrementAndGet();
                PostResult sent = contentApiClient.postPrivateMessage(comment.id(), rule.privateReplyText());
                if (!sent.duplicate()) {
                    counters.privateMessagesSent.incrementAndGet();
                }
                log.debug("Sent private reply for comment {}", comment.id());
            } catch (Exception e) {
                log.warn("Failed to send private reply for comment {}: {}", comment.id(), e.getMessage());
            }
        }
    }

    private void logFailure(String what, Exception e) {
        MonitoringErrorType type = errorClassifier.classify(e);
        if (type == MonitoringErrorType.RATE_LIMIT) {
            log.warn("{} (rate limited): {}", what, e.getMessage());
        } else {
            log.error("{} [{}]: {}", what, type, e.getMessage());
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private record ItemTask(ContentItem item, FutureTask<Void> future, AtomicBoolean abandoned) {
    }

    private static final class CycleCounters {
        private int enabledRules;
        private int itemsFetched;
        private final AtomicInteger itemsProcessed = new AtomicInteger();
        private final AtomicInteger itemFailures = new AtomicInteger();
        private final AtomicInteger commentsScanned = new AtomicInteger();
        private final AtomicInteger repliesSent = new AtomicInteger();
        private final AtomicInteger replyFailures = new AtomicInteger();
        private final AtomicInteger privateMessagesSent = new AtomicInteger();
        private final AtomicInteger apiCalls = new AtomicInteger();

        CycleResult toResult(String trigger, Instant startedAt, Duration duration,
                             MonitoringErrorType errorType, String errorMessage) {
            return new CycleResult(trigger, startedAt, duration, errorType == null, enabledRules,
                    itemsFetched, itemsProcessed.get(), itemFailures.get(), commentsScanned.get(),
                    repliesSent.get(), replyFailures.get(), privateMessagesSent.get(), apiCalls.get(),
                    errorType, errorMessage);
        }
    }
}
