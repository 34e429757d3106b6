package com.decisions.scraper.dispatch;

import com.decisions.scraper.config.ScraperProperties;
import com.decisions.scraper.session.SearchSessionFactory;
import com.decisions.scraper.session.SessionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * <h2>Keyword fan-out</h2>
 *
 * <p>Runs one keyword session per keyword on a pool of
 * {@code min(keywords, maxConcurrency)} threads created for the call. Results
 * are collected in the order sessions finish. A session that throws, or that
 * is still running once the dispatch deadline (plus one wait timeout of grace)
 * has passed, is reported as a failed outcome; siblings are unaffected.
 * Stragglers are interrupted and given one more wait timeout to return the
 * decisions they already collected.</p>
 *
 * <p>{@link #dispatch(List)} never throws.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KeywordDispatcher {

    static final String DEADLINE_EXCEEDED = "dispatch deadline exceeded";

    static final String INTERRUPTED = "dispatch interrupted";

    private final ScraperProperties props;

    private final SearchSessionFactory sessionFactory;

    private final Clock clock;

    /**
     * @param keywords non-empty, de-duplicated keywords
     * @return one session result per keyword, in completion order
     */
    public DispatchReport dispatch(final List<String> keywords) {
        long started = System.nanoTime();
        if (keywords.isEmpty()) {
            return new DispatchReport(List.of(), Duration.ZERO);
        }

        Instant now = clock.instant();
        Instant dispatchDeadline = now.plus(props.getDispatchTimeout());
        Instant sessionDeadline = earliest(now.plus(props.getSessionTimeout()), dispatchDeadline);
        Instant collectUntil = dispatchDeadline.plus(props.getWaitTimeout());

        int workers = Math.min(keywords.size(), props.getMaxConcurrency());
        ExecutorService pool = Executors.newFixedThreadPool(workers, new CustomizableThreadFactory("keyword-session-"));
        CompletionService<SessionResult> completion = new ExecutorCompletionService<>(pool);

        Map<Future<SessionResult>, String> pending = new HashMap<>();
        for (String keyword : keywords) {
            pending.put(completion.submit(() -> sessionFactory.create(keyword, sessionDeadline).run()), keyword);
        }
        log.info("Dispatched {} keyword sessions on {} workers", keywords.size(), workers);

        List<SessionResult> completed = new ArrayList<>(keywords.size());
        String abandonReason = DEADLINE_EXCEEDED;
        try {
            while (!pending.isEmpty()) {
                long waitNanos = Duration.between(clock.instant(), collectUntil).toNanos();
                Future<SessionResult> done = waitNanos > 0
                        ? completion.poll(waitNanos, TimeUnit.NANOSECONDS)
                        : completion.poll();
                if (done == null) {
                    log.warn("Dispatch deadline passed with {} sessions still running", pending.size());
                    break;
                }
                completed.add(collect(done, pending.remove(done)));
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            abandonReason = INTERRUPTED;
            log.warn("Dispatch interrupted with {} sessions still running", pending.size());
        } finally {
            pool.shutdownNow();
        }

        if (!pending.isEmpty()) {
            if (!Thread.currentThread().isInterrupted()) {
                awaitStragglers(pool, pending.size());
            }
            String reason = abandonReason;
            pending.forEach((future, keyword) -> completed.add(abandon(future, keyword, reason)));
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        log.info("Dispatch of {} keywords finished in {} ms, {} raw results",
                keywords.size(), elapsed.toMillis(),
                completed.stream().mapToInt(s -> s.results().size()).sum());
        return new DispatchReport(completed, elapsed);
    }

    private SessionResult collect(final Future<SessionResult> future, final String keyword) {
        try {
            return future.get();
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.error("Keyword session '{}' crashed", keyword, cause);
            return SessionResult.failed(keyword, List.of(), 0, String.valueOf(cause.getMessage()));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return SessionResult.failed(keyword, List.of(), 0, INTERRUPTED);
        }
    }

    /**
     * Interrupted sessions get one wait timeout to unwind and hand back what
     * they collected.
     */
    private void awaitStragglers(final ExecutorService pool, final int running) {
        try {
            if (!pool.awaitTermination(props.getWaitTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} keyword sessions did not stop after interruption", running);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Result for a session the dispatch stopped waiting for. A session that
     * unwound in time keeps its collected decisions.
     */
    private SessionResult abandon(final Future<SessionResult> future, final String keyword, final String reason) {
        if (future.isDone() && !future.isCancelled()) {
            SessionResult own = collect(future, keyword);
            if (own.success()) {
                return own;
            }
            return SessionResult.failed(keyword, own.results(), own.pagesVisited(), reason);
        }
        future.cancel(true);
        return SessionResult.failed(keyword, List.of(), 0, reason);
    }

    private static Instant earliest(final Instant a, final Instant b) {
        return a.isBefore(b) ? a : b;
    }
}
