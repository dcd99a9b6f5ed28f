package com.hookrelay.trigger;

import com.hookrelay.dto.TriggerParams;
import com.hookrelay.exception.NoEventDetectedException;
import com.hookrelay.exception.TriggerDispatchException;
import com.hookrelay.model.DispatchOutcome;
import com.hookrelay.model.DispatchReport;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans one webhook's trigger params out to the build API.
 *
 * FLOW:
 *   0 params → no call, report carries the "no event detected" error
 *   1 param  → one call
 *   N params → one call per param; a failed call never stops the others
 *
 * Every attempt yields a DispatchOutcome, in input order, so the report always
 * has exactly as many outcomes as there were params.
 *
 * With maxParallel = 1 the calls run one after another on the request thread.
 * With maxParallel > 1 they run on a bounded pool shared by all requests and
 * are joined before the report is built.
 */
@Slf4j
public class TriggerDispatcher implements AutoCloseable {

    private final BuildTriggerClient client;
    private final ExecutorService executor;

    public TriggerDispatcher(BuildTriggerClient client, int maxParallel) {
        this.client = client;
        this.executor = maxParallel > 1 ? Executors.newFixedThreadPool(maxParallel, daemonThreads()) : null;
    }

    public DispatchReport dispatch(URI url, String apiToken, List<TriggerParams> params) {
        if (params.isEmpty()) {
            log.warn("Nothing to dispatch: no trigger params");
            return DispatchReport.noAttempt(NoEventDetectedException.MESSAGE);
        }

        List<DispatchOutcome> outcomes = executor == null || params.size() == 1
                ? dispatchSequentially(url, apiToken, params)
                : dispatchConcurrently(url, apiToken, params);

        DispatchReport report = DispatchReport.of(outcomes);
        log.info("Dispatched {} build trigger(s) → url={}, failed={}",
                report.getAttempted(), url, report.errors().size());
        return report;
    }

    private List<DispatchOutcome> dispatchSequentially(URI url, String apiToken, List<TriggerParams> params) {
        List<DispatchOutcome> outcomes = new ArrayList<>(params.size());
        for (int i = 0; i < params.size(); i++) {
            outcomes.add(attempt(i, url, apiToken, params.get(i)));
        }
        return outcomes;
    }

    private List<DispatchOutcome> dispatchConcurrently(URI url, String apiToken, List<TriggerParams> params) {
        List<CompletableFuture<DispatchOutcome>> futures = new ArrayList<>(params.size());
        for (int i = 0; i < params.size(); i++) {
            final int index = i;
            futures.add(CompletableFuture.supplyAsync(
                    () -> attempt(index, url, apiToken, params.get(index)), executor));
        }
        // attempt() never throws, so join() cannot either
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private DispatchOutcome attempt(int index, URI url, String apiToken, TriggerParams params) {
        try {
            client.trigger(url, apiToken, params);
            return DispatchOutcome.success(index, params);
        } catch (TriggerDispatchException e) {
            log.error("Trigger #{} failed: {}", index, e.getMessage());
            return DispatchOutcome.failure(index, params, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Trigger #{} failed unexpectedly: {}", index, e.getMessage(), e);
            return DispatchOutcome.failure(index, params, TriggerDispatchException.PREFIX + e.getMessage());
        }
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "trigger-dispatch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
