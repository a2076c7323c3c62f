package com.nursingjobs.pipeline.ingest.classify;

import com.nursingjobs.pipeline.config.PipelineProperties;
import com.nursingjobs.pipeline.ingest.model.ClassificationOutcome;
import com.nursingjobs.pipeline.ingest.model.ClassificationSummary;
import com.nursingjobs.pipeline.ingest.model.ClassifierVerdict;
import com.nursingjobs.pipeline.ingest.model.JobRecord;
import com.nursingjobs.pipeline.ingest.persistence.ActivationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

/**
 * Sends pending jobs to the classifier in bounded batches with a small fixed fan-out. A job is
 * promoted to active only after a successful, in-vocabulary answer; every other outcome leaves
 * it pending (or inactive for non-RN roles).
 */
@Service
public class ClassificationGate {
    private static final Logger log = LoggerFactory.getLogger(ClassificationGate.class);
    private static final long DEADLINE_GRACE_SECONDS = 5;

    private final ClassificationClient client;
    private final ActivationStore store;
    private final PipelineProperties properties;
    private final ExecutorService executor;

    public ClassificationGate(
        ClassificationClient client,
        ActivationStore store,
        PipelineProperties properties,
        @Qualifier("classificationExecutor") ExecutorService executor
    ) {
        this.client = client;
        this.store = store;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * @throws ClassificationServiceException when the service cannot be used at all; outcomes of
     *     calls already completed are persisted first
     */
    public ClassificationSummary classify(List<JobRecord> pending, String employerName, BooleanSupplier cancelled) {
        PipelineProperties.Classification config = properties.getClassification();
        int batchSize = config.getBatchSize();
        BigDecimal costPerCall = BigDecimal.valueOf(config.getCostPerCallUsd());
        AtomicReference<ClassificationServiceException> fatal = new AtomicReference<>();

        int attempted = 0;
        int succeeded = 0;
        int outOfScope = 0;
        int failed = 0;
        BigDecimal cost = BigDecimal.ZERO;
        List<JobRecord> activated = new ArrayList<>();

        for (int start = 0; start < pending.size(); start += batchSize) {
            if (cancelled.getAsBoolean()) {
                log.info("Classification cancelled with {} job(s) left pending", pending.size() - start);
                break;
            }
            List<JobRecord> batch = pending.subList(start, Math.min(pending.size(), start + batchSize));
            log.info(
                "Classifying batch {}-{} of {} for {}",
                start + 1,
                start + batch.size(),
                pending.size(),
                employerName
            );
            List<ClassificationOutcome> outcomes = runBatch(batch, employerName, fatal);
            for (ClassificationOutcome outcome : outcomes) {
                if (outcome == null) {
                    continue;
                }
                attempted++;
                cost = cost.add(costPerCall);
                switch (outcome.status()) {
                    case CLASSIFIED -> {
                        List<JobRecord> promoted = store.markActive(List.of(outcome.jobId()), outcome.classification());
                        activated.addAll(promoted);
                        succeeded++;
                        log.info("Job {} classified as {}", outcome.jobId(), outcome.classification().specialty());
                    }
                    case OUT_OF_SCOPE -> {
                        store.markInactive(List.of(outcome.jobId()));
                        outOfScope++;
                        log.info("Job {} is not a staff RN role; kept hidden", outcome.jobId());
                    }
                    case FAILED -> {
                        failed++;
                        log.warn("Job {} left pending: {}", outcome.jobId(), outcome.failureReason());
                    }
                }
            }
            if (fatal.get() != null) {
                throw fatal.get();
            }
        }

        log.info(
            "Classification finished for {}: attempted={}, classified={}, outOfScope={}, failed={}, estimatedCost=${}",
            employerName,
            attempted,
            succeeded,
            outOfScope,
            failed,
            cost
        );
        return new ClassificationSummary(attempted, succeeded, outOfScope, failed, cost, activated);
    }

    /**
     * Outcomes in batch order; null for jobs that were never sent.
     */
    private List<ClassificationOutcome> runBatch(
        List<JobRecord> batch,
        String employerName,
        AtomicReference<ClassificationServiceException> fatal
    ) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        List<Callable<ClassificationOutcome>> tasks = new ArrayList<>();
        for (JobRecord job : batch) {
            tasks.add(() -> classifyOne(job, employerName, mdc, fatal));
        }
        PipelineProperties.Classification config = properties.getClassification();
        long rounds = (batch.size() + config.getConcurrency() - 1) / config.getConcurrency();
        long deadlineSeconds = rounds * config.getTimeoutSeconds() + DEADLINE_GRACE_SECONDS;

        List<Future<ClassificationOutcome>> futures;
        try {
            futures = executor.invokeAll(tasks, deadlineSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while classifying; remaining jobs stay pending");
            return List.of();
        }

        List<ClassificationOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            long jobId = batch.get(i).id();
            try {
                outcomes.add(futures.get(i).get());
            } catch (CancellationException e) {
                outcomes.add(ClassificationOutcome.failed(jobId, "timeout: batch deadline of " + deadlineSeconds + "s exceeded"));
            } catch (ExecutionException e) {
                outcomes.add(ClassificationOutcome.failed(jobId, "unexpected error: " + e.getCause()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcomes.add(null);
            }
        }
        return outcomes;
    }

    private ClassificationOutcome classifyOne(
        JobRecord job,
        String employerName,
        Map<String, String> mdc,
        AtomicReference<ClassificationServiceException> fatal
    ) {
        if (fatal.get() != null) {
            return null;
        }
        if (mdc != null) {
            MDC.setContextMap(mdc);
        }
        try {
            ClassifierVerdict verdict = client.classify(job, employerName);
            if (!verdict.staffRn()) {
                return ClassificationOutcome.outOfScope(job.id());
            }
            return ClassificationOutcome.classified(job.id(), verdict.classification());
        } catch (ClassificationServiceException e) {
            fatal.compareAndSet(null, e);
            return null;
        } catch (ClassificationFailureException e) {
            return ClassificationOutcome.failed(job.id(), e.getMessage());
        } finally {
            MDC.clear();
        }
    }
}
