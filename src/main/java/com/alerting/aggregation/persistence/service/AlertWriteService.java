package com.alerting.aggregation.persistence.service;

import com.alerting.aggregation.persistence.entity.AlertEntity;
import com.alerting.aggregation.persistence.repository.AlertRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Writes alerts in fixed-size batches, one transaction per batch, so a batch's effects
 * become visible all at once. A batch that loses an optimistic-lock race is skipped;
 * the reconciliation passes are idempotent and pick it up again on the next tick.
 */
@Slf4j
@Service
public class AlertWriteService {

    private final AlertRepository alertRepository;
    private final TransactionTemplate transactionTemplate;
    private final int batchSize;

    public AlertWriteService(AlertRepository alertRepository,
                             PlatformTransactionManager transactionManager,
                             @Value("${alerting.aggregation.batch-size:500}") int batchSize) {
        this.alertRepository = alertRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.batchSize = Math.max(1, batchSize);
    }

    /**
     * Saves the alerts and returns how many were written.
     *
     * @param reason short label for logs, e.g. {@code auto-close}
     */
    public int saveInBatches(List<AlertEntity> alerts, String reason) {
        return saveAllInBatches(alerts, reason).size();
    }

    /**
     * Saves the alerts and returns them as written, in input order, leaving out batches
     * that were skipped. Callers that go on changing an alert after this call must continue
     * on the returned instance: the one passed in may still carry collection changes that
     * are already committed.
     */
    public List<AlertEntity> saveAllInBatches(List<AlertEntity> alerts, String reason) {
        if (alerts == null || alerts.isEmpty()) {
            return List.of();
        }
        List<SavedBatch> saved = inBatches(alerts, reason,
                batch -> new SavedBatch(batch, alertRepository.saveAll(batch)));
        List<AlertEntity> written = new ArrayList<>();
        for (SavedBatch batch : saved) {
            batch.syncVersions();
            written.addAll(batch.written());
        }
        log.debug("Alert batch write complete: reason={}, requested={}, written={}", reason, alerts.size(), written.size());
        return written;
    }

    /**
     * Runs {@code work} over consecutive slices of {@code items}, each slice in its own
     * transaction. Returns the results of the slices that committed.
     */
    public <T, R> List<R> inBatches(List<T> items, String reason, Function<List<T>, R> work) {
        List<R> results = new ArrayList<>();
        for (int from = 0; from < items.size(); from += batchSize) {
            List<T> batch = items.subList(from, Math.min(from + batchSize, items.size()));
            try {
                R result = transactionTemplate.execute(status -> work.apply(batch));
                results.add(result);
            } catch (OptimisticLockingFailureException e) {
                log.warn("Alert batch skipped after concurrent modification: reason={}, batchSize={}, cause={}",
                        reason, batch.size(), e.getMessage());
            }
        }
        return results;
    }

    /**
     * Callers keep working with the detached instances they passed in, so the ids and
     * versions assigned on commit are copied back onto them.
     */
    private record SavedBatch(List<AlertEntity> originals, List<AlertEntity> managed) {

        boolean hasManagedCopies() {
            return managed != null && managed.size() == originals.size() && !managed.contains(null);
        }

        List<AlertEntity> written() {
            return hasManagedCopies() ? managed : originals;
        }

        void syncVersions() {
            if (!hasManagedCopies()) {
                return;
            }
            for (int i = 0; i < originals.size(); i++) {
                AlertEntity original = originals.get(i);
                AlertEntity copy = managed.get(i);
                if (copy != original) {
                    original.setId(copy.getId());
                    original.setVersion(copy.getVersion());
                }
            }
        }
    }
}
