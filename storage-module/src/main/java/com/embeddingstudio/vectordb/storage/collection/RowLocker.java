package com.embeddingstudio.vectordb.storage.collection;

import com.embeddingstudio.vectordb.common.exception.LockAcquisitionException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Takes no-wait row locks one id at a time in sorted order, retrying a held lock a bounded number of times.
 */
@Slf4j
public class RowLocker {

    private final int maxAttempts;
    private final Duration retryDelay;

    public RowLocker(int maxAttempts, Duration retryDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be positive, got: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.retryDelay = retryDelay;
    }

    /**
     * @param tryLock attempts one lock without waiting, false when another transaction holds it
     * @return the distinct ids in the order they were locked
     */
    public List<String> lockAll(List<String> objectIds, Predicate<String> tryLock) {
        List<String> sorted = List.copyOf(new TreeSet<>(objectIds));
        for (String objectId : sorted) {
            lockOne(objectId, sorted, tryLock);
        }
        return sorted;
    }

    private void lockOne(String objectId, List<String> requested, Predicate<String> tryLock) {
        for (int attempt = 1; ; attempt++) {
            if (tryLock.test(objectId)) {
                return;
            }
            if (attempt >= maxAttempts) {
                log.error("Failed to lock object {} after {} attempts", objectId, maxAttempts);
                throw new LockAcquisitionException(
                        String.format("Could not lock object %s after %d attempts", objectId, maxAttempts), requested);
            }
            log.warn("Object {} is locked, retry {} of {} in {} ms",
                    objectId, attempt, maxAttempts - 1, retryDelay.toMillis());
            try {
                Thread.sleep(retryDelay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockAcquisitionException("Interrupted while waiting for object lock " + objectId,
                        requested, e);
            }
        }
    }
}
