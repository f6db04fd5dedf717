package com.embeddingstudio.vectordb.storage.collection;

import com.embeddingstudio.vectordb.common.exception.LockAcquisitionException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RowLockerTest {

    private final RowLocker locker = new RowLocker(3, Duration.ofMillis(1));

    @Test
    void locksDistinctIdsInSortedOrder() {
        List<String> attempted = new ArrayList<>();

        List<String> locked = locker.lockAll(List.of("c", "a", "b", "a"), id -> attempted.add(id));

        assertThat(locked).containsExactly("a", "b", "c");
        assertThat(attempted).containsExactly("a", "b", "c");
    }

    @Test
    void retriesUntilLockIsReleased() {
        AtomicInteger attempts = new AtomicInteger();

        locker.lockAll(List.of("a"), id -> attempts.incrementAndGet() == 3);

        assertThat(attempts.get()).isEqualTo(3);
    }

    @Test
    void givesUpAfterMaxAttempts() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> locker.lockAll(List.of("b", "a"), id -> {
            attempts.incrementAndGet();
            return !id.equals("b");
        }))
                .isInstanceOfSatisfying(LockAcquisitionException.class,
                        e -> assertThat(e.getObjectIds()).containsExactly("a", "b"));
        assertThat(attempts.get()).isEqualTo(4);
    }

    @Test
    void rejectsNonPositiveAttempts() {
        assertThatThrownBy(() -> new RowLocker(0, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
