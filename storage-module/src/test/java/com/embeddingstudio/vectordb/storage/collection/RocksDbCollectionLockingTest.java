package com.embeddingstudio.vectordb.storage.collection;

import com.embeddingstudio.vectordb.common.exception.LockAcquisitionException;
import com.embeddingstudio.vectordb.common.model.EmbeddingModelInfo;
import com.embeddingstudio.vectordb.common.model.ObjectPart;
import com.embeddingstudio.vectordb.common.model.SearchIndexInfo;
import com.embeddingstudio.vectordb.common.model.VectorObject;
import com.embeddingstudio.vectordb.storage.config.VectorDbProperties;
import com.embeddingstudio.vectordb.storage.kv.RocksDbStore;
import com.embeddingstudio.vectordb.storage.metadata.RocksDbCollectionMetadataStore;
import com.embeddingstudio.vectordb.storage.vectordb.RocksDbVectorDb;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RocksDbCollectionLockingTest {

    @TempDir
    Path tempDir;

    private RocksDbStore store;
    private Collection collection;

    @BeforeEach
    void setUp() {
        store = new RocksDbStore(tempDir.toString());
        store.initialize();
        VectorDbProperties properties = new VectorDbProperties();
        properties.getLocking().setMaxAttempts(3);
        properties.getLocking().setRetryDelay(Duration.ofMillis(10));
        RocksDbVectorDb vectorDb = new RocksDbVectorDb(store,
                new RocksDbCollectionMetadataStore(store, Duration.ofMillis(200)), "lock_db", properties);
        collection = vectorDb.createCollection(new EmbeddingModelInfo("test-model", "m", SearchIndexInfo.of(2)));

        List<VectorObject> objects = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            objects.add(object("obj-" + i));
        }
        collection.insert(objects);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void heldLockMakesOtherWritersFailAfterRetries() {
        try (ObjectLock lock = collection.lockObjects(List.of("obj-2", "obj-1"))) {
            assertThat(lock.objectIds()).containsExactly("obj-1", "obj-2");

            assertThatThrownBy(() -> collection.delete(List.of("obj-0", "obj-1")))
                    .isInstanceOfSatisfying(LockAcquisitionException.class,
                            e -> assertThat(e.isRetryable()).isTrue());
            assertThatThrownBy(() -> collection.upsert(List.of(object("obj-2"))))
                    .isInstanceOf(LockAcquisitionException.class);
        }

        assertThat(collection.getTotal(false)).isEqualTo(20);
        collection.delete(List.of("obj-0", "obj-1"));
        assertThat(collection.getTotal(false)).isEqualTo(18);
    }

    @Test
    void writesThroughLockAreInvisibleUntilCommit() {
        try (ObjectLock lock = collection.lockObjects(List.of("obj-0", "new"))) {
            lock.delete(List.of("obj-0"));
            lock.insert(List.of(object("new")));

            assertThat(collection.findByIds(List.of("obj-0", "new")))
                    .extracting(VectorObject::objectId)
                    .containsExactly("obj-0");
            lock.commit();
        }

        assertThat(collection.findByIds(List.of("obj-0", "new")))
                .extracting(VectorObject::objectId)
                .containsExactly("new");
    }

    @Test
    void lockRejectsWritesToIdsItDoesNotHold() {
        try (ObjectLock lock = collection.lockObjects(List.of("obj-0"))) {
            assertThatThrownBy(() -> lock.delete(List.of("obj-1")))
                    .isInstanceOf(IllegalStateException.class);
        }
        assertThat(collection.getTotal(false)).isEqualTo(20);
    }

    @Test
    void uncommittedLockRollsBack() {
        try (ObjectLock lock = collection.lockObjects(List.of("obj-0"))) {
            lock.delete(List.of("obj-0"));
        }

        assertThat(collection.findByIds(List.of("obj-0"))).hasSize(1);
    }

    @Test
    void concurrentOverlappingDeletesNeverInterleave() throws Exception {
        List<String> first = new ArrayList<>();
        List<String> second = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            first.add("obj-" + i);
        }
        for (int i = 5; i < 20; i++) {
            second.add("obj-" + i);
        }

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<Boolean> a = executor.submit(() -> deleteAfter(start, first));
            Future<Boolean> b = executor.submit(() -> deleteAfter(start, second));
            start.countDown();

            boolean aSucceeded = a.get(10, TimeUnit.SECONDS);
            boolean bSucceeded = b.get(10, TimeUnit.SECONDS);

            assertThat(aSucceeded || bSucceeded).isTrue();
            List<String> remaining = remainingIds();
            if (aSucceeded && bSucceeded) {
                assertThat(remaining).isEmpty();
            } else if (aSucceeded) {
                assertThat(remaining).containsExactlyInAnyOrder("obj-15", "obj-16", "obj-17", "obj-18", "obj-19");
            } else {
                assertThat(remaining).containsExactlyInAnyOrder("obj-0", "obj-1", "obj-2", "obj-3", "obj-4");
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private boolean deleteAfter(CountDownLatch start, List<String> ids) throws InterruptedException {
        start.await();
        try {
            collection.delete(ids);
            return true;
        } catch (LockAcquisitionException e) {
            return false;
        }
    }

    private List<String> remainingIds() {
        List<String> all = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            all.add("obj-" + i);
        }
        return collection.findByIds(all).stream().map(VectorObject::objectId).toList();
    }

    private static VectorObject object(String id) {
        return VectorObject.builder()
                .objectId(id)
                .parts(List.of(ObjectPart.of(id + "_0", 1f, 0f)))
                .build();
    }
}
