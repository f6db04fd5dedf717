package com.embeddingstudio.vectordb.storage.vectordb;

import com.embeddingstudio.vectordb.common.exception.CollectionNotFoundException;
import com.embeddingstudio.vectordb.common.exception.CreateCollectionConflictException;
import com.embeddingstudio.vectordb.common.exception.DeleteBlueCollectionException;
import com.embeddingstudio.vectordb.common.model.CollectionStateInfo;
import com.embeddingstudio.vectordb.common.model.CollectionWorkState;
import com.embeddingstudio.vectordb.common.model.EmbeddingModelInfo;
import com.embeddingstudio.vectordb.common.model.MetricType;
import com.embeddingstudio.vectordb.common.model.ObjectPart;
import com.embeddingstudio.vectordb.common.model.SearchIndexInfo;
import com.embeddingstudio.vectordb.common.model.VectorObject;
import com.embeddingstudio.vectordb.storage.collection.Collection;
import com.embeddingstudio.vectordb.storage.config.VectorDbProperties;
import com.embeddingstudio.vectordb.storage.kv.RocksDbStore;
import com.embeddingstudio.vectordb.storage.metadata.RocksDbCollectionMetadataStore;
import com.embeddingstudio.vectordb.storage.optimization.CreateIndexOptimization;
import com.embeddingstudio.vectordb.storage.optimization.Optimization;
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
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RocksDbVectorDbTest {

    @TempDir
    Path tempDir;

    private RocksDbStore store;
    private RocksDbCollectionMetadataStore metadataStore;
    private VectorDbProperties properties;
    private VectorDb vectorDb;

    @BeforeEach
    void setUp() {
        store = new RocksDbStore(tempDir.toString());
        store.initialize();
        metadataStore = new RocksDbCollectionMetadataStore(store, Duration.ofSeconds(1));
        properties = new VectorDbProperties();
        vectorDb = new VectorDbFactory(store, metadataStore, properties).create("main_db");
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void createdCollectionsAreListedByKind() {
        vectorDb.createCollection(model("m1"));
        Collection query = vectorDb.createQueryCollection(model("m1"));

        assertThat(vectorDb.collectionExists("m1")).isTrue();
        assertThat(vectorDb.queryCollectionExists("m1_q")).isTrue();
        assertThat(vectorDb.collectionExists("m1_q")).isFalse();
        assertThat(vectorDb.listCollections()).extracting(CollectionStateInfo::collectionId).containsExactly("m1");
        assertThat(query.getStateInfo().containsQueries()).isTrue();
        assertThat(query.getStateInfo().embeddingModel().id()).isEqualTo("m1");
        assertThat(store.hasColumnFamily("dbo_main_db_m1_q")).isTrue();
        assertThat(store.hasColumnFamily("dbop_main_db_m1")).isTrue();
    }

    @Test
    void missingCollectionIsNotFound() {
        assertThatThrownBy(() -> vectorDb.getCollection("absent"))
                .isInstanceOf(CollectionNotFoundException.class);
        assertThatThrownBy(() -> vectorDb.getQueryCollection("absent_q"))
                .isInstanceOf(CollectionNotFoundException.class);
    }

    @Test
    void recreatingWithSameModelIsToleratedButOtherModelConflicts() {
        vectorDb.createCollection(model("m1"));

        assertThat(vectorDb.createCollection(model("m1")).getStateInfo().collectionId()).isEqualTo("m1");
        EmbeddingModelInfo other = new EmbeddingModelInfo("test-model", "m1",
                new SearchIndexInfo(3, MetricType.DOT, null, null));
        assertThatThrownBy(() -> vectorDb.createCollection(other))
                .isInstanceOf(CreateCollectionConflictException.class);
        assertThat(vectorDb.listCollections()).hasSize(1);
    }

    @Test
    void getOrCreateReturnsExistingCollection() {
        Collection created = vectorDb.getOrCreateCollection(model("m1"));
        created.insert(List.of(object("a")));

        Collection again = vectorDb.getOrCreateCollection(model("m1"));
        Collection query = vectorDb.getOrCreateQueryCollection(model("m1"));
        Collection queryAgain = vectorDb.getOrCreateQueryCollection(model("m1"));

        assertThat(again.getTotal(false)).isEqualTo(1);
        assertThat(query.getInfo()).isEqualTo(queryAgain.getInfo());
        assertThat(vectorDb.listQueryCollections()).hasSize(1);
    }

    @Test
    void blueSwitchPairsQueryCollection() {
        assertThat(vectorDb.getBlueCollection()).isEmpty();
        vectorDb.createCollection(model("m1"));
        vectorDb.createQueryCollection(model("m1"));

        vectorDb.setBlueCollection("m1");

        assertThat(vectorDb.getBlueCollection().map(c -> c.getStateInfo().collectionId())).contains("m1");
        assertThat(vectorDb.getBlueQueryCollection().map(c -> c.getStateInfo().collectionId())).contains("m1_q");
        assertThat(vectorDb.getCollection("m1").getStateInfo().workState()).isEqualTo(CollectionWorkState.BLUE);
    }

    @Test
    void blueSwitchWithoutQueryCollectionFailsAndKeepsPointer() {
        vectorDb.createCollection(model("m1"));
        vectorDb.createQueryCollection(model("m1"));
        vectorDb.setBlueCollection("m1");
        vectorDb.createCollection(model("m2"));

        assertThatThrownBy(() -> vectorDb.setBlueCollection("m2"))
                .isInstanceOf(CollectionNotFoundException.class);
        assertThat(vectorDb.getBlueCollection().map(c -> c.getStateInfo().collectionId())).contains("m1");
    }

    @Test
    void concurrentSwitchesLeaveExactlyOneBlueCollection() throws Exception {
        List<String> models = List.of("m1", "m2", "m3", "m4");
        for (String id : models) {
            vectorDb.createCollection(model(id));
            vectorDb.createQueryCollection(model(id));
        }

        ExecutorService executor = Executors.newFixedThreadPool(models.size());
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (String id : models) {
                futures.add(executor.submit(() -> {
                    start.await();
                    vectorDb.setBlueCollection(id);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        VectorDb reopened = new VectorDbFactory(store, metadataStore, properties).create("main_db");
        assertThat(reopened.listCollections().stream().filter(CollectionStateInfo::isBlue).count()).isEqualTo(1);
        assertThat(reopened.listQueryCollections().stream().filter(CollectionStateInfo::isBlue).count()).isEqualTo(1);
        String blue = reopened.getBlueCollection().orElseThrow().getStateInfo().collectionId();
        assertThat(reopened.getBlueQueryCollection().orElseThrow().getStateInfo().collectionId())
                .isEqualTo(blue + "_q");
    }

    @Test
    void blueCollectionCannotBeDeleted() {
        vectorDb.createCollection(model("m1"));
        vectorDb.createQueryCollection(model("m1"));
        vectorDb.setBlueCollection("m1");

        assertThatThrownBy(() -> vectorDb.deleteCollection("m1"))
                .isInstanceOf(DeleteBlueCollectionException.class);
        assertThatThrownBy(() -> vectorDb.deleteQueryCollection("m1_q"))
                .isInstanceOf(DeleteBlueCollectionException.class);

        assertThat(vectorDb.getCollection("m1").getStateInfo().isBlue()).isTrue();
        assertThat(store.hasColumnFamily("dbo_main_db_m1")).isTrue();
    }

    @Test
    void switchRacingDeleteNeverLeavesDanglingBluePointer() throws Exception {
        vectorDb.createCollection(model("base"));
        vectorDb.createQueryCollection(model("base"));
        vectorDb.setBlueCollection("base");

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 30; i++) {
                String id = "m" + i;
                vectorDb.createCollection(model(id));
                vectorDb.createQueryCollection(model(id));
                CountDownLatch start = new CountDownLatch(1);

                Future<Boolean> switched = executor.submit(() -> {
                    start.await();
                    try {
                        vectorDb.setBlueCollection(id);
                        return true;
                    } catch (CollectionNotFoundException e) {
                        return false;
                    }
                });
                Future<Boolean> deleted = executor.submit(() -> {
                    start.await();
                    try {
                        vectorDb.deleteCollection(id);
                        return true;
                    } catch (DeleteBlueCollectionException e) {
                        return false;
                    }
                });
                start.countDown();

                boolean switchWon = switched.get(10, TimeUnit.SECONDS);
                boolean deleteWon = deleted.get(10, TimeUnit.SECONDS);
                assertThat(switchWon).isNotEqualTo(deleteWon);

                String pointed = metadataStore.findBluePointer("main_db").orElseThrow().collectionId();
                assertThat(metadataStore.findCollection("main_db", pointed)).isPresent();
                assertThat(store.hasColumnFamily("dbo_main_db_" + pointed)).isTrue();
                VectorDb reopened = new VectorDbFactory(store, metadataStore, properties).create("main_db");
                assertThat(reopened.getBlueCollection()).isPresent();
                if (deleteWon) {
                    assertThat(store.hasColumnFamily("dbo_main_db_" + id)).isFalse();
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void deletingGreenCollectionDropsStorageAndMetadata() {
        vectorDb.createCollection(model("m1")).insert(List.of(object("a")));

        vectorDb.deleteCollection("m1");

        assertThat(vectorDb.collectionExists("m1")).isFalse();
        assertThat(store.hasColumnFamily("dbo_main_db_m1")).isFalse();
        assertThat(store.hasColumnFamily("dbop_main_db_m1")).isFalse();
        assertThatThrownBy(() -> vectorDb.deleteCollection("m1"))
                .isInstanceOf(CollectionNotFoundException.class);

        assertThat(vectorDb.createCollection(model("m1")).getTotal(false)).isZero();
    }

    @Test
    void namespacesAreIsolated() {
        vectorDb.createCollection(model("m1"));
        VectorDb categories = new VectorDbFactory(store, metadataStore, properties).create("categories_db");

        assertThat(categories.listCollections()).isEmpty();
        categories.createCollection(model("m1")).insert(List.of(object("a"), object("b")));
        assertThat(vectorDb.getCollection("m1").getTotal(false)).isZero();
    }

    @Test
    void optimizationsRunOncePerCollection() {
        AtomicInteger calls = new AtomicInteger();
        Optimization counting = new Optimization() {
            @Override
            public String getName() {
                return "Counting";
            }

            @Override
            public void apply(Collection collection) {
                calls.incrementAndGet();
            }
        };
        vectorDb.addOptimization(counting);
        vectorDb.addOptimization(new CreateIndexOptimization());

        Collection collection = vectorDb.createCollection(model("m1"));
        vectorDb.applyOptimizations();
        vectorDb.applyOptimizations();

        assertThat(calls.get()).isEqualTo(1);
        assertThat(collection.getStateInfo().appliedOptimizations())
                .containsExactly("Counting", CreateIndexOptimization.NAME);
        assertThat(collection.getStateInfo().indexCreated()).isTrue();
    }

    @Test
    void queryOptimizationsApplyToQueryCollectionsOnly() {
        vectorDb.createCollection(model("m1"));
        vectorDb.createQueryCollection(model("m1"));
        vectorDb.addQueryOptimization(new CreateIndexOptimization());

        vectorDb.applyQueryOptimizations();

        assertThat(vectorDb.getQueryCollection("m1_q").getStateInfo().indexCreated()).isTrue();
        assertThat(vectorDb.getCollection("m1").getStateInfo().indexCreated()).isFalse();
    }

    private static EmbeddingModelInfo model(String id) {
        return new EmbeddingModelInfo("test-model", id, SearchIndexInfo.of(3));
    }

    private static VectorObject object(String id) {
        return VectorObject.builder()
                .objectId(id)
                .parts(List.of(ObjectPart.of(id + "_0", 1f, 0f, 0f)))
                .build();
    }
}
