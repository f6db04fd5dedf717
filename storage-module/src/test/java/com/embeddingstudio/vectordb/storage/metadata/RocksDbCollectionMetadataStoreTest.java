package com.embeddingstudio.vectordb.storage.metadata;

import com.embeddingstudio.vectordb.common.exception.CollectionNotFoundException;
import com.embeddingstudio.vectordb.common.exception.DeleteBlueCollectionException;
import com.embeddingstudio.vectordb.common.exception.DuplicateKeyException;
import com.embeddingstudio.vectordb.common.model.BlueCollectionPointer;
import com.embeddingstudio.vectordb.common.model.CollectionInfo;
import com.embeddingstudio.vectordb.common.model.EmbeddingModelInfo;
import com.embeddingstudio.vectordb.common.model.SearchIndexInfo;
import com.embeddingstudio.vectordb.storage.kv.RocksDbStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RocksDbCollectionMetadataStoreTest {

    private static final String DB_ID = "db";

    @TempDir
    Path tempDir;

    private RocksDbStore store;
    private RocksDbCollectionMetadataStore metadataStore;

    @BeforeEach
    void setUp() {
        store = new RocksDbStore(tempDir.toString());
        store.initialize();
        metadataStore = new RocksDbCollectionMetadataStore(store, Duration.ofMillis(200));
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void insertedRecordIsFound() {
        metadataStore.insertCollection(record("m1"));

        assertThat(metadataStore.findCollection(DB_ID, "m1"))
                .hasValueSatisfying(found -> {
                    assertThat(found.embeddingModel().id()).isEqualTo("m1");
                    assertThat(found.indexCreated()).isFalse();
                    assertThat(found.createdAt()).isNotNull();
                });
        assertThat(metadataStore.findCollection(DB_ID, "missing")).isEmpty();
    }

    @Test
    void duplicateInsertIsRejected() {
        metadataStore.insertCollection(record("m1"));

        assertThatThrownBy(() -> metadataStore.insertCollection(record("m1")))
                .isInstanceOf(DuplicateKeyException.class);
    }

    @Test
    void findCollectionsIsScopedToNamespace() {
        metadataStore.insertCollection(record("m2"));
        metadataStore.insertCollection(record("m1"));
        metadataStore.insertCollection(CollectionInfoRecord.newRecord("db2",
                CollectionInfo.forModel(model("other")), false));

        assertThat(metadataStore.findCollections(DB_ID))
                .extracting(CollectionInfoRecord::collectionId)
                .containsExactly("m1", "m2");
        assertThat(metadataStore.findCollections("db2"))
                .extracting(CollectionInfoRecord::collectionId)
                .containsExactly("other");
    }

    @Test
    void namespaceWithSeparatorIsRejected() {
        assertThatThrownBy(() -> metadataStore.findCollections("a/b"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void updateKeepsCreationFieldsAndReplacesOptimizations() {
        CollectionInfoRecord inserted = record("m1");
        metadataStore.insertCollection(inserted);
        metadataStore.setIndexCreated(DB_ID, "m1", true);

        metadataStore.updateCollection(inserted.toBuilder()
                .appliedOptimizations(List.of("CreateIndexOptimization"))
                .indexCreated(false)
                .build());

        CollectionInfoRecord updated = metadataStore.findCollection(DB_ID, "m1").orElseThrow();
        assertThat(updated.appliedOptimizations()).containsExactly("CreateIndexOptimization");
        assertThat(updated.indexCreated()).isTrue();
    }

    @Test
    void updatingMissingRecordFails() {
        assertThatThrownBy(() -> metadataStore.updateCollection(record("missing")))
                .isInstanceOf(CollectionNotFoundException.class);
        assertThatThrownBy(() -> metadataStore.setIndexCreated(DB_ID, "missing", true))
                .isInstanceOf(CollectionNotFoundException.class);
    }

    @Test
    void deleteReportsWhetherRowExisted() {
        metadataStore.insertCollection(record("m1"));

        assertThat(metadataStore.deleteCollection(DB_ID, "m1")).isTrue();
        assertThat(metadataStore.deleteCollection(DB_ID, "m1")).isFalse();
    }

    @Test
    void collectionNamedByBluePointerIsNotDeleted() {
        metadataStore.insertCollection(record("m1"));
        metadataStore.insertCollection(queryRecord("m1_q"));
        metadataStore.switchBluePointer(new BlueCollectionPointer(DB_ID, "m1", "m1_q"));

        assertThatThrownBy(() -> metadataStore.deleteCollection(DB_ID, "m1"))
                .isInstanceOf(DeleteBlueCollectionException.class);
        assertThatThrownBy(() -> metadataStore.deleteCollection(DB_ID, "m1_q"))
                .isInstanceOf(DeleteBlueCollectionException.class);

        assertThat(metadataStore.findCollection(DB_ID, "m1")).isPresent();
        assertThat(metadataStore.findCollection(DB_ID, "m1_q")).isPresent();
    }

    @Test
    void bluePointerIsWrittenOnlyForExistingCollections() {
        metadataStore.insertCollection(record("m1"));
        metadataStore.insertCollection(queryRecord("m1_q"));

        assertThatThrownBy(() -> metadataStore.switchBluePointer(new BlueCollectionPointer(DB_ID, "m1", "nope")))
                .isInstanceOf(CollectionNotFoundException.class);
        assertThat(metadataStore.findBluePointer(DB_ID)).isEmpty();

        metadataStore.switchBluePointer(new BlueCollectionPointer(DB_ID, "m1", "m1_q"));

        assertThat(metadataStore.findBluePointer(DB_ID))
                .contains(new BlueCollectionPointer(DB_ID, "m1", "m1_q"));
    }

    private static CollectionInfoRecord record(String id) {
        return CollectionInfoRecord.newRecord(DB_ID, CollectionInfo.forModel(model(id)), false);
    }

    private static CollectionInfoRecord queryRecord(String id) {
        return CollectionInfoRecord.newRecord(DB_ID, new CollectionInfo(id, model(id), List.of()), true);
    }

    private static EmbeddingModelInfo model(String id) {
        return new EmbeddingModelInfo("test-model", id, SearchIndexInfo.of(3));
    }
}
