package com.embeddingstudio.vectordb.storage.config;

import com.embeddingstudio.vectordb.common.model.EmbeddingModelInfo;
import com.embeddingstudio.vectordb.common.model.SearchIndexInfo;
import com.embeddingstudio.vectordb.storage.vectordb.VectorDb;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@DirtiesContext
class VectorDbConfigTest {

    @TempDir
    static Path dataDir;

    @DynamicPropertySource
    static void storageProperties(DynamicPropertyRegistry registry) {
        registry.add("vector-db.storage.data-path", () -> dataDir.toString());
    }

    @Autowired
    private VectorDbProperties properties;

    @Autowired
    private VectorDb vectorDb;

    @Autowired
    @Qualifier("categoriesVectorDb")
    private VectorDb categoriesVectorDb;

    @Test
    void propertiesAreBoundFromTestProfile() {
        assertThat(properties.getBackend()).isEqualTo(VectorDbBackend.ROCKSDB);
        assertThat(properties.getLocking().getMaxAttempts()).isEqualTo(3);
        assertThat(properties.getLocking().getRetryDelay()).isEqualTo(Duration.ofMillis(10));
        assertThat(properties.getIndex().getEfSearch()).isEqualTo(50);
    }

    @Test
    void primaryAndCategoriesNamespacesAreSeparate() {
        assertThat(vectorDb.getDbId()).isEqualTo("test_db");
        assertThat(categoriesVectorDb.getDbId()).isEqualTo("test_categories_db");

        vectorDb.getOrCreateCollection(new EmbeddingModelInfo("test-model", "config_model", SearchIndexInfo.of(4)));

        assertThat(vectorDb.collectionExists("config_model")).isTrue();
        assertThat(categoriesVectorDb.collectionExists("config_model")).isFalse();
    }
}
