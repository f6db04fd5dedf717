package com.embeddingstudio.vectordb.storage.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the vector database engine.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "vector-db")
public class VectorDbProperties {

    @NotNull
    private VectorDbBackend backend = VectorDbBackend.ROCKSDB;

    /**
     * Namespace of general objects.
     */
    @NotBlank
    private String dbId = "rocksdb_single_db";

    /**
     * Namespace of category-mode objects.
     */
    @NotBlank
    private String categoriesDbId = "rocksdb_categories_db";

    @Valid
    @NotNull
    private Storage storage = new Storage();

    @Valid
    @NotNull
    private Locking locking = new Locking();

    @Valid
    @NotNull
    private Index index = new Index();

    @Data
    public static class Storage {
        /**
         * Directory of the RocksDB instance.
         */
        @NotBlank
        private String dataPath = "./data";
    }

    @Data
    public static class Locking {
        /**
         * Attempts to take one row lock before giving up.
         */
        @Min(1)
        private int maxAttempts = 5;

        @NotNull
        private Duration retryDelay = Duration.ofMillis(100);

        /**
         * How long a blue switch waits for a concurrent switch of the same namespace.
         */
        @NotNull
        private Duration switchLockTimeout = Duration.ofSeconds(1);
    }

    @Data
    public static class Index {
        /**
         * Initial capacity of an in-memory HNSW graph.
         */
        @Min(1)
        private int maxItems = 100_000;

        @Min(1)
        private int efSearch = 100;
    }
}
