package com.embeddingstudio.vectordb.storage.config;

import com.embeddingstudio.vectordb.storage.kv.RocksDbStore;
import com.embeddingstudio.vectordb.storage.metadata.CollectionMetadataStore;
import com.embeddingstudio.vectordb.storage.metadata.RocksDbCollectionMetadataStore;
import com.embeddingstudio.vectordb.storage.vectordb.VectorDb;
import com.embeddingstudio.vectordb.storage.vectordb.VectorDbFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Wires the storage engine and the two vector DB namespaces: general objects and categories.
 */
@Configuration
@EnableConfigurationProperties(VectorDbProperties.class)
@RequiredArgsConstructor
public class VectorDbConfig {

    private final VectorDbProperties properties;

    @Bean(destroyMethod = "close")
    public RocksDbStore rocksDbStore() {
        return new RocksDbStore(properties.getStorage().getDataPath());
    }

    @Bean
    public CollectionMetadataStore collectionMetadataStore(RocksDbStore rocksDbStore) {
        return new RocksDbCollectionMetadataStore(rocksDbStore, properties.getLocking().getSwitchLockTimeout());
    }

    @Bean
    public VectorDbFactory vectorDbFactory(RocksDbStore rocksDbStore, CollectionMetadataStore collectionMetadataStore) {
        return new VectorDbFactory(rocksDbStore, collectionMetadataStore, properties);
    }

    @Bean
    @Primary
    public VectorDb vectorDb(VectorDbFactory vectorDbFactory) {
        return vectorDbFactory.create(properties.getDbId());
    }

    @Bean
    @Qualifier("categoriesVectorDb")
    public VectorDb categoriesVectorDb(VectorDbFactory vectorDbFactory) {
        return vectorDbFactory.create(properties.getCategoriesDbId());
    }
}
