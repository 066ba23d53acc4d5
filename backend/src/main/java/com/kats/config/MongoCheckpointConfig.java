package com.kats.config;

import com.kats.ingestion.config.CheckpointProperties;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.data.mongo.MongoRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.context.annotation.Configuration;

/**
 * Mongo client, template and repositories, loaded only for {@code kats.checkpoint.store=mongo}.
 */
@Configuration
@ConditionalOnProperty(prefix = "kats.checkpoint", name = "store", havingValue = CheckpointProperties.STORE_MONGO)
@ImportAutoConfiguration({
        MongoAutoConfiguration.class,
        MongoDataAutoConfiguration.class,
        MongoRepositoriesAutoConfiguration.class
})
public class MongoCheckpointConfig {
}
