package com.kats;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.data.mongo.MongoRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

/**
 * Krist ledger to NATS JetStream bridge. Mongo is wired by {@link com.kats.config.MongoCheckpointConfig}
 * only when it holds the checkpoints.
 */
@SpringBootApplication(exclude = {
        MongoAutoConfiguration.class,
        MongoDataAutoConfiguration.class,
        MongoRepositoriesAutoConfiguration.class
})
public class KatsApplication {

    public static void main(String[] args) {
        SpringApplication.run(KatsApplication.class, args);
    }
}
