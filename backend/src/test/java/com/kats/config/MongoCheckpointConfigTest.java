package com.kats.config;

import com.kats.KatsApplication;
import com.kats.domain.CheckpointRepository;
import com.mongodb.client.MongoClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import static org.assertj.core.api.Assertions.assertThat;

class MongoCheckpointConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(DomainPackage.class, MongoCheckpointConfig.class)
            .withPropertyValues("spring.data.mongodb.uri=mongodb://localhost:27017/kats");

    @Test
    @DisplayName("default nats checkpoint store builds no Mongo client")
    void natsStore_noMongoBeans() {
        contextRunner.run(context -> {
            assertThat(context).doesNotHaveBean(MongoClient.class);
            assertThat(context).doesNotHaveBean(MongoTemplate.class);
            assertThat(context).doesNotHaveBean(CheckpointRepository.class);
        });
        contextRunner.withPropertyValues("kats.checkpoint.store=nats")
                .run(context -> assertThat(context).doesNotHaveBean(MongoClient.class));
    }

    @Test
    @DisplayName("mongo checkpoint store brings up client and template")
    void mongoStore_mongoBeans() {
        contextRunner.withPropertyValues("kats.checkpoint.store=mongo")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(MongoClient.class);
                    assertThat(context).hasSingleBean(MongoTemplate.class);
                    assertThat(context).hasSingleBean(CheckpointRepository.class);
                });
    }

    @Test
    @DisplayName("application excludes Mongo auto-configuration by default")
    void applicationExcludesMongoAutoConfiguration() {
        SpringBootApplication app = KatsApplication.class.getAnnotation(SpringBootApplication.class);

        assertThat(app.exclude()).contains(MongoAutoConfiguration.class);
    }

    /** Stands in for the application's auto-configuration package so repositories are found. */
    @Configuration
    @AutoConfigurationPackage(basePackageClasses = CheckpointRepository.class)
    static class DomainPackage {
    }
}
