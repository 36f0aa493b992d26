package io.github.drompincen.sprintplanner.gateway.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Multi-document transactions need a replica set. Single-node development
 * databases set {@code planner.mongo.transactions-enabled=false}.
 */
@Configuration
public class MongoTransactionConfig {

    private static final Logger log = LoggerFactory.getLogger(MongoTransactionConfig.class);

    @Bean
    MongoTransactionManager transactionManager(MongoDatabaseFactory databaseFactory) {
        return new MongoTransactionManager(databaseFactory);
    }

    @Bean
    TransactionOperations transactionOperations(MongoTransactionManager transactionManager,
                                                @Value("${planner.mongo.transactions-enabled:true}") boolean enabled) {
        if (!enabled) {
            log.warn("[Mongo] transactions disabled, multi-step writes are not atomic");
            return TransactionOperations.withoutTransaction();
        }
        return new TransactionTemplate(transactionManager);
    }
}
