package com.example.docstandards.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableReactiveMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableReactiveMongoRepositories;

@Configuration
@EnableReactiveMongoRepositories(basePackages = {
        "com.example.docstandards.folder.repository",
        "com.example.docstandards.standard.repository",
        "com.example.docstandards.validation.repository"
})
@EnableReactiveMongoAuditing
public class MongoConfig {
    // Job queue and audit ledger indexes come from their @Indexed / @CompoundIndex mappings
}
