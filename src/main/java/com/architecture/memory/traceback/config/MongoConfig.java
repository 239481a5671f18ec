package com.architecture.memory.traceback.config;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.AbstractMongoClientConfiguration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

import java.util.concurrent.TimeUnit;

/**
 * Mongo holds ingestion sync metadata only.
 */
@Configuration
@EnableMongoRepositories(basePackages = "com.architecture.memory.traceback.repository")
public class MongoConfig extends AbstractMongoClientConfiguration {

    @Value("${spring.data.mongodb.uri}")
    private String uri;

    @Value("${spring.data.mongodb.database}")
    private String database;

    @Override
    protected String getDatabaseName() {
        return database;
    }

    @Override
    public MongoClient mongoClient() {
        MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(uri))
                .applyToConnectionPoolSettings(builder ->
                    builder.maxConnectionIdleTime(60, TimeUnit.SECONDS)
                           .maxSize(20)
                           .minSize(2))
                .applyToSocketSettings(builder ->
                    builder.connectTimeout(10, TimeUnit.SECONDS)
                           .readTimeout(30, TimeUnit.SECONDS))
                .build();
        return MongoClients.create(settings);
    }
}
