package com.e2eq.streamquery.mongo;

import com.mongodb.client.MongoClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Hands out document sources for collections of the configured database.
 */
@ApplicationScoped
public class MongoDocumentSources {

    @Inject
    MongoClient mongoClient;

    @ConfigProperty(name = "quarkus.mongodb.database")
    String databaseName;

    public MongoDocumentSource forCollection(String collectionName) {
        return new MongoDocumentSource(mongoClient.getDatabase(databaseName).getCollection(collectionName));
    }
}
