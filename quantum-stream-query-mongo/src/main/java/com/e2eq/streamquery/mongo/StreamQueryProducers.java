package com.e2eq.streamquery.mongo;

import com.e2eq.streamquery.StreamQuery;
import com.e2eq.streamquery.cache.CacheStore;
import com.e2eq.streamquery.coordinator.CoordinatorSettings;
import com.e2eq.streamquery.coordinator.QueryCoordinator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClient;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class StreamQueryProducers {

    private static final Logger LOG = Logger.getLogger(StreamQueryProducers.class);

    @Inject
    MongoClient mongoClient;

    @Inject
    StreamQueryConfig config;

    @ConfigProperty(name = "quarkus.mongodb.database")
    String databaseName;

    @Produces
    @DefaultBean
    @Singleton
    public CacheStore cacheStore() {
        return MongoCacheStore.open(mongoClient.getDatabase(databaseName), config.cacheCollection(),
                config.toSettings().getCacheTtl(), new ObjectMapper());
    }

    @Produces
    @DefaultBean
    @Singleton
    public QueryCoordinator queryCoordinator(CacheStore cacheStore) {
        CoordinatorSettings settings = config.toSettings();
        LOG.infof("Building QueryCoordinator: %s", settings);
        return new QueryCoordinator(cacheStore, settings);
    }

    void closeQueryCoordinator(@Disposes QueryCoordinator coordinator) {
        coordinator.close();
    }

    @Produces
    @DefaultBean
    @Singleton
    public StreamQuery streamQuery(QueryCoordinator coordinator) {
        return new StreamQuery(coordinator);
    }
}
