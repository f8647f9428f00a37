package com.e2eq.streamquery.mongo;

import com.e2eq.streamquery.cache.CacheStore;
import com.e2eq.streamquery.model.CacheEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.client.model.Updates;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * CacheStore over a MongoDB collection. One document per fingerprint, guarded by a unique index;
 * a TTL index on {@code expiresAt} lets the server purge stale entries. Entries past their expiry
 * read as absent even before the TTL monitor removes them.
 */
public class MongoCacheStore implements CacheStore {

    private static final Logger LOG = Logger.getLogger(MongoCacheStore.class);

    static final String FINGERPRINT_INDEX = "uniq_fingerprint";
    static final String EXPIRY_INDEX = "ttl_expires_at";

    private final MongoCollection<Document> collection;
    private final Duration ttl;
    private final ResultValues resultValues;

    public MongoCacheStore(MongoCollection<Document> collection, Duration ttl, ObjectMapper mapper) {
        this.collection = collection;
        this.ttl = ttl;
        this.resultValues = new ResultValues(mapper);
    }

    /**
     * Checks the database answers, then opens the cache collection and makes sure its indexes exist.
     *
     * @throws IllegalStateException when the database cannot be reached
     */
    public static MongoCacheStore open(MongoDatabase database, String collectionName, Duration ttl, ObjectMapper mapper) {
        try {
            database.runCommand(new Document("ping", 1));
        } catch (MongoException e) {
            throw new IllegalStateException("MongoDB database " + database.getName() + " is not usable: " + e.getMessage(), e);
        }
        MongoCacheStore store = new MongoCacheStore(database.getCollection(collectionName), ttl, mapper);
        store.ensureIndexes();
        LOG.infof("Cache store ready on %s.%s, entries live for %d ms", database.getName(), collectionName, ttl.toMillis());
        return store;
    }

    public void ensureIndexes() {
        try {
            collection.createIndex(Indexes.ascending(CacheEntryDocuments.FINGERPRINT),
                    new IndexOptions().name(FINGERPRINT_INDEX).unique(true));
            collection.createIndex(Indexes.ascending(CacheEntryDocuments.EXPIRES_AT),
                    new IndexOptions().name(EXPIRY_INDEX).expireAfter(0L, TimeUnit.SECONDS));
            LOG.debugf("Index creation successful on %s", collection.getNamespace());
        } catch (MongoException e) {
            LOG.warnf("Index creation failed on %s: %s", collection.getNamespace(), e.getMessage());
        }
    }

    @Override
    public Optional<CacheEntry> get(long fingerprint) {
        Document document = collection.find(byFingerprint(fingerprint)).first();
        if (document == null || CacheEntryDocuments.isExpired(document, Instant.now())) {
            return Optional.empty();
        }
        return Optional.of(CacheEntryDocuments.toEntry(document));
    }

    @Override
    public Optional<CacheEntry> getCompleted(long fingerprint) {
        return get(fingerprint).filter(entry -> !entry.isInProgress());
    }

    @Override
    public boolean tryBeginInProgress(long fingerprint, boolean replaceCompleted) {
        Date now = new Date();
        Bson replaceable = replaceCompleted
                ? Filters.eq(CacheEntryDocuments.IN_PROGRESS, false)
                : Filters.eq(CacheEntryDocuments.FAILED, true);
        // no match means insert, and the unique index turns a live entry into a duplicate key
        Bson claimable = Filters.and(byFingerprint(fingerprint),
                Filters.or(replaceable, Filters.lt(CacheEntryDocuments.EXPIRES_AT, now)));
        Bson claim = Updates.combine(
                Updates.set(CacheEntryDocuments.IN_PROGRESS, true),
                Updates.set(CacheEntryDocuments.FAILED, false),
                Updates.set(CacheEntryDocuments.RESULT, null),
                Updates.set(CacheEntryDocuments.EXPIRES_AT, expiry()));
        try {
            collection.updateOne(claimable, claim, new UpdateOptions().upsert(true));
            return true;
        } catch (MongoWriteException e) {
            if (ErrorCategory.fromErrorCode(e.getError().getCode()) == ErrorCategory.DUPLICATE_KEY) {
                LOG.debugf("Claim on %d lost, entry already present", fingerprint);
                return false;
            }
            throw e;
        }
    }

    @Override
    public void complete(long fingerprint, List<Object> result) {
        collection.updateOne(byFingerprint(fingerprint), Updates.combine(
                        Updates.set(CacheEntryDocuments.IN_PROGRESS, false),
                        Updates.set(CacheEntryDocuments.FAILED, false),
                        Updates.set(CacheEntryDocuments.RESULT, resultValues.normalize(result)),
                        Updates.set(CacheEntryDocuments.EXPIRES_AT, expiry())),
                new UpdateOptions().upsert(true));
    }

    @Override
    public void delete(long fingerprint) {
        collection.deleteOne(byFingerprint(fingerprint));
    }

    @Override
    public void renewExpiry(long fingerprint) {
        collection.updateOne(byFingerprint(fingerprint), Updates.set(CacheEntryDocuments.EXPIRES_AT, expiry()));
    }

    @Override
    public void markFailed(long fingerprint, Duration markerTtl) {
        collection.updateOne(byFingerprint(fingerprint), Updates.combine(
                Updates.set(CacheEntryDocuments.IN_PROGRESS, false),
                Updates.set(CacheEntryDocuments.FAILED, true),
                Updates.set(CacheEntryDocuments.RESULT, null),
                Updates.set(CacheEntryDocuments.EXPIRES_AT, Date.from(Instant.now().plus(markerTtl)))));
    }

    private static Bson byFingerprint(long fingerprint) {
        return Filters.eq(CacheEntryDocuments.FINGERPRINT, fingerprint);
    }

    private Date expiry() {
        return Date.from(Instant.now().plus(ttl));
    }
}
