package com.e2eq.streamquery.mongo;

import com.e2eq.streamquery.source.CursorRequest;
import com.e2eq.streamquery.source.DocumentCursor;
import com.e2eq.streamquery.source.DocumentSource;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import org.bson.Document;

import java.util.Map;

/**
 * Streams a MongoDB collection sorted by {@code _id}, one driver batch at a time.
 */
public class MongoDocumentSource implements DocumentSource {

    private final MongoCollection<Document> collection;

    public MongoDocumentSource(MongoCollection<Document> collection) {
        this.collection = collection;
    }

    @Override
    public String name() {
        return collection.getNamespace().getCollectionName();
    }

    @Override
    public DocumentCursor open(CursorRequest request) {
        FindIterable<Document> find = collection.find(new Document(request.filter()))
                .sort(new Document("_id", request.order().direction()))
                .batchSize(request.batchSize());
        return new MongoDocumentCursor(MongoReadOptions.apply(find, request.readOptions()).iterator());
    }

    @Override
    public void validateReadOptions(Map<String, Object> readOptions) {
        MongoReadOptions.validate(readOptions);
    }

    static final class MongoDocumentCursor implements DocumentCursor {

        private final MongoCursor<Document> cursor;
        private volatile boolean closed;

        MongoDocumentCursor(MongoCursor<Document> cursor) {
            this.cursor = cursor;
        }

        @Override
        public boolean hasNext() {
            return !closed && cursor.hasNext();
        }

        @Override
        public Map<String, Object> next() {
            return cursor.next();
        }

        @Override
        public void cancel() {
            close();
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                cursor.close();
            }
        }
    }
}
