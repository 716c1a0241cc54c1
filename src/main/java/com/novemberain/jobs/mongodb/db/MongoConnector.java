package com.novemberain.jobs.mongodb.db;

import com.mongodb.client.MongoCollection;
import org.bson.Document;

import java.io.Closeable;

/**
 * Source of the collections jobs are stored in.
 */
public interface MongoConnector extends Closeable {

    /**
     * @param collectionName collection name
     * @return collection configured with the write concern jobs need
     */
    MongoCollection<Document> getCollection(String collectionName);

    /**
     * Releases the client if this connector created it.
     */
    @Override
    void close();
}
