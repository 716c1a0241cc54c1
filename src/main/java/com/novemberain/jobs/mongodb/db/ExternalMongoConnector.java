package com.novemberain.jobs.mongodb.db;

import com.mongodb.WriteConcern;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import org.bson.Document;

/**
 * Connector over a database handed in by the application, which keeps ownership of the client.
 */
public class ExternalMongoConnector implements MongoConnector {

    private final WriteConcern writeConcern;
    private final MongoDatabase database;

    public ExternalMongoConnector(WriteConcern writeConcern, MongoDatabase database) {
        this.writeConcern = writeConcern;
        this.database = database;
    }

    public ExternalMongoConnector(WriteConcern writeConcern, MongoClient mongoClient, String dbName) {
        this(writeConcern, mongoClient.getDatabase(dbName));
    }

    @Override
    public MongoCollection<Document> getCollection(String collectionName) {
        return database.getCollection(collectionName).withWriteConcern(writeConcern);
    }

    @Override
    public void close() {
        // the application closes its own client
    }
}
