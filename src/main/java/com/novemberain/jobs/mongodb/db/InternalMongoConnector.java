package com.novemberain.jobs.mongodb.db;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.MongoException;
import com.mongodb.ServerAddress;
import com.mongodb.WriteConcern;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.novemberain.jobs.mongodb.JobConfigException;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Connector that creates its own {@link MongoClient} and closes it on {@link #close()}.
 */
public class InternalMongoConnector implements MongoConnector {

    private static final Logger log = LoggerFactory.getLogger(InternalMongoConnector.class);

    private final WriteConcern writeConcern;
    private final MongoClient mongoClient;
    private final MongoDatabase database;

    InternalMongoConnector(WriteConcern writeConcern, MongoClient mongoClient, String dbName) {
        this.writeConcern = writeConcern;
        this.mongoClient = mongoClient;
        this.database = mongoClient.getDatabase(dbName);
    }

    /**
     * Connects using a {@code mongodb://} URI. Settings from the URI override {@code settingsBuilder}.
     *
     * @throws JobConfigException if the URI is malformed or the driver rejects the settings
     */
    public static InternalMongoConnector fromUri(WriteConcern writeConcern, String uri, String dbName,
                                                 MongoClientSettings.Builder settingsBuilder)
            throws JobConfigException {
        ConnectionString connectionString;
        try {
            connectionString = new ConnectionString(uri);
        } catch (IllegalArgumentException | MongoException e) {
            throw new JobConfigException("Invalid MongoDB connection URI.", e);
        }
        return new InternalMongoConnector(writeConcern,
                createClient(settingsBuilder.applyConnectionString(connectionString)), dbName);
    }

    /**
     * Connects to an explicit list of servers.
     *
     * @param credential may be {@code null} for unauthenticated access
     * @throws JobConfigException if the driver rejects the settings
     */
    public static InternalMongoConnector fromAddresses(WriteConcern writeConcern, List<ServerAddress> seeds,
                                                       MongoCredential credential, String dbName,
                                                       MongoClientSettings.Builder settingsBuilder)
            throws JobConfigException {
        settingsBuilder.applyToClusterSettings(builder -> builder.hosts(seeds));
        if (credential != null) {
            settingsBuilder.credential(credential);
        }
        return new InternalMongoConnector(writeConcern, createClient(settingsBuilder), dbName);
    }

    @Override
    public MongoCollection<Document> getCollection(String collectionName) {
        return database.getCollection(collectionName).withWriteConcern(writeConcern);
    }

    @Override
    public void close() {
        log.info("Closing MongoDB client of database {}", database.getName());
        mongoClient.close();
    }

    private static MongoClient createClient(MongoClientSettings.Builder settingsBuilder) throws JobConfigException {
        try {
            return MongoClients.create(settingsBuilder.build());
        } catch (MongoException | IllegalArgumentException e) {
            throw new JobConfigException("MongoDB driver threw an exception.", e);
        }
    }
}
