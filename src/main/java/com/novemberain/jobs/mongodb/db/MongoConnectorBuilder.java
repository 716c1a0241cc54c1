package com.novemberain.jobs.mongodb.db;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.ServerAddress;
import com.mongodb.WriteConcern;
import com.novemberain.jobs.mongodb.JobConfigException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Builds the connector a job scheduler opens for itself from the {@code jobs.*}
 * connection properties.
 *
 * <p>The server is given either as a {@code mongodb://} URI or as seed addresses with
 * optional credentials. Jobs go to the database named explicitly or, failing that, to
 * the one in the URI path. Writes are acknowledged by a majority of the replica set
 * and journaled unless another write concern is named, so a claimed lock survives
 * a failover.</p>
 *
 * <p>An application that already holds a {@code MongoDatabase} wraps it in an
 * {@link ExternalMongoConnector} instead.</p>
 */
public class MongoConnectorBuilder {

    private String uri;
    private final List<String> addresses = new ArrayList<>();
    private String databaseName;
    private String authDatabaseName;
    private String username;
    private String password;
    private Integer maxConnections;
    private Integer connectTimeoutMillis;
    private Integer readTimeoutMillis;
    private Integer writeTimeoutMillis;
    private String writeConcernName;

    private MongoConnectorBuilder() {
    }

    public static MongoConnectorBuilder builder() {
        return new MongoConnectorBuilder();
    }

    /**
     * @throws JobConfigException if the server, the database or the credentials are missing
     *                            or contradict each other, or the driver rejects the settings
     */
    public MongoConnector build() throws JobConfigException {
        if (uri != null && !addresses.isEmpty()) {
            throw new JobConfigException("Give either a MongoDB URI or server addresses, not both.");
        }
        if (uri == null && addresses.isEmpty()) {
            throw new JobConfigException("A MongoDB URI or at least one server address is required.");
        }
        ConnectionString connectionString = uri != null ? parseUri() : null;

        String jobsDatabase = databaseName;
        if (jobsDatabase == null && connectionString != null) {
            jobsDatabase = connectionString.getDatabase();
        }
        if (jobsDatabase == null) {
            throw new JobConfigException("No database for jobs: set a database name or put one in the URI path.");
        }

        WriteConcern writeConcern = writeConcern();
        if (connectionString != null) {
            if (username != null || password != null || authDatabaseName != null) {
                throw new JobConfigException("Credentials go into the URI when a URI is used.");
            }
            return InternalMongoConnector.fromUri(writeConcern, uri, jobsDatabase, clientSettings());
        }
        return InternalMongoConnector.fromAddresses(writeConcern, seeds(), credential(jobsDatabase),
                jobsDatabase, clientSettings());
    }

    private ConnectionString parseUri() throws JobConfigException {
        try {
            return new ConnectionString(uri);
        } catch (IllegalArgumentException e) {
            throw new JobConfigException("Invalid MongoDB URI: " + e.getMessage(), e);
        }
    }

    private List<ServerAddress> seeds() {
        List<ServerAddress> seeds = new ArrayList<>(addresses.size());
        for (String address : addresses) {
            seeds.add(new ServerAddress(address));
        }
        return seeds;
    }

    private MongoCredential credential(String jobsDatabase) throws JobConfigException {
        if (username == null && password == null) {
            return null;
        }
        if (username == null || password == null) {
            throw new JobConfigException("Username and password must be given together.");
        }
        String source = authDatabaseName != null ? authDatabaseName : jobsDatabase;
        return MongoCredential.createCredential(username, source, password.toCharArray());
    }

    WriteConcern writeConcern() throws JobConfigException {
        WriteConcern writeConcern = WriteConcern.MAJORITY;
        if (writeConcernName != null) {
            writeConcern = WriteConcern.valueOf(writeConcernName);
            if (writeConcern == null) {
                throw new JobConfigException("Unknown write concern '" + writeConcernName + "'.");
            }
        }
        if (writeTimeoutMillis != null) {
            writeConcern = writeConcern.withWTimeout(writeTimeoutMillis, TimeUnit.MILLISECONDS);
        }
        return writeConcern.withJournal(true);
    }

    private MongoClientSettings.Builder clientSettings() {
        MongoClientSettings.Builder settings = MongoClientSettings.builder();
        if (maxConnections != null) {
            settings.applyToConnectionPoolSettings(pool -> pool.maxSize(maxConnections));
        }
        settings.applyToSocketSettings(socket -> {
            if (connectTimeoutMillis != null) {
                socket.connectTimeout(connectTimeoutMillis, TimeUnit.MILLISECONDS);
            }
            if (readTimeoutMillis != null) {
                socket.readTimeout(readTimeoutMillis, TimeUnit.MILLISECONDS);
            }
        });
        return settings;
    }

    public MongoConnectorBuilder withUri(String uri) {
        this.uri = uri;
        return this;
    }

    /**
     * @param addresses {@code host[:port]} entries, blank ones are skipped
     */
    public MongoConnectorBuilder withAddresses(String... addresses) {
        this.addresses.clear();
        if (addresses != null) {
            for (String address : addresses) {
                if (address != null && !address.trim().isEmpty()) {
                    this.addresses.add(address.trim());
                }
            }
        }
        return this;
    }

    public MongoConnectorBuilder withDatabaseName(String databaseName) {
        this.databaseName = databaseName;
        return this;
    }

    /**
     * Database holding the user, when it is not the jobs database (often {@code admin}).
     */
    public MongoConnectorBuilder withAuthDatabaseName(String authDatabaseName) {
        this.authDatabaseName = authDatabaseName;
        return this;
    }

    public MongoConnectorBuilder withCredentials(String username, String password) {
        this.username = username;
        this.password = password;
        return this;
    }

    public MongoConnectorBuilder withMaxConnections(Integer maxConnections) {
        this.maxConnections = maxConnections;
        return this;
    }

    public MongoConnectorBuilder withConnectTimeoutMillis(Integer connectTimeoutMillis) {
        this.connectTimeoutMillis = connectTimeoutMillis;
        return this;
    }

    public MongoConnectorBuilder withReadTimeoutMillis(Integer readTimeoutMillis) {
        this.readTimeoutMillis = readTimeoutMillis;
        return this;
    }

    public MongoConnectorBuilder withWriteTimeoutMillis(Integer writeTimeoutMillis) {
        this.writeTimeoutMillis = writeTimeoutMillis;
        return this;
    }

    /**
     * @param writeConcernName a {@link WriteConcern} constant such as {@code W1} or {@code MAJORITY}
     */
    public MongoConnectorBuilder withWriteConcern(String writeConcernName) {
        this.writeConcernName = writeConcernName;
        return this;
    }
}
