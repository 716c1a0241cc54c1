package com.novemberain.jobs.mongodb;

import com.novemberain.jobs.mongodb.db.MongoConnector;
import com.novemberain.jobs.mongodb.db.MongoConnectorBuilder;
import com.novemberain.jobs.mongodb.util.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.lang.management.ManagementFactory;
import java.util.Properties;

/**
 * Assembles a {@link JobScheduler} backed by {@link MongoJobStore} from properties,
 * by default the {@value #PROPERTIES_FILE} classpath resource.
 *
 * <pre>
 * jobs.mongoUri=mongodb://localhost:27017/scheduling
 * jobs.collection=jobs
 * jobs.instanceName=worker-1
 * jobs.defaultLockLifetimeMillis=600000
 * </pre>
 */
public class JobSchedulerFactory {

    private static final Logger log = LoggerFactory.getLogger(JobSchedulerFactory.class);

    public static final String PROPERTIES_FILE = "jobs.properties";

    public static final String PROP_MONGO_URI = "jobs.mongoUri";
    public static final String PROP_ADDRESSES = "jobs.addresses";
    public static final String PROP_DB_NAME = "jobs.dbName";
    public static final String PROP_AUTH_DB_NAME = "jobs.authDbName";
    public static final String PROP_USERNAME = "jobs.username";
    public static final String PROP_PASSWORD = "jobs.password";
    public static final String PROP_COLLECTION = "jobs.collection";
    public static final String PROP_INSTANCE_NAME = "jobs.instanceName";
    public static final String PROP_DEFAULT_LOCK_LIFETIME = "jobs.defaultLockLifetimeMillis";
    public static final String PROP_WRITE_CONCERN_TIMEOUT = "jobs.writeConcernTimeoutMillis";
    public static final String PROP_WRITE_CONCERN_W = "jobs.writeConcernW";
    public static final String PROP_MAX_CONNECTIONS = "jobs.maxConnections";
    public static final String PROP_CONNECT_TIMEOUT = "jobs.connectTimeoutMillis";
    public static final String PROP_READ_TIMEOUT = "jobs.readTimeoutMillis";

    private static final int DEFAULT_WRITE_CONCERN_TIMEOUT_MILLIS = 5000;

    private final Properties props;
    private Clock clock = Clock.SYSTEM_CLOCK;

    public JobSchedulerFactory(Properties props) {
        this.props = props;
    }

    /**
     * Reads {@value #PROPERTIES_FILE} from the classpath.
     *
     * @throws JobConfigException if the resource is missing or unreadable
     */
    public static JobSchedulerFactory fromClasspath() throws JobConfigException {
        return fromClasspath(PROPERTIES_FILE);
    }

    public static JobSchedulerFactory fromClasspath(String resource) throws JobConfigException {
        Properties props = new Properties();
        try (InputStream in = JobSchedulerFactory.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new JobConfigException("Properties resource '" + resource + "' not found on classpath");
            }
            props.load(in);
        } catch (IOException e) {
            throw new JobConfigException("Could not read properties resource '" + resource + "'", e);
        }
        return new JobSchedulerFactory(props);
    }

    public JobSchedulerFactory withClock(Clock clock) {
        this.clock = clock;
        return this;
    }

    public String getInstanceName() {
        String configured = props.getProperty(PROP_INSTANCE_NAME);
        // pid@hostname
        return configured != null ? configured : ManagementFactory.getRuntimeMXBean().getName();
    }

    public String getCollectionName() {
        return props.getProperty(PROP_COLLECTION, Constants.DEFAULT_COLLECTION);
    }

    public long getDefaultLockLifetimeMillis() throws JobConfigException {
        Long configured = getLong(PROP_DEFAULT_LOCK_LIFETIME);
        return configured != null ? configured : Constants.DEFAULT_LOCK_LIFETIME_MILLIS;
    }

    /**
     * Connects to MongoDB as configured and builds the scheduler.
     */
    public JobScheduler getScheduler() throws JobConfigException {
        return getScheduler(createMongoConnector());
    }

    /**
     * Builds the scheduler on an existing connector; connection properties are ignored.
     */
    public JobScheduler getScheduler(MongoConnector mongoConnector) throws JobConfigException {
        String instanceName = getInstanceName();
        MongoJobStore jobStore = new MongoJobStore(mongoConnector, getCollectionName(), clock, instanceName);
        try {
            jobStore.ensureIndexes();
        } catch (JobStoreException e) {
            throw new JobConfigException("Cannot prepare jobs collection " + getCollectionName(), e);
        }
        log.info("Job scheduler {} uses collection {}", instanceName, getCollectionName());
        return new JobScheduler(instanceName, jobStore, clock, getDefaultLockLifetimeMillis());
    }

    MongoConnector createMongoConnector() throws JobConfigException {
        String addresses = props.getProperty(PROP_ADDRESSES);
        Integer writeConcernTimeout = getInteger(PROP_WRITE_CONCERN_TIMEOUT);
        return MongoConnectorBuilder.builder()
                .withUri(props.getProperty(PROP_MONGO_URI))
                .withAddresses(addresses != null ? addresses.split(",") : null)
                .withDatabaseName(props.getProperty(PROP_DB_NAME))
                .withAuthDatabaseName(props.getProperty(PROP_AUTH_DB_NAME))
                .withCredentials(props.getProperty(PROP_USERNAME), props.getProperty(PROP_PASSWORD))
                .withMaxConnections(getInteger(PROP_MAX_CONNECTIONS))
                .withConnectTimeoutMillis(getInteger(PROP_CONNECT_TIMEOUT))
                .withReadTimeoutMillis(getInteger(PROP_READ_TIMEOUT))
                .withWriteTimeoutMillis(writeConcernTimeout != null
                        ? writeConcernTimeout : DEFAULT_WRITE_CONCERN_TIMEOUT_MILLIS)
                .withWriteConcern(props.getProperty(PROP_WRITE_CONCERN_W))
                .build();
    }

    private Integer getInteger(String key) throws JobConfigException {
        Long value = getLong(key);
        return value != null ? Integer.valueOf(value.intValue()) : null;
    }

    private Long getLong(String key) throws JobConfigException {
        String value = props.getProperty(key);
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new JobConfigException("Property " + key + " must be a number, got '" + value + "'", e);
        }
    }
}
