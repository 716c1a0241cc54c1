package com.novemberain.jobs.mongodb.db;

import com.mongodb.WriteConcern;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import org.bson.Document;
import org.junit.Test;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

public class ExternalMongoConnectorTest {

    @Test
    @SuppressWarnings("unchecked")
    public void testCollectionsUseWriteConcern() {
        MongoDatabase database = mock(MongoDatabase.class);
        MongoCollection<Document> collection = mock(MongoCollection.class);
        MongoCollection<Document> acknowledged = mock(MongoCollection.class);
        when(database.getCollection("jobs")).thenReturn(collection);
        when(collection.withWriteConcern(WriteConcern.MAJORITY)).thenReturn(acknowledged);

        MongoConnector connector = new ExternalMongoConnector(WriteConcern.MAJORITY, database);

        assertSame(acknowledged, connector.getCollection("jobs"));
    }

    @Test
    public void testCloseLeavesClientOpen() throws Exception {
        MongoClient client = mock(MongoClient.class);
        when(client.getDatabase("scheduling")).thenReturn(mock(MongoDatabase.class));

        MongoConnector connector = new ExternalMongoConnector(WriteConcern.W1, client, "scheduling");
        connector.close();

        verify(client).getDatabase("scheduling");
        verify(client, never()).close();
    }
}
