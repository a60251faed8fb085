package com.pickalert.infrastructure.persistence;

import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.Updates;
import com.pickalert.domain.model.Registration;
import com.pickalert.domain.ports.RegistrationStore;
import com.pickalert.domain.ports.RegistrationStoreException;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Optional;

/**
 * MongoDB implementation of RegistrationStore. One document per draft, keyed by draft id.
 *
 * <p>Writes are plain field updates with no version check; overlapping cycles on the same draft
 * resolve as last writer wins.</p>
 */
@Repository
public class MongoRegistrationStore implements RegistrationStore {

    private static final Logger logger = LoggerFactory.getLogger(MongoRegistrationStore.class);

    static final String FIELD_ID = "_id";
    static final String FIELD_CHANNEL_ID = "channelId";
    static final String FIELD_LAST_KNOWN_PICK_COUNT = "lastKnownPickCount";
    static final String FIELD_REGISTERED_AT = "registeredAt";
    static final String FIELD_UPDATED_AT = "updatedAt";

    private final MongoClient mongoClient;
    private final String databaseName;
    private final String collectionName;

    public MongoRegistrationStore(
            MongoClient mongoClient,
            @Value("${mongodb.database:pickalert}") String databaseName,
            @Value("${mongodb.registrations-collection:draft_registrations}") String collectionName) {
        this.mongoClient = mongoClient;
        this.databaseName = databaseName;
        this.collectionName = collectionName;

        initializeIndexes();
    }

    private void initializeIndexes() {
        try {
            // A channel follows at most one draft
            collection().createIndex(
                Indexes.ascending(FIELD_CHANNEL_ID),
                new IndexOptions().unique(true).background(true)
            );
            logger.info("MongoDB indexes initialized for collection: {}", collectionName);
        } catch (Exception e) {
            logger.warn("Failed to create indexes (may already exist): {}", e.getMessage());
        }
    }

    private MongoCollection<Document> collection() {
        return mongoClient.getDatabase(databaseName).getCollection(collectionName);
    }

    @Override
    public Optional<Registration> find(String draftId) {
        try {
            Document doc = collection().find(Filters.eq(FIELD_ID, draftId)).first();
            return Optional.ofNullable(doc).map(MongoRegistrationStore::toRegistration);
        } catch (MongoException e) {
            throw new RegistrationStoreException("Failed to load registration for draft " + draftId, e);
        }
    }

    @Override
    public void setLastKnownCount(String draftId, int count) {
        try {
            var result = collection().updateOne(
                Filters.eq(FIELD_ID, draftId),
                Updates.combine(
                    Updates.set(FIELD_LAST_KNOWN_PICK_COUNT, count),
                    Updates.set(FIELD_UPDATED_AT, Date.from(Instant.now()))
                )
            );
            if (result.getMatchedCount() == 0) {
                logger.warn("Draft {} was unregistered before its count {} could be stored", draftId, count);
            }
        } catch (MongoException e) {
            throw new RegistrationStoreException("Failed to store pick count " + count + " for draft " + draftId, e);
        }
    }

    @Override
    public List<Registration> findAll() {
        try {
            List<Registration> registrations = new ArrayList<>();
            collection().find().forEach(doc -> registrations.add(toRegistration(doc)));
            return registrations;
        } catch (MongoException e) {
            throw new RegistrationStoreException("Failed to list registrations", e);
        }
    }

    @Override
    public Optional<Registration> findByChannel(String channelId) {
        try {
            Document doc = collection().find(Filters.eq(FIELD_CHANNEL_ID, channelId)).first();
            return Optional.ofNullable(doc).map(MongoRegistrationStore::toRegistration);
        } catch (MongoException e) {
            throw new RegistrationStoreException("Failed to load registration for channel " + channelId, e);
        }
    }

    @Override
    public Registration register(String draftId, String channelId, int initialCount) {
        Registration registration = new Registration(draftId, channelId, initialCount);
        try {
            MongoCollection<Document> collection = collection();
            var removed = collection.deleteMany(Filters.and(
                Filters.eq(FIELD_CHANNEL_ID, channelId),
                Filters.ne(FIELD_ID, draftId)
            ));
            if (removed.getDeletedCount() > 0) {
                logger.info("Replaced {} draft(s) previously registered to channel {}", removed.getDeletedCount(), channelId);
            }

            Date now = Date.from(Instant.now());
            Document doc = new Document(FIELD_ID, draftId)
                .append(FIELD_CHANNEL_ID, channelId)
                .append(FIELD_LAST_KNOWN_PICK_COUNT, initialCount)
                .append(FIELD_REGISTERED_AT, now)
                .append(FIELD_UPDATED_AT, now);
            collection.replaceOne(Filters.eq(FIELD_ID, draftId), doc, new ReplaceOptions().upsert(true));
            return registration;
        } catch (MongoException e) {
            throw new RegistrationStoreException("Failed to register draft " + draftId, e);
        }
    }

    @Override
    public boolean unregister(String draftId) {
        try {
            return collection().deleteOne(Filters.eq(FIELD_ID, draftId)).getDeletedCount() > 0;
        } catch (MongoException e) {
            throw new RegistrationStoreException("Failed to unregister draft " + draftId, e);
        }
    }

    private static Registration toRegistration(Document doc) {
        Number count = doc.get(FIELD_LAST_KNOWN_PICK_COUNT, Number.class);
        return new Registration(
            doc.getString(FIELD_ID),
            doc.getString(FIELD_CHANNEL_ID),
            count != null ? count.intValue() : 0
        );
    }
}
