package com.pickalert.infrastructure.persistence;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.ReplaceOptions;
import com.pickalert.domain.model.PlayerMapping;
import com.pickalert.domain.ports.NameResolver;
import org.bson.Document;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Sleeper user to Slack member mappings stored in MongoDB.
 */
@Repository
public class MongoPlayerDirectory implements NameResolver {

    private final MongoClient mongoClient;
    private final String databaseName;
    private final String collectionName;

    public MongoPlayerDirectory(
            MongoClient mongoClient,
            @Value("${mongodb.database:pickalert}") String databaseName,
            @Value("${mongodb.players-collection:player_mappings}") String collectionName) {
        this.mongoClient = mongoClient;
        this.databaseName = databaseName;
        this.collectionName = collectionName;
    }

    private MongoCollection<Document> collection() {
        return mongoClient.getDatabase(databaseName).getCollection(collectionName);
    }

    public Optional<PlayerMapping> find(String externalId) {
        if (externalId == null) {
            return Optional.empty();
        }
        Document doc = collection().find(Filters.eq("_id", externalId)).first();
        if (doc == null) {
            return Optional.empty();
        }
        return Optional.of(new PlayerMapping(
            doc.getString("_id"),
            doc.getString("memberId"),
            doc.getString("displayName")
        ));
    }

    /**
     * Stores or replaces a mapping. The display name falls back to the member id.
     */
    public PlayerMapping save(String externalId, String memberId, String displayName) {
        String name = displayName == null || displayName.isBlank() ? memberId : displayName;
        Document doc = new Document("_id", externalId)
            .append("memberId", memberId)
            .append("displayName", name);
        collection().replaceOne(Filters.eq("_id", externalId), doc, new ReplaceOptions().upsert(true));
        return new PlayerMapping(externalId, memberId, name);
    }

    @Override
    public Optional<String> resolve(String externalId) {
        return find(externalId).map(mapping ->
            mapping.displayName() != null ? mapping.displayName() : mapping.memberId());
    }

    @Override
    public Optional<String> resolveMention(String externalId) {
        return find(externalId)
            .filter(mapping -> mapping.memberId() != null && !mapping.memberId().isBlank())
            .map(mapping -> "<@" + mapping.memberId() + ">");
    }
}
