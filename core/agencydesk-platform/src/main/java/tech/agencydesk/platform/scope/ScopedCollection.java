package tech.agencydesk.platform.scope;

import com.mongodb.client.AggregateIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Aggregates;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.InsertManyOptions;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.InsertManyResult;
import com.mongodb.client.result.InsertOneResult;
import com.mongodb.client.result.UpdateResult;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.bson.Document;
import org.bson.conversions.Bson;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A MongoDB collection handle bound to a single tenant.
 *
 * Rewrites every call before it reaches the raw collection:
 * <ul>
 *   <li>filters are merged with {@code {scopeField: tenantId}}, the tenant value always wins</li>
 *   <li>inserted documents get {@code scopeField} set to the tenant id</li>
 *   <li>update documents cannot touch {@code scopeField}; it is pinned to the tenant id</li>
 *   <li>aggregation pipelines get a {@code $match} on the tenant prepended as a new first stage</li>
 * </ul>
 *
 * Documents that lack the scope field never match, so records written outside
 * this layer are invisible rather than shared. Store errors propagate unchanged.
 *
 * Only the first pipeline stage is scoped. {@code $lookup}, {@code $graphLookup}
 * and {@code $unionWith} read the other collection unscoped, and {@code $merge}
 * or {@code $out} write without stamping. Pipelines that use them must filter
 * the joined collection by tenant themselves.
 */
public class ScopedCollection {

    private final MongoCollection<Document> collection;
    private final String scopeField;
    private final String tenantId;

    public ScopedCollection(MongoCollection<Document> collection, String scopeField, String tenantId) {
        this.collection = Objects.requireNonNull(collection, "collection");
        this.scopeField = Objects.requireNonNull(scopeField, "scopeField");
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId");
    }

    public String name() {
        return collection.getNamespace().getCollectionName();
    }

    public String scopeField() {
        return scopeField;
    }

    public String tenantId() {
        return tenantId;
    }

    // Reads

    public Document findOne(Bson filter) {
        return collection.find(scopeFilter(filter)).first();
    }

    /**
     * Find matching documents. The returned query can be sorted, limited,
     * projected and refiltered by the caller without losing the tenant predicate.
     */
    public ScopedFind find(Bson filter) {
        return new ScopedFind(collection, this, filter);
    }

    public ScopedFind find() {
        return find(null);
    }

    public long count(Bson filter) {
        return collection.countDocuments(scopeFilter(filter));
    }

    public AggregateIterable<Document> aggregate(List<? extends Bson> pipeline) {
        return collection.aggregate(scopePipeline(pipeline));
    }

    // Writes

    public InsertOneResult insertOne(Document document) {
        return collection.insertOne(stamp(document));
    }

    public InsertManyResult insertMany(List<Document> documents) {
        return insertMany(documents, new InsertManyOptions());
    }

    public InsertManyResult insertMany(List<Document> documents, InsertManyOptions options) {
        documents.forEach(this::stamp);
        return collection.insertMany(documents, options);
    }

    public UpdateResult updateOne(Bson filter, Bson update) {
        return updateOne(filter, update, new UpdateOptions());
    }

    public UpdateResult updateOne(Bson filter, Bson update, UpdateOptions options) {
        return collection.updateOne(scopeFilter(filter), scopeUpdate(update), options);
    }

    public UpdateResult updateMany(Bson filter, Bson update) {
        return updateMany(filter, update, new UpdateOptions());
    }

    public UpdateResult updateMany(Bson filter, Bson update, UpdateOptions options) {
        return collection.updateMany(scopeFilter(filter), scopeUpdate(update), options);
    }

    public Document findOneAndUpdate(Bson filter, Bson update) {
        return findOneAndUpdate(filter, update, new FindOneAndUpdateOptions());
    }

    public Document findOneAndUpdate(Bson filter, Bson update, FindOneAndUpdateOptions options) {
        return collection.findOneAndUpdate(scopeFilter(filter), scopeUpdate(update), options);
    }

    public DeleteResult deleteOne(Bson filter) {
        return collection.deleteOne(scopeFilter(filter));
    }

    public DeleteResult deleteMany(Bson filter) {
        return collection.deleteMany(scopeFilter(filter));
    }

    // Rewriting

    /**
     * Merge the caller's filter with the tenant predicate.
     * A caller-supplied value for the scope field is overwritten, never honoured.
     */
    BsonDocument scopeFilter(Bson filter) {
        BsonDocument merged = toBsonDocument(filter);
        merged.put(scopeField, tenantValue());
        return merged;
    }

    /**
     * Remove the scope field from every update operator and pin it to the tenant id.
     * Matched documents already carry that value; upserted documents receive it.
     */
    BsonDocument scopeUpdate(Bson update) {
        Objects.requireNonNull(update, "update");
        BsonDocument scoped = toBsonDocument(update);
        for (Map.Entry<String, BsonValue> operator : scoped.entrySet()) {
            if (operator.getKey().startsWith("$") && operator.getValue().isDocument()) {
                BsonDocument fields = operator.getValue().asDocument();
                fields.keySet().removeIf(this::touchesScopeField);
                if (operator.getKey().equals("$rename")) {
                    fields.values().removeIf(target -> target.isString() && touchesScopeField(target.asString().getValue()));
                }
            }
        }
        scoped.entrySet().removeIf(operator -> operator.getValue().isDocument()
            && operator.getValue().asDocument().isEmpty());

        BsonValue set = scoped.get("$set");
        BsonDocument setOperator = set != null && set.isDocument() ? set.asDocument() : new BsonDocument();
        setOperator.put(scopeField, tenantValue());
        scoped.put("$set", setOperator);
        return scoped;
    }

    /**
     * Prepend a tenant {@code $match} stage. Existing stages are left untouched,
     * including a leading {@code $match}.
     */
    List<Bson> scopePipeline(List<? extends Bson> pipeline) {
        List<Bson> scoped = new ArrayList<>(pipeline.size() + 1);
        scoped.add(Aggregates.match(new BsonDocument(scopeField, tenantValue())));
        scoped.addAll(pipeline);
        return scoped;
    }

    private Document stamp(Document document) {
        document.put(scopeField, tenantId);
        return document;
    }

    private boolean touchesScopeField(String path) {
        return path.equals(scopeField) || path.startsWith(scopeField + ".");
    }

    private BsonValue tenantValue() {
        return new BsonString(tenantId);
    }

    private BsonDocument toBsonDocument(Bson bson) {
        if (bson == null) {
            return new BsonDocument();
        }
        // Copy so the caller's filter object is never mutated
        return bson.toBsonDocument(BsonDocument.class, collection.getCodecRegistry()).clone();
    }
}
