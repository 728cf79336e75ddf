package tech.agencydesk.platform.scope;

import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import org.bson.BsonDocument;
import org.bson.Document;
import org.bson.conversions.Bson;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * Find query bound to one tenant.
 *
 * Unlike the driver's FindIterable, replacing the filter keeps the tenant
 * predicate: every {@link #filter(Bson)} goes through the owning collection's
 * filter merge again. The driver query is built only when results are read.
 */
public class ScopedFind {

    private final MongoCollection<Document> collection;
    private final ScopedCollection scope;

    private BsonDocument filter;
    private Bson sort;
    private Bson projection;
    private int skip;
    private int limit;

    ScopedFind(MongoCollection<Document> collection, ScopedCollection scope, Bson filter) {
        this.collection = collection;
        this.scope = scope;
        this.filter = scope.scopeFilter(filter);
    }

    /**
     * Replace the query filter. The tenant predicate is merged in again.
     */
    public ScopedFind filter(Bson filter) {
        this.filter = scope.scopeFilter(filter);
        return this;
    }

    public ScopedFind sort(Bson sort) {
        this.sort = sort;
        return this;
    }

    public ScopedFind projection(Bson projection) {
        this.projection = projection;
        return this;
    }

    public ScopedFind skip(int skip) {
        if (skip < 0) {
            throw new IllegalArgumentException("Skip cannot be negative: " + skip);
        }
        this.skip = skip;
        return this;
    }

    public ScopedFind limit(int limit) {
        this.limit = limit;
        return this;
    }

    public Document first() {
        return iterable().first();
    }

    public <A extends Collection<? super Document>> A into(A target) {
        return iterable().into(target);
    }

    public List<Document> toList() {
        return into(new ArrayList<>());
    }

    public <T> List<T> map(Function<Document, T> mapper) {
        return iterable().map(mapper::apply).into(new ArrayList<>());
    }

    private FindIterable<Document> iterable() {
        FindIterable<Document> iterable = collection.find(filter.clone());
        if (sort != null) {
            iterable = iterable.sort(sort);
        }
        if (projection != null) {
            iterable = iterable.projection(projection);
        }
        if (skip > 0) {
            iterable = iterable.skip(skip);
        }
        if (limit != 0) {
            iterable = iterable.limit(limit);
        }
        return iterable;
    }
}
