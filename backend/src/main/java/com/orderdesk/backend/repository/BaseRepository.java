package com.orderdesk.backend.repository;

import com.orderdesk.backend.pagination.PaginateOptions;
import com.orderdesk.backend.pagination.PaginatedResult;
import com.orderdesk.backend.pagination.PaginationSource;
import com.orderdesk.backend.pagination.Paginator;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.GroupOperation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.UpdateDefinition;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Shared verb set for every entity repository. Arguments are MongoDB's own
 * query shapes and are handed to {@link MongoTemplate} as they are; errors
 * from the driver propagate untouched.
 *
 * @param <T> the mapped document type
 */
public abstract class BaseRepository<T> implements PaginationSource<T> {

    protected final MongoTemplate mongoTemplate;
    private final Paginator paginator;
    private final Class<T> entityClass;

    protected BaseRepository(MongoTemplate mongoTemplate, Paginator paginator, Class<T> entityClass) {
        this.mongoTemplate = mongoTemplate;
        this.paginator = paginator;
        this.entityClass = entityClass;
    }

    public Optional<T> findUnique(String id) {
        return Optional.ofNullable(mongoTemplate.findById(id, entityClass));
    }

    public Optional<T> findUnique(Query query) {
        return Optional.ofNullable(mongoTemplate.findOne(query, entityClass));
    }

    public T findUniqueOrThrow(Query query) {
        return findUnique(query).orElseThrow(() -> new EmptyResultDataAccessException(
                "No " + entityClass.getSimpleName() + " matches " + query, 1));
    }

    public Optional<T> findFirst(Query query) {
        return Optional.ofNullable(mongoTemplate.findOne(Query.of(query).limit(1), entityClass));
    }

    public T findFirstOrThrow(Query query) {
        return findFirst(query).orElseThrow(() -> new EmptyResultDataAccessException(
                "No " + entityClass.getSimpleName() + " matches " + query, 1));
    }

    @Override
    public List<T> findMany(Query query) {
        return mongoTemplate.find(query, entityClass);
    }

    public T create(T entity) {
        return mongoTemplate.insert(entity);
    }

    public Collection<T> createMany(Collection<? extends T> entities) {
        return mongoTemplate.insert(entities, entityClass);
    }

    /**
     * @return the updated document, or empty when nothing matched
     */
    public Optional<T> update(Query query, UpdateDefinition update) {
        return Optional.ofNullable(mongoTemplate.findAndModify(
                query, update, FindAndModifyOptions.options().returnNew(true), entityClass));
    }

    public long updateMany(Query query, UpdateDefinition update) {
        return mongoTemplate.updateMulti(query, update, entityClass).getModifiedCount();
    }

    public Optional<T> delete(Query query) {
        return Optional.ofNullable(mongoTemplate.findAndRemove(query, entityClass));
    }

    public long deleteMany(Query query) {
        return mongoTemplate.remove(query, entityClass).getDeletedCount();
    }

    public T upsert(Query query, UpdateDefinition update) {
        return mongoTemplate.findAndModify(
                query, update, FindAndModifyOptions.options().upsert(true).returnNew(true), entityClass);
    }

    @Override
    public long count(Query query) {
        return mongoTemplate.count(query, entityClass);
    }

    public <O> List<O> aggregate(Aggregation aggregation, Class<O> outputType) {
        return mongoTemplate.aggregate(aggregation, entityClass, outputType).getMappedResults();
    }

    public <O> List<O> groupBy(Criteria where, GroupOperation group, Class<O> outputType) {
        return aggregate(Aggregation.newAggregation(Aggregation.match(where), group), outputType);
    }

    public PaginatedResult<T> findManyPaginated(Query query, PaginateOptions options) {
        return paginator.paginate(this, query, options);
    }
}
