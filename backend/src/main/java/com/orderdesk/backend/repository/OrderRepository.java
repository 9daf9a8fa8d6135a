package com.orderdesk.backend.repository;

import com.orderdesk.backend.model.Order;
import com.orderdesk.backend.pagination.Paginator;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class OrderRepository extends BaseRepository<Order> {

    public OrderRepository(MongoTemplate mongoTemplate, Paginator paginator) {
        super(mongoTemplate, paginator, Order.class);
    }

    public List<Order> findByCustomerId(String customerId) {
        return findMany(new Query(Criteria.where("customerId").is(customerId)));
    }

    public List<String> findCustomerIdsByUserId(String userId) {
        Query query = new Query(Criteria.where("userId").is(userId).and("customerId").ne(null));
        return mongoTemplate.findDistinct(query, "customerId", Order.class, String.class);
    }

    public long countByUserId(String userId) {
        return count(new Query(Criteria.where("userId").is(userId)));
    }
}
