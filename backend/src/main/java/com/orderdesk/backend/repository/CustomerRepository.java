package com.orderdesk.backend.repository;

import com.orderdesk.backend.model.Customer;
import com.orderdesk.backend.pagination.Paginator;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class CustomerRepository extends BaseRepository<Customer> {

    public CustomerRepository(MongoTemplate mongoTemplate, Paginator paginator) {
        super(mongoTemplate, paginator, Customer.class);
    }
}
