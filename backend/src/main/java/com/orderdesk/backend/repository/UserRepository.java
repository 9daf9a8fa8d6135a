package com.orderdesk.backend.repository;

import com.orderdesk.backend.model.User;
import com.orderdesk.backend.pagination.Paginator;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class UserRepository extends BaseRepository<User> {

    public UserRepository(MongoTemplate mongoTemplate, Paginator paginator) {
        super(mongoTemplate, paginator, User.class);
    }

    public Optional<User> findByEmail(String email) {
        return findUnique(new Query(Criteria.where("email").is(email)));
    }
}
