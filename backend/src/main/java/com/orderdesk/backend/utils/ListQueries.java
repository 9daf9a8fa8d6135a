package com.orderdesk.backend.utils;

import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.util.StringUtils;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

public final class ListQueries {

    private ListQueries() {
    }

    /**
     * @return the field to sort by, or null when no sorting was requested
     * @throws IllegalArgumentException when the field is not sortable
     */
    public static String sortField(String sortBy, Set<String> allowed) {
        if (!StringUtils.hasText(sortBy)) {
            return null;
        }
        if (!allowed.contains(sortBy)) {
            throw new IllegalArgumentException("Cannot sort by '" + sortBy + "'. Allowed fields: " + allowed);
        }
        return sortBy;
    }

    /**
     * Splits the text on whitespace and matches any term, case-insensitively,
     * as a substring of any of the fields.
     */
    public static Criteria search(String text, String... fields) {
        Criteria[] alternatives = Arrays.stream(text.trim().split("\\s+"))
                .filter(term -> !term.isEmpty())
                .flatMap(term -> Arrays.stream(fields).map(field -> contains(field, term)))
                .toArray(Criteria[]::new);
        return new Criteria().orOperator(alternatives);
    }

    public static Criteria contains(String field, String text) {
        return Criteria.where(field).regex(Pattern.compile(Pattern.quote(text.trim()), Pattern.CASE_INSENSITIVE));
    }

    public static Query query(List<Criteria> clauses, String sortBy, Sort.Direction direction) {
        Query query = clauses.isEmpty() ? new Query() : new Query(new Criteria().andOperator(clauses));
        if (sortBy != null) {
            query.with(Sort.by(direction, sortBy));
        }
        return query;
    }

    public static Query byId(String id) {
        return new Query(Criteria.where("id").is(id));
    }
}
