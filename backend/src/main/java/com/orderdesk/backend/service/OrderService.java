package com.orderdesk.backend.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.orderdesk.backend.cache.CacheKeys;
import com.orderdesk.backend.cache.CacheRegion;
import com.orderdesk.backend.cache.QueryCache;
import com.orderdesk.backend.dto.order.CreateOrderRequest;
import com.orderdesk.backend.dto.order.OrderDTO;
import com.orderdesk.backend.dto.order.OrderQuery;
import com.orderdesk.backend.dto.order.UpdateOrderRequest;
import com.orderdesk.backend.exception.ResourceNotFoundException;
import com.orderdesk.backend.mapper.OrderMapper;
import com.orderdesk.backend.model.Order;
import com.orderdesk.backend.model.OrderStatus;
import com.orderdesk.backend.model.Role;
import com.orderdesk.backend.pagination.PaginateOptions;
import com.orderdesk.backend.pagination.PaginatedResult;
import com.orderdesk.backend.repository.CustomerRepository;
import com.orderdesk.backend.repository.OrderRepository;
import com.orderdesk.backend.security.AccessPolicy;
import com.orderdesk.backend.security.AuthUser;
import com.orderdesk.backend.utils.ListQueries;
import com.orderdesk.backend.utils.Persistence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

@Slf4j
@Service
public class OrderService {

    static final Set<String> SORTABLE_FIELDS =
            Set.of("title", "price", "startDate", "endDate", "status", "category", "createdAt");

    private static final Role[] ORDER_ROLES = {Role.ADMIN, Role.MANAGER, Role.FREELANCER};

    private static final TypeReference<PaginatedResult<OrderDTO>> PAGE_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<OrderDTO> ORDER_TYPE = new TypeReference<>() {
    };

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private CustomerRepository customerRepository;

    @Autowired
    private OrderMapper orderMapper;

    @Autowired
    private QueryCache queryCache;

    @Autowired
    private AccessPolicy accessPolicy;

    public OrderDTO createOrder(AuthUser actor, CreateOrderRequest request) {
        accessPolicy.requireRole(actor, ORDER_ROLES);
        requireDateRange(request.getStartDate(), request.getEndDate());

        if (StringUtils.hasText(request.getCustomerId())) {
            boolean customerExists = Persistence.call("Failed to create order",
                    () -> customerRepository.findUnique(request.getCustomerId()).isPresent());
            if (!customerExists) {
                throw new ResourceNotFoundException("Customer not found with id: " + request.getCustomerId());
            }
        }

        LocalDateTime now = LocalDateTime.now();
        Order order = Order.builder()
                .title(request.getTitle())
                .description(request.getDescription())
                .price(request.getPrice())
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .category(request.getCategory())
                .status(request.getStatus() != null ? request.getStatus() : OrderStatus.NEW)
                .userId(actor.getId())
                .customerId(StringUtils.hasText(request.getCustomerId()) ? request.getCustomerId() : null)
                .createdAt(now)
                .updatedAt(now)
                .build();

        Order saved = Persistence.call("Failed to create order", () -> orderRepository.create(order));
        log.info("Order {} created by user {}", saved.getId(), actor.getId());

        invalidate();
        return orderMapper.toDto(saved);
    }

    /**
     * Lists orders visible to the caller. FREELANCER callers are always
     * restricted to their own orders, whatever userId they pass.
     */
    public PaginatedResult<OrderDTO> getOrders(AuthUser actor, OrderQuery query) {
        accessPolicy.requireRole(actor, ORDER_ROLES);
        String sortBy = ListQueries.sortField(query.getSortBy(), SORTABLE_FIELDS);

        Map<String, Object> filters = new TreeMap<>();
        if (!accessPolicy.canManageAllOrders(actor)) {
            filters.put("userId", actor.getId());
        } else if (StringUtils.hasText(query.getUserId())) {
            filters.put("userId", query.getUserId());
        }
        if (StringUtils.hasText(query.getSearchText())) {
            filters.put("searchText", query.getSearchText().trim());
        }
        if (query.getCategory() != null) {
            filters.put("category", query.getCategory());
        }
        if (query.getStatus() != null) {
            filters.put("status", query.getStatus());
        }
        if (StringUtils.hasText(query.getCustomerId())) {
            filters.put("customerId", query.getCustomerId());
        }

        List<Criteria> clauses = new ArrayList<>();
        filters.forEach((field, value) -> clauses.add("searchText".equals(field)
                ? ListQueries.search((String) value, "title", "description")
                : Criteria.where(field).is(value)));

        Query mongoQuery = ListQueries.query(clauses, sortBy, query.direction());
        PaginateOptions options = query.toPaginateOptions();

        String key = CacheKeys.listKey(CacheRegion.ORDERS, options.resolvePage(), options.resolvePerPage(),
                sortBy, query.direction(), queryCache.toJson(filters));

        return queryCache.getOrLoad(key, PAGE_TYPE, () -> Persistence.call("Failed to load orders",
                () -> orderRepository.findManyPaginated(mongoQuery, options).map(orderMapper::toDto)));
    }

    public OrderDTO getOrder(AuthUser actor, String id) {
        accessPolicy.requireRole(actor, ORDER_ROLES);

        String key = CacheKeys.detailKey(CacheRegion.ORDERS, id);
        Optional<OrderDTO> cached = queryCache.get(key, ORDER_TYPE);
        OrderDTO order;
        if (cached.isPresent()) {
            order = cached.get();
        } else {
            order = orderMapper.toDto(loadOrder(id));
            queryCache.put(key, order);
        }

        accessPolicy.requireOrderAccess(actor, order.getId(), order.getUserId());
        return order;
    }

    public OrderDTO updateOrder(AuthUser actor, String id, UpdateOrderRequest request) {
        accessPolicy.requireRole(actor, ORDER_ROLES);
        Order existing = loadOrder(id);
        accessPolicy.requireOrderAccess(actor, existing.getId(), existing.getUserId());

        requireDateRange(
                request.getStartDate() != null ? request.getStartDate() : existing.getStartDate(),
                request.getEndDate() != null ? request.getEndDate() : existing.getEndDate());

        Update update = new Update().set("updatedAt", LocalDateTime.now());
        if (request.getTitle() != null) update.set("title", request.getTitle());
        if (request.getDescription() != null) update.set("description", request.getDescription());
        if (request.getPrice() != null) update.set("price", request.getPrice());
        if (request.getStartDate() != null) update.set("startDate", request.getStartDate());
        if (request.getEndDate() != null) update.set("endDate", request.getEndDate());
        if (request.getCategory() != null) update.set("category", request.getCategory());
        if (request.getStatus() != null) update.set("status", request.getStatus());

        Order updated = Persistence.call("Failed to update order",
                () -> orderRepository.update(ListQueries.byId(id), update))
                .orElseThrow(() -> new ResourceNotFoundException("Order not found with id: " + id));
        log.info("Order {} updated by user {}", id, actor.getId());

        invalidate();
        return orderMapper.toDto(updated);
    }

    public OrderDTO deleteOrder(AuthUser actor, String id) {
        accessPolicy.requireRole(actor, ORDER_ROLES);
        Order existing = loadOrder(id);
        accessPolicy.requireOrderAccess(actor, existing.getId(), existing.getUserId());

        Order deleted = Persistence.call("Failed to delete order",
                () -> orderRepository.delete(ListQueries.byId(id)))
                .orElseThrow(() -> new ResourceNotFoundException("Order not found with id: " + id));
        log.info("Order {} deleted by user {}", id, actor.getId());

        invalidate();
        return orderMapper.toDto(deleted);
    }

    private Order loadOrder(String id) {
        return Persistence.call("Failed to load order", () -> orderRepository.findUnique(id))
                .orElseThrow(() -> new ResourceNotFoundException("Order not found with id: " + id));
    }

    private void requireDateRange(LocalDate startDate, LocalDate endDate) {
        if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("End date must not be before start date.");
        }
    }

    // Customer payloads embed orders and statistics are derived from them
    private void invalidate() {
        queryCache.invalidate(CacheRegion.ORDERS, CacheRegion.CUSTOMERS, CacheRegion.STATISTICS);
    }
}
