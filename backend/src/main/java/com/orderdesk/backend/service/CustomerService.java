package com.orderdesk.backend.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.orderdesk.backend.cache.CacheKeys;
import com.orderdesk.backend.cache.CacheRegion;
import com.orderdesk.backend.cache.QueryCache;
import com.orderdesk.backend.dto.customer.CreateCustomerRequest;
import com.orderdesk.backend.dto.customer.CustomerDTO;
import com.orderdesk.backend.dto.customer.CustomerQuery;
import com.orderdesk.backend.dto.customer.UpdateCustomerRequest;
import com.orderdesk.backend.dto.order.OrderDTO;
import com.orderdesk.backend.exception.DuplicateResourceException;
import com.orderdesk.backend.exception.ResourceNotFoundException;
import com.orderdesk.backend.mapper.CustomerMapper;
import com.orderdesk.backend.model.Customer;
import com.orderdesk.backend.model.Order;
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

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Customers and their order links. A non-admin caller sees a customer only
 * while at least one of the caller's own orders is linked to it.
 */
@Slf4j
@Service
public class CustomerService {

    static final Set<String> SORTABLE_FIELDS = Set.of("fullName", "email", "company", "createdAt");

    private static final Role[] CUSTOMER_ROLES = {Role.ADMIN, Role.MANAGER, Role.FREELANCER};

    private static final TypeReference<PaginatedResult<CustomerDTO>> PAGE_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<CustomerDTO> CUSTOMER_TYPE = new TypeReference<>() {
    };

    @Autowired
    private CustomerRepository customerRepository;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private CustomerMapper customerMapper;

    @Autowired
    private QueryCache queryCache;

    @Autowired
    private AccessPolicy accessPolicy;

    /**
     * Creates a customer and links the given orders to it. Every order is
     * checked before anything is written, so a rejected order leaves no
     * customer behind.
     */
    public CustomerDTO createCustomer(AuthUser actor, CreateCustomerRequest request) {
        accessPolicy.requireRole(actor, CUSTOMER_ROLES);

        Set<String> orderIds = request.getOrderIds() == null
                ? Set.of()
                : new LinkedHashSet<>(request.getOrderIds());
        List<Order> orders = loadLinkableOrders(actor, orderIds);

        LocalDateTime now = LocalDateTime.now();
        Customer customer = Customer.builder()
                .fullName(request.getFullName())
                .email(request.getEmail())
                .telegram(request.getTelegram())
                .company(request.getCompany())
                .createdAt(now)
                .updatedAt(now)
                .build();

        Customer saved = Persistence.call("Failed to create customer", () -> customerRepository.create(customer));
        try {
            if (!orders.isEmpty()) {
                link(saved.getId(), orderIds);
            }
        } catch (RuntimeException e) {
            discard(saved.getId(), e);
            throw e;
        } finally {
            invalidate();
        }
        log.info("Customer {} created by user {} with {} orders", saved.getId(), actor.getId(), orders.size());

        return toDto(saved);
    }

    public PaginatedResult<CustomerDTO> getCustomers(AuthUser actor, CustomerQuery query) {
        accessPolicy.requireRole(actor, CUSTOMER_ROLES);
        String sortBy = ListQueries.sortField(query.getSortBy(), SORTABLE_FIELDS);

        Map<String, Object> filters = new TreeMap<>();
        if (!accessPolicy.isAdmin(actor)) {
            filters.put("ownerId", actor.getId());
        }
        if (StringUtils.hasText(query.getSearchText())) {
            filters.put("searchText", query.getSearchText().trim());
        }
        if (StringUtils.hasText(query.getCompany())) {
            filters.put("company", query.getCompany());
        }

        PaginateOptions options = query.toPaginateOptions();
        String key = CacheKeys.listKey(CacheRegion.CUSTOMERS, options.resolvePage(), options.resolvePerPage(),
                sortBy, query.direction(), queryCache.toJson(filters));

        return queryCache.getOrLoad(key, PAGE_TYPE, () -> Persistence.call("Failed to load customers", () -> {
            List<Criteria> clauses = new ArrayList<>();
            if (filters.containsKey("ownerId")) {
                clauses.add(Criteria.where("id").in(orderRepository.findCustomerIdsByUserId(actor.getId())));
            }
            if (filters.containsKey("searchText")) {
                clauses.add(ListQueries.search((String) filters.get("searchText"), "fullName", "email", "company"));
            }
            if (filters.containsKey("company")) {
                clauses.add(ListQueries.contains("company", (String) filters.get("company")));
            }
            Query mongoQuery = ListQueries.query(clauses, sortBy, query.direction());

            PaginatedResult<Customer> page = customerRepository.findManyPaginated(mongoQuery, options);
            Map<String, List<Order>> ordersByCustomer = linkedOrders(
                    page.getData().stream().map(Customer::getId).collect(Collectors.toList()));
            return page.map(customer -> customerMapper.toDto(
                    customer, ordersByCustomer.getOrDefault(customer.getId(), List.of())));
        }));
    }

    public CustomerDTO getCustomer(AuthUser actor, String id) {
        accessPolicy.requireRole(actor, CUSTOMER_ROLES);

        String key = CacheKeys.detailKey(CacheRegion.CUSTOMERS, id);
        Optional<CustomerDTO> cached = queryCache.get(key, CUSTOMER_TYPE);
        CustomerDTO customer;
        if (cached.isPresent()) {
            customer = cached.get();
        } else {
            customer = toDto(loadCustomer(id));
            queryCache.put(key, customer);
        }

        accessPolicy.requireCustomerAccess(actor, id, ownerIds(customer));
        return customer;
    }

    public CustomerDTO updateCustomer(AuthUser actor, String id, UpdateCustomerRequest request) {
        accessPolicy.requireRole(actor, CUSTOMER_ROLES);
        loadCustomer(id);
        List<Order> orders = ordersOf(id);
        accessPolicy.requireCustomerAccess(actor, id, orderOwners(orders));

        Update update = new Update().set("updatedAt", LocalDateTime.now());
        if (request.getFullName() != null) update.set("fullName", request.getFullName());
        if (request.getEmail() != null) update.set("email", request.getEmail());
        if (request.getTelegram() != null) update.set("telegram", request.getTelegram());
        if (request.getCompany() != null) update.set("company", request.getCompany());

        Customer updated = Persistence.call("Failed to update customer",
                () -> customerRepository.update(ListQueries.byId(id), update))
                .orElseThrow(() -> new ResourceNotFoundException("Customer not found with id: " + id));
        log.info("Customer {} updated by user {}", id, actor.getId());

        invalidate();
        return customerMapper.toDto(updated, orders);
    }

    /**
     * Deletes a customer after unlinking every order that points at it.
     */
    public CustomerDTO deleteCustomer(AuthUser actor, String id) {
        accessPolicy.requireRole(actor, CUSTOMER_ROLES);
        loadCustomer(id);
        accessPolicy.requireCustomerAccess(actor, id, orderOwners(ordersOf(id)));

        Customer deleted;
        try {
            deleted = Persistence.call("Failed to delete customer", () -> {
                unlinkAll(id);
                return customerRepository.delete(ListQueries.byId(id));
            }).orElseThrow(() -> new ResourceNotFoundException("Customer not found with id: " + id));
        } finally {
            invalidate();
        }
        log.info("Customer {} deleted by user {}", id, actor.getId());

        return customerMapper.toDto(deleted, List.of());
    }

    /**
     * Links orders to a customer. Any order that already has a customer,
     * including this one, is rejected; nothing is linked in that case.
     */
    public CustomerDTO attachOrders(AuthUser actor, String id, List<String> orderIds) {
        accessPolicy.requireRole(actor, CUSTOMER_ROLES);
        Customer customer = loadCustomer(id);

        Set<String> ids = new LinkedHashSet<>(orderIds);
        loadLinkableOrders(actor, ids);

        try {
            link(id, ids);
        } finally {
            invalidate();
        }
        log.info("User {} attached orders {} to customer {}", actor.getId(), ids, id);

        return toDto(customer);
    }

    public CustomerDTO detachOrders(AuthUser actor, String id, List<String> orderIds) {
        accessPolicy.requireRole(actor, CUSTOMER_ROLES);
        Customer customer = loadCustomer(id);

        Set<String> ids = new LinkedHashSet<>(orderIds);
        for (String orderId : ids) {
            Order order = loadOrder(orderId);
            accessPolicy.requireOrderOwnership(actor, orderId, order.getUserId());
            if (!id.equals(order.getCustomerId())) {
                throw new IllegalArgumentException("Order " + orderId + " is not linked to customer " + id + ".");
            }
        }

        try {
            unlink(id, ids);
        } finally {
            invalidate();
        }
        log.info("User {} detached orders {} from customer {}", actor.getId(), ids, id);

        return toDto(customer);
    }

    // Existence, then ownership, then the free-link check, in that order per order
    private List<Order> loadLinkableOrders(AuthUser actor, Collection<String> orderIds) {
        List<Order> orders = new ArrayList<>();
        for (String orderId : orderIds) {
            Order order = loadOrder(orderId);
            accessPolicy.requireOrderOwnership(actor, orderId, order.getUserId());
            if (order.getCustomerId() != null) {
                throw new DuplicateResourceException(
                        "Order " + orderId + " is already linked to customer " + order.getCustomerId() + ".");
            }
            orders.add(order);
        }
        return orders;
    }

    /**
     * Links only orders that are still free. When another request linked one of
     * them between the check and the write, the orders linked here are
     * released again and the whole call is a conflict.
     */
    private void link(String customerId, Collection<String> orderIds) {
        long linked = Persistence.call("Failed to attach orders", () -> orderRepository.updateMany(
                new Query(Criteria.where("id").in(orderIds).and("customerId").is(null)),
                new Update().set("customerId", customerId).set("updatedAt", LocalDateTime.now())));
        if (linked < orderIds.size()) {
            log.warn("Only {} of {} orders were linked to customer {}, releasing them",
                    linked, orderIds.size(), customerId);
            unlink(customerId, orderIds);
            throw new DuplicateResourceException(
                    "One of the orders " + orderIds + " was linked to another customer meanwhile.");
        }
    }

    private void unlink(String customerId, Collection<String> orderIds) {
        Persistence.run("Failed to detach orders", () -> orderRepository.updateMany(
                new Query(Criteria.where("id").in(orderIds).and("customerId").is(customerId)),
                new Update().unset("customerId").set("updatedAt", LocalDateTime.now())));
    }

    private void unlinkAll(String customerId) {
        orderRepository.updateMany(
                new Query(Criteria.where("customerId").is(customerId)),
                new Update().unset("customerId").set("updatedAt", LocalDateTime.now()));
    }

    // Removes a customer whose orders could not be linked; a failed cleanup rides along on the cause
    private void discard(String customerId, RuntimeException cause) {
        try {
            Persistence.run("Failed to remove customer " + customerId, () -> {
                unlinkAll(customerId);
                customerRepository.delete(ListQueries.byId(customerId));
            });
            log.warn("Customer {} removed after its orders could not be linked", customerId);
        } catch (RuntimeException cleanupFailure) {
            log.error("Customer {} is left without orders: {}", customerId, cleanupFailure.getMessage());
            cause.addSuppressed(cleanupFailure);
        }
    }

    private Customer loadCustomer(String id) {
        return Persistence.call("Failed to load customer", () -> customerRepository.findUnique(id))
                .orElseThrow(() -> new ResourceNotFoundException("Customer not found with id: " + id));
    }

    private Order loadOrder(String id) {
        return Persistence.call("Failed to load order", () -> orderRepository.findUnique(id))
                .orElseThrow(() -> new ResourceNotFoundException("Order not found with id: " + id));
    }

    private List<Order> ordersOf(String customerId) {
        return Persistence.call("Failed to load customer orders",
                () -> orderRepository.findByCustomerId(customerId));
    }

    private CustomerDTO toDto(Customer customer) {
        return customerMapper.toDto(customer, ordersOf(customer.getId()));
    }

    private Map<String, List<Order>> linkedOrders(List<String> customerIds) {
        if (customerIds.isEmpty()) {
            return Map.of();
        }
        return orderRepository.findMany(new Query(Criteria.where("customerId").in(customerIds))).stream()
                .collect(Collectors.groupingBy(Order::getCustomerId));
    }

    private static Set<String> ownerIds(CustomerDTO customer) {
        if (customer.getOrders() == null) {
            return Set.of();
        }
        return customer.getOrders().stream()
                .map(OrderDTO::getUserId)
                .collect(Collectors.toSet());
    }

    private static Set<String> orderOwners(List<Order> orders) {
        return orders.stream().map(Order::getUserId).collect(Collectors.toSet());
    }

    private void invalidate() {
        queryCache.invalidate(CacheRegion.CUSTOMERS, CacheRegion.ORDERS, CacheRegion.STATISTICS);
    }
}
