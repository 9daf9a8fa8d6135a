package com.orderdesk.backend.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.orderdesk.backend.cache.CacheKeys;
import com.orderdesk.backend.cache.CacheRegion;
import com.orderdesk.backend.cache.QueryCache;
import com.orderdesk.backend.dto.user.CreateUserRequest;
import com.orderdesk.backend.dto.user.UpdateUserRequest;
import com.orderdesk.backend.dto.user.UserDTO;
import com.orderdesk.backend.dto.user.UserQuery;
import com.orderdesk.backend.exception.DuplicateResourceException;
import com.orderdesk.backend.exception.ForbiddenAccessException;
import com.orderdesk.backend.exception.ResourceNotFoundException;
import com.orderdesk.backend.mapper.UserMapper;
import com.orderdesk.backend.model.Role;
import com.orderdesk.backend.model.User;
import com.orderdesk.backend.pagination.PaginateOptions;
import com.orderdesk.backend.pagination.PaginatedResult;
import com.orderdesk.backend.repository.OrderRepository;
import com.orderdesk.backend.repository.UserRepository;
import com.orderdesk.backend.security.AccessPolicy;
import com.orderdesk.backend.security.AuthUser;
import com.orderdesk.backend.utils.ListQueries;
import com.orderdesk.backend.utils.Persistence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

@Slf4j
@Service
public class UserService {

    static final Set<String> SORTABLE_FIELDS =
            Set.of("firstName", "lastName", "email", "country", "role", "createdAt");

    private static final Role[] ANY_ROLE = Role.values();

    private static final TypeReference<PaginatedResult<UserDTO>> PAGE_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<UserDTO> USER_TYPE = new TypeReference<>() {
    };

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private PasswordEncoder passwordEncoder;

    @Autowired
    private UserMapper userMapper;

    @Autowired
    private QueryCache queryCache;

    @Autowired
    private AccessPolicy accessPolicy;

    // Admin-side account creation; self sign-up goes through AuthService
    public UserDTO createUser(AuthUser actor, CreateUserRequest request) {
        accessPolicy.requireRole(actor, Role.ADMIN);
        requireEmailAvailable(request.getEmail());

        LocalDateTime now = LocalDateTime.now();
        User user = User.builder()
                .firstName(request.getFirstName())
                .lastName(request.getLastName())
                .email(request.getEmail())
                .password(passwordEncoder.encode(request.getPassword()))
                .country(request.getCountry())
                .isEmailVerified(Boolean.TRUE.equals(request.getIsEmailVerified()))
                .role(request.getRole() != null ? request.getRole() : Role.FREELANCER)
                .createdAt(now)
                .updatedAt(now)
                .build();

        User saved = Persistence.call("Failed to create user", () -> userRepository.create(user));
        log.info("User {} created by admin {}", saved.getId(), actor.getId());

        queryCache.invalidate(CacheRegion.USERS);
        return userMapper.toDto(saved);
    }

    public PaginatedResult<UserDTO> getUsers(AuthUser actor, UserQuery query) {
        accessPolicy.requireRole(actor, Role.ADMIN);
        String sortBy = ListQueries.sortField(query.getSortBy(), SORTABLE_FIELDS);

        Map<String, Object> filters = new TreeMap<>();
        if (StringUtils.hasText(query.getSearchText())) {
            filters.put("searchText", query.getSearchText().trim());
        }
        if (query.getRole() != null) {
            filters.put("role", query.getRole());
        }
        if (StringUtils.hasText(query.getCountry())) {
            filters.put("country", query.getCountry());
        }

        List<Criteria> clauses = new ArrayList<>();
        filters.forEach((field, value) -> {
            switch (field) {
                case "searchText" -> clauses.add(ListQueries.search((String) value, "firstName", "lastName", "email"));
                case "country" -> clauses.add(ListQueries.contains("country", (String) value));
                default -> clauses.add(Criteria.where(field).is(value));
            }
        });

        Query mongoQuery = ListQueries.query(clauses, sortBy, query.direction());
        PaginateOptions options = query.toPaginateOptions();
        String key = CacheKeys.listKey(CacheRegion.USERS, options.resolvePage(), options.resolvePerPage(),
                sortBy, query.direction(), queryCache.toJson(filters));

        return queryCache.getOrLoad(key, PAGE_TYPE, () -> Persistence.call("Failed to load users",
                () -> userRepository.findManyPaginated(mongoQuery, options).map(userMapper::toDto)));
    }

    public UserDTO getUser(AuthUser actor, String id) {
        accessPolicy.requireRole(actor, ANY_ROLE);

        String key = CacheKeys.detailKey(CacheRegion.USERS, id);
        Optional<UserDTO> cached = queryCache.get(key, USER_TYPE);
        UserDTO user;
        if (cached.isPresent()) {
            user = cached.get();
        } else {
            user = userMapper.toDto(loadUser(id));
            queryCache.put(key, user);
        }

        accessPolicy.requireSelfOrAdmin(actor, user.getId());
        return user;
    }

    public UserDTO getCurrentUser(AuthUser actor) {
        return getUser(actor, actor.getId());
    }

    public UserDTO updateUser(AuthUser actor, String id, UpdateUserRequest request) {
        accessPolicy.requireRole(actor, ANY_ROLE);
        User existing = loadUser(id);
        accessPolicy.requireSelfOrAdmin(actor, existing.getId());

        if (request.getRole() != null && request.getRole() != existing.getRole() && !accessPolicy.isAdmin(actor)) {
            log.warn("User {} tried to change the role of user {}", actor.getId(), id);
            throw new ForbiddenAccessException("Access Denied: only an admin can change roles.");
        }

        Update update = new Update().set("updatedAt", LocalDateTime.now());
        if (request.getFirstName() != null) update.set("firstName", request.getFirstName());
        if (request.getLastName() != null) update.set("lastName", request.getLastName());
        if (request.getCountry() != null) update.set("country", request.getCountry());
        if (request.getRole() != null) update.set("role", request.getRole());
        if (request.getEmail() != null && !request.getEmail().equals(existing.getEmail())) {
            requireEmailAvailable(request.getEmail());
            // A new address has to be verified again
            update.set("email", request.getEmail()).set("isEmailVerified", false);
        }

        User updated = Persistence.call("Failed to update user",
                () -> userRepository.update(ListQueries.byId(id), update))
                .orElseThrow(() -> new ResourceNotFoundException("User not found with id: " + id));
        log.info("User {} updated by user {}", id, actor.getId());

        queryCache.invalidate(CacheRegion.USERS);
        return userMapper.toDto(updated);
    }

    /**
     * Deletes an account. Accounts that still own orders are kept, since every
     * order needs an owner.
     */
    public UserDTO deleteUser(AuthUser actor, String id) {
        accessPolicy.requireRole(actor, Role.ADMIN);
        loadUser(id);

        long ownedOrders = Persistence.call("Failed to delete user", () -> orderRepository.countByUserId(id));
        if (ownedOrders > 0) {
            throw new DuplicateResourceException(
                    "User " + id + " still owns " + ownedOrders + " orders and cannot be deleted.");
        }

        User deleted = Persistence.call("Failed to delete user",
                () -> userRepository.delete(ListQueries.byId(id)))
                .orElseThrow(() -> new ResourceNotFoundException("User not found with id: " + id));
        log.info("User {} deleted by admin {}", id, actor.getId());

        queryCache.invalidate(CacheRegion.USERS);
        return userMapper.toDto(deleted);
    }

    private User loadUser(String id) {
        return Persistence.call("Failed to load user", () -> userRepository.findUnique(id))
                .orElseThrow(() -> new ResourceNotFoundException("User not found with id: " + id));
    }

    private void requireEmailAvailable(String email) {
        boolean taken = Persistence.call("Failed to check email",
                () -> userRepository.findByEmail(email).isPresent());
        if (taken) {
            throw new DuplicateResourceException("Email is already in use: " + email);
        }
    }
}
