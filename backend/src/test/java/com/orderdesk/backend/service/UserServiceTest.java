package com.orderdesk.backend.service;

import com.orderdesk.backend.cache.QueryCache;
import com.orderdesk.backend.dto.user.CreateUserRequest;
import com.orderdesk.backend.dto.user.UpdateUserRequest;
import com.orderdesk.backend.dto.user.UserDTO;
import com.orderdesk.backend.dto.user.UserQuery;
import com.orderdesk.backend.exception.DuplicateResourceException;
import com.orderdesk.backend.exception.ForbiddenAccessException;
import com.orderdesk.backend.exception.ResourceNotFoundException;
import com.orderdesk.backend.mapper.UserMapper;
import com.orderdesk.backend.model.Category;
import com.orderdesk.backend.model.Order;
import com.orderdesk.backend.model.Role;
import com.orderdesk.backend.model.User;
import com.orderdesk.backend.security.AccessPolicy;
import com.orderdesk.backend.security.AuthUser;
import com.orderdesk.backend.support.InMemoryCacheStore;
import com.orderdesk.backend.support.InMemoryRepositories;
import com.orderdesk.backend.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.LocalDate;

import static com.orderdesk.backend.support.TestFixtures.admin;
import static com.orderdesk.backend.support.TestFixtures.freelancer;
import static com.orderdesk.backend.support.TestFixtures.manager;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UserServiceTest {

    private InMemoryRepositories.Users users;
    private InMemoryRepositories.Orders orders;
    private UserService userService;

    private final AuthUser admin = admin("a1");

    @BeforeEach
    void setUp() {
        users = new InMemoryRepositories.Users();
        orders = new InMemoryRepositories.Orders();
        QueryCache queryCache = new QueryCache(new InMemoryCacheStore(), TestFixtures.objectMapper(), 300, 1800);
        userService = new UserService();
        ReflectionTestUtils.setField(userService, "userRepository", users);
        ReflectionTestUtils.setField(userService, "orderRepository", orders);
        ReflectionTestUtils.setField(userService, "passwordEncoder", new BCryptPasswordEncoder(4));
        ReflectionTestUtils.setField(userService, "userMapper", new UserMapper());
        ReflectionTestUtils.setField(userService, "queryCache", queryCache);
        ReflectionTestUtils.setField(userService, "accessPolicy", new AccessPolicy(true));
    }

    private UserDTO createUser(String email, Role role) {
        CreateUserRequest request = new CreateUserRequest();
        request.setFirstName("Ada");
        request.setLastName("Lovelace");
        request.setEmail(email);
        request.setPassword("s3cret-password");
        request.setRole(role);
        request.setIsEmailVerified(true);
        return userService.createUser(admin, request);
    }

    private AuthUser principalOf(UserDTO user) {
        return new AuthUser(user.getId(), user.getEmail(), "hash", user.getRole(), true);
    }

    @Test
    void adminCreatesUsersAndPasswordIsHashed() {
        UserDTO created = createUser("ada@example.com", Role.MANAGER);

        User stored = users.findUnique(created.getId()).orElseThrow();
        assertThat(stored.getRole()).isEqualTo(Role.MANAGER);
        assertThat(stored.getPassword()).isNotEqualTo("s3cret-password").startsWith("$2");
    }

    @Test
    void duplicateEmailIsAConflict() {
        createUser("ada@example.com", Role.FREELANCER);

        assertThatThrownBy(() -> createUser("ada@example.com", Role.FREELANCER))
                .isInstanceOf(DuplicateResourceException.class);
    }

    @Test
    void onlyAdminsCreateAndListUsers() {
        CreateUserRequest request = new CreateUserRequest();
        request.setEmail("x@example.com");

        assertThatThrownBy(() -> userService.createUser(manager("m1"), request))
                .isInstanceOf(ForbiddenAccessException.class);
        assertThatThrownBy(() -> userService.getUsers(freelancer("f1"), new UserQuery()))
                .isInstanceOf(ForbiddenAccessException.class);
    }

    @Test
    void listFiltersByRoleAndReflectsNewUsers() {
        createUser("ada@example.com", Role.MANAGER);
        UserQuery managers = new UserQuery();
        managers.setRole(Role.MANAGER);
        assertThat(userService.getUsers(admin, managers).getMeta().getTotal()).isEqualTo(1);

        createUser("grace@example.com", Role.MANAGER);
        createUser("linus@example.com", Role.FREELANCER);

        assertThat(userService.getUsers(admin, managers).getData())
                .extracting(UserDTO::getEmail)
                .containsExactlyInAnyOrder("ada@example.com", "grace@example.com");
    }

    @Test
    void searchMatchesAnyWordAndCountryMatchesPartOfTheName() {
        CreateUserRequest grace = new CreateUserRequest();
        grace.setFirstName("Grace");
        grace.setLastName("Hopper");
        grace.setEmail("grace@example.com");
        grace.setPassword("s3cret-password");
        grace.setCountry("United States");
        userService.createUser(admin, grace);
        createUser("ada@example.com", Role.FREELANCER);
        createUser("linus@example.org", Role.FREELANCER);

        UserQuery search = new UserQuery();
        search.setSearchText("hopper  EXAMPLE.ORG");
        assertThat(userService.getUsers(admin, search).getData())
                .extracting(UserDTO::getEmail)
                .containsExactlyInAnyOrder("grace@example.com", "linus@example.org");

        UserQuery byCountry = new UserQuery();
        byCountry.setCountry("states");
        assertThat(userService.getUsers(admin, byCountry).getData())
                .extracting(UserDTO::getEmail)
                .containsExactly("grace@example.com");
    }

    @Test
    void usersReadOnlyThemselves() {
        UserDTO ada = createUser("ada@example.com", Role.FREELANCER);
        UserDTO grace = createUser("grace@example.com", Role.FREELANCER);

        assertThat(userService.getCurrentUser(principalOf(ada)).getEmail()).isEqualTo("ada@example.com");
        assertThatThrownBy(() -> userService.getUser(principalOf(ada), grace.getId()))
                .isInstanceOf(ForbiddenAccessException.class);
        assertThat(userService.getUser(admin, grace.getId()).getId()).isEqualTo(grace.getId());
        assertThatThrownBy(() -> userService.getUser(admin, "ghost"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void nonAdminCannotChangeOwnRole() {
        UserDTO ada = createUser("ada@example.com", Role.FREELANCER);
        UpdateUserRequest request = new UpdateUserRequest();
        request.setRole(Role.ADMIN);

        assertThatThrownBy(() -> userService.updateUser(principalOf(ada), ada.getId(), request))
                .isInstanceOf(ForbiddenAccessException.class);
        assertThat(userService.updateUser(admin, ada.getId(), request).getRole()).isEqualTo(Role.ADMIN);
    }

    @Test
    void changingEmailResetsVerification() {
        UserDTO ada = createUser("ada@example.com", Role.FREELANCER);
        UpdateUserRequest request = new UpdateUserRequest();
        request.setEmail("ada.l@example.com");

        UserDTO updated = userService.updateUser(principalOf(ada), ada.getId(), request);

        assertThat(updated.getEmail()).isEqualTo("ada.l@example.com");
        assertThat(updated.getIsEmailVerified()).isFalse();
    }

    @Test
    void userOwningOrdersCannotBeDeleted() {
        UserDTO ada = createUser("ada@example.com", Role.FREELANCER);
        orders.create(Order.builder()
                .title("Some order")
                .description("Some work to do")
                .price(BigDecimal.TEN)
                .startDate(LocalDate.of(2025, 1, 1))
                .endDate(LocalDate.of(2025, 1, 2))
                .category(Category.DESIGN)
                .userId(ada.getId())
                .build());

        assertThatThrownBy(() -> userService.deleteUser(admin, ada.getId()))
                .isInstanceOf(DuplicateResourceException.class);

        UserDTO grace = createUser("grace@example.com", Role.FREELANCER);
        assertThat(userService.deleteUser(admin, grace.getId()).getId()).isEqualTo(grace.getId());
        assertThatThrownBy(() -> userService.getUser(admin, grace.getId()))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
