package com.orderdesk.backend.filter;

import com.orderdesk.backend.config.UserDetailsServiceImpl;
import com.orderdesk.backend.controller.OrderController;
import com.orderdesk.backend.exception.GlobalExceptionHandler;
import com.orderdesk.backend.security.AuthUser;
import com.orderdesk.backend.service.OrderService;
import com.orderdesk.backend.service.TokenRevocationService;
import com.orderdesk.backend.support.InMemoryCacheStore;
import com.orderdesk.backend.utils.JwtUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authorization.AuthenticatedAuthorizationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.DefaultSecurityFilterChain;
import org.springframework.security.web.FilterChainProxy;
import org.springframework.security.web.access.ExceptionTranslationFilter;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.method.annotation.AuthenticationPrincipalArgumentResolver;
import org.springframework.security.web.util.matcher.AnyRequestMatcher;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.concurrent.atomic.AtomicReference;

import static com.orderdesk.backend.support.TestFixtures.freelancer;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class JwtAuthTokenFilterTest {

    private final AuthUser currentUser = freelancer("u1");

    private InMemoryCacheStore store;
    private TokenRevocationService tokenRevocationService;
    private UserDetailsServiceImpl userDetailsService;
    private JwtAuthTokenFilter filter;
    private OrderService orderService;
    private MockMvc mockMvc;
    private String token;

    @BeforeEach
    void setUp() {
        JwtUtils jwtUtils = new JwtUtils("test-access-secret-0123456789abcdef0123", 60_000,
                "test-refresh-secret-0123456789abcdef012", 120_000);
        token = jwtUtils.generateAccessToken("u1", "u1@example.com");

        store = new InMemoryCacheStore();
        tokenRevocationService = new TokenRevocationService();
        ReflectionTestUtils.setField(tokenRevocationService, "cacheStore", store);
        ReflectionTestUtils.setField(tokenRevocationService, "jwtUtils", jwtUtils);

        userDetailsService = mock(UserDetailsServiceImpl.class);
        when(userDetailsService.loadUserById("u1")).thenReturn(currentUser);

        filter = new JwtAuthTokenFilter();
        ReflectionTestUtils.setField(filter, "jwtUtils", jwtUtils);
        ReflectionTestUtils.setField(filter, "userDetailsService", userDetailsService);
        ReflectionTestUtils.setField(filter, "tokenRevocationService", tokenRevocationService);

        orderService = mock(OrderService.class);
        OrderController controller = new OrderController();
        ReflectionTestUtils.setField(controller, "orderService", orderService);

        FilterChainProxy securityChain = new FilterChainProxy(new DefaultSecurityFilterChain(AnyRequestMatcher.INSTANCE,
                filter,
                new AnonymousAuthenticationFilter("order-desk-test"),
                new ExceptionTranslationFilter(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)),
                new AuthorizationFilter(AuthenticatedAuthorizationManager.authenticated())));

        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .setCustomArgumentResolvers(new AuthenticationPrincipalArgumentResolver())
                .addFilters(securityChain)
                .build();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    private Authentication authenticationSeenDownstream(String bearer) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/orders");
        if (bearer != null) {
            request.addHeader("Authorization", "Bearer " + bearer);
        }
        AtomicReference<Authentication> seen = new AtomicReference<>();
        filter.doFilter(request, new MockHttpServletResponse(),
                (rq, rs) -> seen.set(SecurityContextHolder.getContext().getAuthentication()));
        return seen.get();
    }

    @Test
    void validTokenAuthenticatesTheRequest() throws Exception {
        Authentication authentication = authenticationSeenDownstream(token);

        assertThat(authentication).isNotNull();
        assertThat(authentication.getPrincipal()).isEqualTo(currentUser);
    }

    @Test
    void revokedTokenLeavesTheRequestAnonymous() throws Exception {
        tokenRevocationService.revoke(token);

        assertThat(authenticationSeenDownstream(token)).isNull();
        verify(userDetailsService, never()).loadUserById(any());
    }

    @Test
    void unreadableLedgerLeavesTheRequestAnonymous() throws Exception {
        store.setDown(true);

        assertThat(authenticationSeenDownstream(token)).isNull();
        verify(userDetailsService, never()).loadUserById(any());
    }

    @Test
    void validTokenReachesTheController() throws Exception {
        mockMvc.perform(get("/api/orders").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk());

        verify(orderService).getOrders(eq(currentUser), any());
    }

    @Test
    void revokedTokenIsRejectedWith401() throws Exception {
        tokenRevocationService.revoke(token);

        mockMvc.perform(get("/api/orders").header("Authorization", "Bearer " + token))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(orderService);
    }

    @Test
    void unreadableLedgerIsRejectedWith401() throws Exception {
        store.setDown(true);

        mockMvc.perform(get("/api/orders").header("Authorization", "Bearer " + token))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(orderService);
    }

    @Test
    void tamperedTokenIsRejectedWith401() throws Exception {
        mockMvc.perform(get("/api/orders").header("Authorization", "Bearer " + token + "x"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(orderService);
    }

    @Test
    void missingTokenIsRejectedWith401() throws Exception {
        mockMvc.perform(get("/api/orders"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(orderService);
    }
}
