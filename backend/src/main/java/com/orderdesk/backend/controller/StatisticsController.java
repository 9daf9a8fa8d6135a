package com.orderdesk.backend.controller;

import com.orderdesk.backend.dto.stats.CustomerSpendingDTO;
import com.orderdesk.backend.dto.stats.DashboardStatsDTO;
import com.orderdesk.backend.dto.stats.TopCustomerByOrdersDTO;
import com.orderdesk.backend.dto.stats.TopCustomerBySpendingDTO;
import com.orderdesk.backend.dto.stats.TopExpensiveOrderDTO;
import com.orderdesk.backend.dto.stats.UserCustomerStatsDTO;
import com.orderdesk.backend.dto.stats.UserOrderStatsDTO;
import com.orderdesk.backend.security.AuthUser;
import com.orderdesk.backend.service.StatisticsService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/statistics")
public class StatisticsController {

    @Autowired
    private StatisticsService statisticsService;

    @GetMapping("/users/{userId}/customers")
    public ResponseEntity<UserCustomerStatsDTO> getUserCustomerStats(@AuthenticationPrincipal AuthUser currentUser,
                                                                     @PathVariable String userId) {
        return ResponseEntity.ok(statisticsService.getUserCustomerStats(currentUser, userId));
    }

    @GetMapping("/users/{userId}/orders")
    public ResponseEntity<UserOrderStatsDTO> getUserOrderStats(@AuthenticationPrincipal AuthUser currentUser,
                                                               @PathVariable String userId) {
        return ResponseEntity.ok(statisticsService.getUserOrderStats(currentUser, userId));
    }

    // limit defaults to 5, clamped to 1..100
    @GetMapping("/orders/top-expensive")
    public ResponseEntity<List<TopExpensiveOrderDTO>> getTopExpensiveOrders(@AuthenticationPrincipal AuthUser currentUser,
                                                                            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(statisticsService.getTopExpensiveOrders(currentUser, limit));
    }

    @GetMapping("/customers/spending")
    public ResponseEntity<List<CustomerSpendingDTO>> getCustomerSpending(@AuthenticationPrincipal AuthUser currentUser) {
        return ResponseEntity.ok(statisticsService.getCustomerSpending(currentUser));
    }

    @GetMapping("/customers/top-spenders")
    public ResponseEntity<List<TopCustomerBySpendingDTO>> getTopCustomersBySpending(@AuthenticationPrincipal AuthUser currentUser,
                                                                                    @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(statisticsService.getTopCustomersBySpending(currentUser, limit));
    }

    @GetMapping("/customers/top-by-orders")
    public ResponseEntity<List<TopCustomerByOrdersDTO>> getTopCustomersByOrders(@AuthenticationPrincipal AuthUser currentUser,
                                                                                @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(statisticsService.getTopCustomersByOrders(currentUser, limit));
    }

    @GetMapping("/dashboard")
    public ResponseEntity<DashboardStatsDTO> getDashboardStats(@AuthenticationPrincipal AuthUser currentUser) {
        return ResponseEntity.ok(statisticsService.getDashboardStats(currentUser));
    }
}
