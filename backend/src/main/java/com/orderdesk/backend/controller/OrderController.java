package com.orderdesk.backend.controller;

import com.orderdesk.backend.dto.order.CreateOrderRequest;
import com.orderdesk.backend.dto.order.OrderDTO;
import com.orderdesk.backend.dto.order.OrderQuery;
import com.orderdesk.backend.dto.order.UpdateOrderRequest;
import com.orderdesk.backend.pagination.PaginatedResult;
import com.orderdesk.backend.security.AuthUser;
import com.orderdesk.backend.service.OrderService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/orders")
public class OrderController {

    @Autowired
    private OrderService orderService;

    @PostMapping
    public ResponseEntity<OrderDTO> createOrder(@AuthenticationPrincipal AuthUser currentUser,
                                                @Valid @RequestBody CreateOrderRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(orderService.createOrder(currentUser, request));
    }

    // Supports ?page, perPage, sortBy, order, searchText, category, status, userId, customerId
    @GetMapping
    public ResponseEntity<PaginatedResult<OrderDTO>> getOrders(@AuthenticationPrincipal AuthUser currentUser,
                                                               @Valid @ModelAttribute OrderQuery query) {
        return ResponseEntity.ok(orderService.getOrders(currentUser, query));
    }

    @GetMapping("/{id}")
    public ResponseEntity<OrderDTO> getOrder(@AuthenticationPrincipal AuthUser currentUser,
                                             @PathVariable String id) {
        return ResponseEntity.ok(orderService.getOrder(currentUser, id));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<OrderDTO> updateOrder(@AuthenticationPrincipal AuthUser currentUser,
                                                @PathVariable String id,
                                                @Valid @RequestBody UpdateOrderRequest request) {
        return ResponseEntity.ok(orderService.updateOrder(currentUser, id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<OrderDTO> deleteOrder(@AuthenticationPrincipal AuthUser currentUser,
                                                @PathVariable String id) {
        return ResponseEntity.ok(orderService.deleteOrder(currentUser, id));
    }
}
