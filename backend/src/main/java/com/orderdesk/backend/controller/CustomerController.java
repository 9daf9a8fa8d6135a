package com.orderdesk.backend.controller;

import com.orderdesk.backend.dto.customer.CreateCustomerRequest;
import com.orderdesk.backend.dto.customer.CustomerDTO;
import com.orderdesk.backend.dto.customer.CustomerOrdersRequest;
import com.orderdesk.backend.dto.customer.CustomerQuery;
import com.orderdesk.backend.dto.customer.UpdateCustomerRequest;
import com.orderdesk.backend.pagination.PaginatedResult;
import com.orderdesk.backend.security.AuthUser;
import com.orderdesk.backend.service.CustomerService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/customers")
public class CustomerController {

    @Autowired
    private CustomerService customerService;

    @PostMapping
    public ResponseEntity<CustomerDTO> createCustomer(@AuthenticationPrincipal AuthUser currentUser,
                                                      @Valid @RequestBody CreateCustomerRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(customerService.createCustomer(currentUser, request));
    }

    @GetMapping
    public ResponseEntity<PaginatedResult<CustomerDTO>> getCustomers(@AuthenticationPrincipal AuthUser currentUser,
                                                                     @Valid @ModelAttribute CustomerQuery query) {
        return ResponseEntity.ok(customerService.getCustomers(currentUser, query));
    }

    @GetMapping("/{id}")
    public ResponseEntity<CustomerDTO> getCustomer(@AuthenticationPrincipal AuthUser currentUser,
                                                   @PathVariable String id) {
        return ResponseEntity.ok(customerService.getCustomer(currentUser, id));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<CustomerDTO> updateCustomer(@AuthenticationPrincipal AuthUser currentUser,
                                                      @PathVariable String id,
                                                      @Valid @RequestBody UpdateCustomerRequest request) {
        return ResponseEntity.ok(customerService.updateCustomer(currentUser, id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<CustomerDTO> deleteCustomer(@AuthenticationPrincipal AuthUser currentUser,
                                                      @PathVariable String id) {
        return ResponseEntity.ok(customerService.deleteCustomer(currentUser, id));
    }

    // Link orders to this customer
    @PostMapping("/{id}/orders")
    public ResponseEntity<CustomerDTO> attachOrders(@AuthenticationPrincipal AuthUser currentUser,
                                                    @PathVariable String id,
                                                    @Valid @RequestBody CustomerOrdersRequest request) {
        return ResponseEntity.ok(customerService.attachOrders(currentUser, id, request.getOrderIds()));
    }

    // Unlink orders from this customer
    @DeleteMapping("/{id}/orders")
    public ResponseEntity<CustomerDTO> detachOrders(@AuthenticationPrincipal AuthUser currentUser,
                                                    @PathVariable String id,
                                                    @Valid @RequestBody CustomerOrdersRequest request) {
        return ResponseEntity.ok(customerService.detachOrders(currentUser, id, request.getOrderIds()));
    }
}
