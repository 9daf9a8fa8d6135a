package com.orderdesk.backend.dto.order;

import com.orderdesk.backend.dto.PageQuery;
import com.orderdesk.backend.model.Category;
import com.orderdesk.backend.model.OrderStatus;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class OrderQuery extends PageQuery {
    private String searchText;
    private Category category;
    private OrderStatus status;
    private String userId; // honored for ADMIN and MANAGER only
    private String customerId;
}
