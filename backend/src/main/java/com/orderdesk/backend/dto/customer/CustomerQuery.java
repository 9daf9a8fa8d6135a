package com.orderdesk.backend.dto.customer;

import com.orderdesk.backend.dto.PageQuery;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class CustomerQuery extends PageQuery {
    private String searchText;
    private String company;
}
