package com.orderdesk.backend.dto.user;

import com.orderdesk.backend.dto.PageQuery;
import com.orderdesk.backend.model.Role;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class UserQuery extends PageQuery {
    private String searchText;
    private Role role;
    private String country;
}
