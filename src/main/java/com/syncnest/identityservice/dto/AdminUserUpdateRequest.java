package com.syncnest.identityservice.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.syncnest.identityservice.entity.UserRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Administrative update; every field is optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdminUserUpdateRequest {

    private UserRole role;

    @JsonAlias("is_active")
    private Boolean active;

    @JsonAlias("is_blocked")
    private Boolean blocked;
}
