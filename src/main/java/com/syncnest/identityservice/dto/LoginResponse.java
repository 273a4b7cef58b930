package com.syncnest.identityservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LoginResponse {

    private UserResponse user;
    private String accessToken;
    private String refreshToken;
    private String tokenType;
    /** Seconds until the access token expires. */
    private long expiresIn;
    private Instant refreshExpiresAt;
}
