package com.syncnest.identityservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    @NotBlank(message = "email is required")
    @Size(max = 254, message = "email must be <= 254 characters")
    @Email(message = "email is invalid")
    private String email;

    @NotBlank(message = "password is required")
    @Size(max = 128, message = "password must be <= 128 characters")
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String password;

    /** Optional client-chosen label kept with the refresh token. */
    @Size(max = 64, message = "deviceId must be <= 64 characters")
    private String deviceId;
}
