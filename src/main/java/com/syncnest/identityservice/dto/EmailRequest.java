package com.syncnest.identityservice.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of the password-reset and verification-email requests.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmailRequest {

    @NotBlank(message = "email is required")
    @Email(message = "email is invalid")
    @Size(max = 254, message = "email must be <= 254 characters")
    private String email;
}
