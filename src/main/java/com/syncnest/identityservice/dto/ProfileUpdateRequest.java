package com.syncnest.identityservice.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial profile update; absent fields are left unchanged, an empty string clears an optional field.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileUpdateRequest {

    @Size(min = 3, max = 150, message = "Username must be between 3 and 150 characters")
    @Pattern(regexp = "^[\\w.@+-]+$", message = "Username may contain letters, digits and @/./+/-/_ only")
    private String username;

    @Email(message = "recoveryEmail is invalid")
    @Size(max = 254, message = "recoveryEmail must be <= 254 characters")
    @JsonAlias("recovery_email")
    private String recoveryEmail;

    @Pattern(regexp = "^$|^\\+?[0-9 ()-]{5,20}$", message = "phoneNumber is invalid")
    @JsonAlias("phone_number")
    private String phoneNumber;

    @Size(max = 500, message = "address must be <= 500 characters")
    private String address;

    @Size(max = 100, message = "country must be <= 100 characters")
    private String country;

    @Size(max = 1000, message = "bio must be <= 1000 characters")
    private String bio;
}
