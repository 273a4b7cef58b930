package com.syncnest.identityservice.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;

@Entity
@Table(
        name = "users",
        uniqueConstraints = {
                @UniqueConstraint(name = User.UK_EMAIL, columnNames = "email"),
                @UniqueConstraint(name = User.UK_USERNAME, columnNames = "username")
        }
)
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@ToString(onlyExplicitlyIncluded = true)
public class User extends BaseEntity implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    public static final String UK_EMAIL = "uk_users_email";
    public static final String UK_USERNAME = "uk_users_username";

    @ToString.Include
    @Column(name = "email", nullable = false, length = 254)
    private String email;

    @ToString.Include
    @Column(name = "username", nullable = false, length = 150)
    private String username;

    @JsonIgnore
    @Column(name = "password", nullable = false)
    private String password;

    @Column(name = "recovery_email", length = 254)
    private String recoveryEmail;

    @Column(name = "phone_number", length = 20)
    private String phoneNumber;

    @Column(name = "address", length = 500)
    private String address;

    @Column(name = "country", length = 100)
    private String country;

    @Column(name = "bio", length = 1000)
    private String bio;

    @ToString.Include
    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    @Builder.Default
    private UserRole role = UserRole.USER;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Builder.Default
    @Column(name = "is_blocked", nullable = false)
    private boolean blocked = false;

    @Builder.Default
    @Column(name = "is_email_verified", nullable = false)
    private boolean emailVerified = false;

    @Column(name = "last_login")
    private Instant lastLoginAt;

    /** True when the account may hold a session. */
    public boolean canAuthenticate() {
        return active && !blocked && !isDeleted();
    }
}
