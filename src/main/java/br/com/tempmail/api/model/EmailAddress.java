package br.com.tempmail.api.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.UUID;

@Entity
@Table(name = "emails", indexes = {
        @Index(name = "emails_user_id_idx", columnList = "user_id"),
        @Index(name = "emails_expires_at_idx", columnList = "expires_at")
})
@Getter
@Setter
@NoArgsConstructor
public class EmailAddress {

    @Id
    @GeneratedValue(strategy = GenerationType.AUTO)
    private UUID id;

    @Column(nullable = false)
    private String address;

    // Endereço em minúsculas; a unicidade é case-insensitive
    @Column(name = "address_key", nullable = false, unique = true)
    private String addressKey;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    public EmailAddress(String address, String userId, LocalDateTime createdAt, LocalDateTime expiresAt) {
        this.address = address;
        this.addressKey = normalize(address);
        this.userId = userId;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    public static String normalize(String address) {
        return address.toLowerCase(Locale.ROOT);
    }
}
