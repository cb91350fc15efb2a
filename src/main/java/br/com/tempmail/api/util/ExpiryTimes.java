package br.com.tempmail.api.util;

import java.time.Duration;
import java.time.LocalDateTime;

public final class ExpiryTimes {

    // Valor gravado em expires_at para e-mails permanentes
    public static final LocalDateTime NEVER = LocalDateTime.of(9999, 1, 1, 0, 0);

    private ExpiryTimes() {
    }

    public static LocalDateTime expiresAt(long expiryTimeMillis, LocalDateTime now) {
        if (expiryTimeMillis == 0) {
            return NEVER;
        }
        return now.plus(Duration.ofMillis(expiryTimeMillis));
    }
}
