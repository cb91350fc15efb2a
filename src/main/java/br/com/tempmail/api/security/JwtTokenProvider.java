package br.com.tempmail.api.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Component
public class JwtTokenProvider {

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${tempmail.jwt.secret}") String jwtSecret) {
        this.secretKey = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
    }

    // Valida a assinatura e extrai os claims
    public Claims getClaims(String token) {
        return Jwts.parserBuilder()
                .setSigningKey(secretKey)
                .build()
                .parseClaimsJws(token)
                .getBody();
    }

    /**
     * Roles do token: claim "roles" (lista) ou "role" (singular).
     * Sem nenhuma das duas, o usuário é CIVILIAN.
     */
    @SuppressWarnings("unchecked")
    public List<String> getRoles(Claims claims) {
        List<String> roles = claims.get("roles", List.class);
        if (roles != null && !roles.isEmpty()) {
            return roles.stream().map(r -> r.toUpperCase(Locale.ROOT)).collect(Collectors.toList());
        }

        String role = claims.get("role", String.class);
        if (role != null && !role.isBlank()) {
            return List.of(role.toUpperCase(Locale.ROOT));
        }

        return List.of("CIVILIAN");
    }
}
