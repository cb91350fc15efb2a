package br.com.tempmail.api.security;

import br.com.tempmail.api.model.enums.Role;
import io.jsonwebtoken.Claims;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Autentica a requisição pelo bearer token: o principal vira um {@link CurrentUser}
 * (ID do "sub" + role de maior privilégio do token).
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenProvider tokenProvider;

    public JwtAuthenticationFilter(JwtTokenProvider tokenProvider) {
        this.tokenProvider = tokenProvider;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String token = resolveToken(request);

        if (token != null) {
            try {
                CurrentUser user = toCurrentUser(tokenProvider.getClaims(token));
                if (user != null) {
                    UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                            user, null, AuthorityUtils.createAuthorityList("ROLE_" + user.role().name()));
                    SecurityContextHolder.getContext().setAuthentication(authentication);
                } else {
                    logger.warn("Token sem \"sub\", requisição segue como anônima");
                }
            } catch (Exception ex) {
                // Token inválido: segue como anônimo, a rota protegida responde 401
                logger.warn("Não foi possível autenticar o usuário: " + ex.getMessage());
            }
        }

        filterChain.doFilter(request, response);
    }

    CurrentUser toCurrentUser(Claims claims) {
        String userId = claims.getSubject();
        if (userId == null || userId.isBlank()) {
            return null;
        }
        return new CurrentUser(userId, Role.highestOf(tokenProvider.getRoles(claims)));
    }

    private String resolveToken(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            return header.substring(BEARER_PREFIX.length());
        }
        return null;
    }
}
