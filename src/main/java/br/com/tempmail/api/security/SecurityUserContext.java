package br.com.tempmail.api.security;

import br.com.tempmail.api.exception.UnauthorizedException;
import br.com.tempmail.api.model.enums.Role;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

/**
 * Lê o usuário do SecurityContext preenchido pelo {@link JwtAuthenticationFilter}.
 */
@Component
public class SecurityUserContext implements UserContext {

    @Override
    public CurrentUser requireCurrentUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null
                || !authentication.isAuthenticated()
                || authentication instanceof AnonymousAuthenticationToken
                || authentication.getName() == null) {
            throw new UnauthorizedException("Não autorizado");
        }

        if (authentication.getPrincipal() instanceof CurrentUser user) {
            return user;
        }

        // Autenticação montada fora do filtro JWT: role da primeira authority "ROLE_*"
        Role role = authentication.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .filter(a -> a.startsWith("ROLE_"))
                .map(a -> Role.fromClaim(a.substring(5)))
                .findFirst()
                .orElse(Role.CIVILIAN);

        return new CurrentUser(authentication.getName(), role);
    }
}
