package br.com.tempmail.api.security;

import br.com.tempmail.api.model.enums.Role;

import java.security.Principal;

/**
 * Usuário da requisição. É o principal da autenticação montada pelo {@link JwtAuthenticationFilter},
 * então {@code Authentication.getName()} devolve o ID.
 */
public record CurrentUser(String id, Role role) implements Principal {

    @Override
    public String getName() {
        return id;
    }
}
