package br.com.tempmail.api.security;

/**
 * Resolve o usuário que está fazendo a requisição.
 */
public interface UserContext {

    /**
     * @throws br.com.tempmail.api.exception.UnauthorizedException se não houver usuário autenticado
     */
    CurrentUser requireCurrentUser();
}
