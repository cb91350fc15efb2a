package br.com.tempmail.api.security;

import br.com.tempmail.api.model.enums.Role;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class JwtAuthenticationFilterTest {

    private static final String SECRET = "segredo-de-teste-com-pelo-menos-32-bytes!!";

    private final JwtAuthenticationFilter filter = new JwtAuthenticationFilter(new JwtTokenProvider(SECRET));

    @AfterEach
    void clear() {
        SecurityContextHolder.clearContext();
    }

    private static String token(String subject, String claim, Object value) {
        JwtBuilder builder = Jwts.builder();
        if (subject != null) {
            builder.setSubject(subject);
        }
        if (claim != null) {
            builder.claim(claim, value);
        }
        return builder.signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8))).compact();
    }

    private MockFilterChain filter(String authorization) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/emails/batch/history");
        if (authorization != null) {
            request.addHeader(HttpHeaders.AUTHORIZATION, authorization);
        }
        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(request, new MockHttpServletResponse(), chain);
        return chain;
    }

    @Test
    void principalIsCurrentUserWithHighestRole() throws Exception {
        MockFilterChain chain = filter("Bearer " + token("user-9", "roles", List.of("knight", "emperor")));

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertEquals(new CurrentUser("user-9", Role.EMPEROR), authentication.getPrincipal());
        assertEquals("user-9", authentication.getName());
        assertEquals(List.of("ROLE_EMPEROR"), authentication.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .collect(Collectors.toList()));
        assertNotNull(chain.getRequest());
    }

    @Test
    void unknownRoleBecomesCivilian() throws Exception {
        filter("Bearer " + token("user-9", "role", "pirata"));

        CurrentUser user = (CurrentUser) SecurityContextHolder.getContext().getAuthentication().getPrincipal();
        assertEquals(Role.CIVILIAN, user.role());
        assertEquals(user, new SecurityUserContext().requireCurrentUser());
    }

    @Test
    void tokenWithoutSubjectStaysAnonymous() throws Exception {
        MockFilterChain chain = filter("Bearer " + token(null, "role", "duke"));

        assertNull(SecurityContextHolder.getContext().getAuthentication());
        assertNotNull(chain.getRequest());
    }

    @Test
    void invalidOrMissingTokenStaysAnonymous() throws Exception {
        assertNotNull(filter("Bearer nao-e-um-jwt").getRequest());
        assertNull(SecurityContextHolder.getContext().getAuthentication());

        assertNotNull(filter(null).getRequest());
        assertNull(SecurityContextHolder.getContext().getAuthentication());
    }
}
