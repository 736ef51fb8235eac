package edu.eci.arsw.facilitator.security;

import edu.eci.arsw.facilitator.exception.AuthenticationException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Locale;

/**
 * Filtro de autenticación del API de administración basado en tokens JWT.
 */
@Component
public class TokenAuthFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(TokenAuthFilter.class);

    private final AuthorizationService authorizationService;

    public TokenAuthFilter(AuthorizationService authorizationService) {
        this.authorizationService = authorizationService;
    }

    /**
     * Autentica la solicitud si trae un token Bearer. Un token inválido deja la
     * solicitud sin autenticar y la cadena de seguridad responde 401.
     *
     * @param request     La solicitud HTTP entrante.
     * @param response    La respuesta HTTP.
     * @param filterChain La cadena de filtros para continuar el procesamiento.
     * @throws ServletException Si ocurre un error en el servlet.
     * @throws IOException      Si ocurre un error de E/S.
     */
    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        try {
            String bearer = request.getHeader(HttpHeaders.AUTHORIZATION);
            if (bearer != null) {
                authenticate(bearer);
            }
            filterChain.doFilter(request, response);
        } finally {
            MDC.clear();
        }
    }

    private void authenticate(String bearer) {
        try {
            var info = authorizationService.parseBearer(bearer);
            var authorities = info.roles().stream()
                    .map(r -> new SimpleGrantedAuthority("ROLE_" + r.toUpperCase(Locale.ROOT)))
                    .toList();
            var auth = new UsernamePasswordAuthenticationToken(info.userId(), "jwt", authorities);
            SecurityContextHolder.getContext().setAuthentication(auth);
            MDC.put("userId", info.userId());
        } catch (AuthenticationException e) {
            log.debug("Token de administración rechazado: {}", e.getMessage());
            SecurityContextHolder.clearContext();
        }
    }
}
