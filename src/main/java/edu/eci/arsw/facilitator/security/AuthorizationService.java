package edu.eci.arsw.facilitator.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.eci.arsw.facilitator.exception.AuthenticationException;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

/**
 * Servicio de autorización para leer y validar tokens JWT. Lo usan el API de
 * administración y el autenticador de sesiones en modo JWT.
 */
@Service
public class AuthorizationService {
    private static final String ROLES_CLAIM = "roles";

    private final ObjectMapper om = new ObjectMapper();
    private final Clock clock;

    public AuthorizationService(Clock clock) {
        this.clock = clock;
    }

    /**
     * Parsea el encabezado Bearer para extraer la información de autenticación.
     *
     * @param bearer El encabezado Authorization o el token sin prefijo.
     * @return La información de autenticación extraída del token.
     * @throws AuthenticationException si falta el token o no es válido
     */
    public AuthInfo parseBearer(String bearer) {
        if (bearer == null || bearer.isBlank())
            throw new AuthenticationException("Falta Authorization");
        String token = bearer.trim();
        if (token.toLowerCase(Locale.ROOT).startsWith("bearer "))
            token = token.substring(7).trim();
        return parseJwt(token);
    }

    /**
     * Parsea un token JWT para extraer la información de autenticación. La firma
     * la valida el emisor aguas arriba; aquí solo se leen sub, roles y exp.
     *
     * @param jwt El token JWT.
     * @return La información de autenticación extraída del token.
     */
    private AuthInfo parseJwt(String jwt) {
        try {
            String[] parts = jwt.split("\\.");
            if (parts.length < 2)
                throw new IllegalArgumentException("JWT inválido");
            String payloadJson = new String(Base64.getUrlDecoder().decode(parts[1]), StandardCharsets.UTF_8);
            JsonNode payload = om.readTree(payloadJson);

            String userId = payload.has("sub") ? payload.get("sub").asText() : null;
            if (userId == null || userId.isBlank())
                throw new AuthenticationException("JWT sin sub");

            List<String> roles = new ArrayList<>();
            if (payload.has(ROLES_CLAIM) && payload.get(ROLES_CLAIM).isArray()) {
                payload.get(ROLES_CLAIM).forEach(r -> roles.add(r.asText()));
            } else if (payload.has("role")) {
                roles.add(payload.get("role").asText());
            }

            if (payload.has("exp")) {
                long exp = payload.get("exp").asLong(0);
                if (exp > 0 && clock.instant().getEpochSecond() > exp)
                    throw new AuthenticationException("Token expirado");
            }
            return new AuthInfo(userId, roles);
        } catch (AuthenticationException e) {
            throw e;
        } catch (Exception e) {
            throw new AuthenticationException("Token inválido");
        }
    }

    /**
     * Información de autenticación extraída del token.
     *
     * @param userId El ID del usuario.
     * @param roles  Los roles asociados al usuario.
     */
    public record AuthInfo(String userId, List<String> roles) {
    }
}
