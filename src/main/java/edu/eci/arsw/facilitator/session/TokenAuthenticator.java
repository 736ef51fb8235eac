package edu.eci.arsw.facilitator.session;

/**
 * Resuelve la identidad asociada a un token de sesión.
 */
public interface TokenAuthenticator {

    /**
     * @param token token presentado en el registro
     * @return identidad del cliente
     * @throws edu.eci.arsw.facilitator.exception.AuthenticationException si el token se rechaza
     */
    String authenticate(String token);
}
