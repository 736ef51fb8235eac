package edu.eci.arsw.facilitator.session;

import edu.eci.arsw.facilitator.security.AuthorizationService;

/**
 * Usa el claim {@code sub} de un JWT como identidad.
 */
public class JwtTokenAuthenticator implements TokenAuthenticator {
    private final AuthorizationService authorizationService;

    public JwtTokenAuthenticator(AuthorizationService authorizationService) {
        this.authorizationService = authorizationService;
    }

    @Override
    public String authenticate(String token) {
        return authorizationService.parseBearer(token).userId();
    }
}
