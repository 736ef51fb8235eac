package edu.eci.arsw.facilitator.domain;

public enum Visibility {
    /** Aparece en los listados y admite unirse por criterio. */
    PUBLIC,
    /** Solo se puede unir con el id. */
    PRIVATE,
    /** Aparece en los listados; unirse exige contraseña. */
    PASSWORD
}
