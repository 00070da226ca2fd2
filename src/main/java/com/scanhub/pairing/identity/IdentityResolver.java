package com.scanhub.pairing.identity;

import java.util.Optional;

/**
 * Looks up who a login belongs to.
 */
public interface IdentityResolver {

    /**
     * @param login identity key from the register message or the bearer credential
     * @return the identity, or empty if the login is not allowed to connect
     */
    Optional<IdentityMetadata> resolve(String login);
}
