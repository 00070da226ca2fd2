package com.scanhub.pairing.identity;

/**
 * Resolved identity of a connecting user.
 *
 * @param login    identity key
 * @param id       optional numeric id from the user directory
 * @param fullName optional display name
 */
public record IdentityMetadata(String login, Long id, String fullName) {

    public static IdentityMetadata ofLogin(String login) {
        return new IdentityMetadata(login, null, null);
    }
}
