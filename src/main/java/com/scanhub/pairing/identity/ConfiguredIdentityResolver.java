package com.scanhub.pairing.identity;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.scanhub.pairing.config.PairingHubProperties;
import com.scanhub.pairing.config.PairingHubProperties.KnownUser;

import lombok.extern.slf4j.Slf4j;

/**
 * Resolves logins against the users listed under {@code scanhub.pairing.identity.users}.
 *
 * With {@code accept-unknown} enabled any non-blank login is accepted and, when not
 * listed, resolved with its login as display name.
 */
@Component
@Slf4j
public class ConfiguredIdentityResolver implements IdentityResolver {

    private final Map<String, KnownUser> knownUsers;
    private final boolean acceptUnknown;

    public ConfiguredIdentityResolver(PairingHubProperties properties) {
        this.knownUsers = properties.getIdentity().getUsers().stream()
                .filter(user -> user.getLogin() != null && !user.getLogin().isBlank())
                .collect(Collectors.toUnmodifiableMap(KnownUser::getLogin, Function.identity(), (a, b) -> a));
        this.acceptUnknown = properties.getIdentity().isAcceptUnknown();
        log.info("IDENTITY: {} known user(s), accept unknown: {}", knownUsers.size(), acceptUnknown);
    }

    @Override
    public Optional<IdentityMetadata> resolve(String login) {
        if (login == null || login.isBlank()) {
            return Optional.empty();
        }
        KnownUser user = knownUsers.get(login);
        if (user != null) {
            String fullName = user.getFullName() != null ? user.getFullName() : login;
            return Optional.of(new IdentityMetadata(login, user.getId(), fullName));
        }
        if (acceptUnknown) {
            return Optional.of(new IdentityMetadata(login, null, login));
        }
        log.debug("IDENTITY: Unknown login {} rejected", login);
        return Optional.empty();
    }
}
