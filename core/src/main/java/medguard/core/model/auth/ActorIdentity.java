package medguard.core.model.auth;

import java.util.Optional;

/**
 * Identity claims supplied by the external identity provider.
 *
 * <p>The core does not issue or validate credentials; it only compares the role
 * claim, when present, with the stored access record.
 *
 * @param actorId   the authenticated actor
 * @param roleClaim the role asserted by the identity provider, if any
 */
public record ActorIdentity(String actorId, Optional<String> roleClaim) {

    public ActorIdentity {
        if (roleClaim == null) {
            roleClaim = Optional.empty();
        }
    }

    public static ActorIdentity of(String actorId) {
        return new ActorIdentity(actorId, Optional.empty());
    }

    public static ActorIdentity withRole(String actorId, String roleClaim) {
        return new ActorIdentity(actorId, Optional.ofNullable(roleClaim));
    }
}
