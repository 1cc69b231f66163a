package medguard.core.service.auth;

import java.util.Collection;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import medguard.core.model.permission.Permission;

/**
 * Evaluates granted permission patterns against a requested capability.
 *
 * <p>Matching is pure and allocation-free: both sides are already padded to three
 * segments by {@link Permission#parse(String)}. A granted segment of {@code *}
 * matches any requested value at that position, and because trailing segments
 * are padded with wildcards, {@code imaging:*} matches {@code imaging:study:read}.
 * The bare {@code *} pattern matches everything.
 *
 * <p>Restrictions use {@link #overlaps(Permission, Permission)} instead, where a
 * wildcard on either side matches, so a request such as {@code patient:data:*}
 * collides with a restriction on {@code patient:data:read}.
 */
@ApplicationScoped
public class PermissionMatcher {

    /**
     * Test a single granted pattern against a requested permission.
     *
     * @param granted   the granted pattern
     * @param requested the requested capability
     * @return true if the grant covers the request
     */
    public boolean matches(Permission granted, Permission requested) {
        if (granted.isSuperuser()) {
            return true;
        }
        for (var i = 0; i < Permission.DEPTH; i++) {
            final var grantedSegment = granted.segment(i);
            if (!Permission.WILDCARD.equals(grantedSegment) && !grantedSegment.equals(requested.segment(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Test a requested permission against a set of grants (logical OR).
     *
     * @param granted   the granted patterns
     * @param requested the requested capability
     * @return true if any grant covers the request
     */
    public boolean anyMatches(Collection<Permission> granted, Permission requested) {
        return firstMatch(granted, requested).isPresent();
    }

    /**
     * Find the first grant that covers a request.
     *
     * @param granted   the granted patterns, iterated in their own order
     * @param requested the requested capability
     * @return the covering pattern, if any
     */
    public Optional<Permission> firstMatch(Collection<Permission> granted, Permission requested) {
        if (granted == null || granted.isEmpty()) {
            return Optional.empty();
        }
        for (var permission : granted) {
            if (matches(permission, requested)) {
                return Optional.of(permission);
            }
        }
        return Optional.empty();
    }

    /**
     * Test whether two patterns could both cover some concrete capability.
     *
     * @param first  one pattern
     * @param second the other pattern
     * @return true if every segment pair is equal or has a wildcard on either side
     */
    public boolean overlaps(Permission first, Permission second) {
        if (first.isSuperuser() || second.isSuperuser()) {
            return true;
        }
        for (var i = 0; i < Permission.DEPTH; i++) {
            final var a = first.segment(i);
            final var b = second.segment(i);
            if (!Permission.WILDCARD.equals(a) && !Permission.WILDCARD.equals(b) && !a.equals(b)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Find the first restriction that overlaps a request.
     *
     * @param restrictions the restriction patterns, iterated in their own order
     * @param requested    the requested capability, possibly containing wildcards
     * @return the overlapping restriction, if any
     */
    public Optional<Permission> firstOverlap(Collection<Permission> restrictions, Permission requested) {
        if (restrictions == null || restrictions.isEmpty()) {
            return Optional.empty();
        }
        for (var restriction : restrictions) {
            if (overlaps(restriction, requested)) {
                return Optional.of(restriction);
            }
        }
        return Optional.empty();
    }
}
