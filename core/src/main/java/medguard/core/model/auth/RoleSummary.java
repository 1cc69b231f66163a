package medguard.core.model.auth;

/**
 * A role together with counts computed from live data at read time.
 *
 * @param role            the role
 * @param memberCount     number of actors currently assigned the role
 * @param permissionCount number of distinct permission patterns on the role
 */
public record RoleSummary(Role role, int memberCount, int permissionCount) {

    public static RoleSummary of(Role role, long memberCount) {
        return new RoleSummary(role, Math.toIntExact(memberCount), role.permissions().size());
    }
}
