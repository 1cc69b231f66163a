package medguard.core.service.auth;

import java.time.Clock;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import medguard.core.model.auth.Role;
import medguard.core.port.out.RoleRepository;

/**
 * The built-in medical roles seeded at startup.
 *
 * <p>Seeding never overwrites: a role whose id already exists is left as is, so
 * operator changes to a built-in role survive restarts.
 */
@ApplicationScoped
public class DefaultRoleCatalog {

    private static final Logger LOG = Logger.getLogger(DefaultRoleCatalog.class);

    public static final String CHIEF_RADIOLOGY = "chief-radiology";
    public static final String ATTENDING_RADIOLOGIST = "attending-radiologist";
    public static final String RADIOLOGY_RESIDENT = "radiology-resident";
    public static final String SYSTEM_ADMIN = "system-admin";
    public static final String EMERGENCY_PHYSICIAN = "emergency-physician";
    public static final String COMPLIANCE_OFFICER = "compliance-officer";

    private final RoleRepository repository;
    private final Clock clock;
    private final List<Definition> definitions;

    @Inject
    public DefaultRoleCatalog(RoleRepository repository) {
        this(repository, Clock.systemUTC());
    }

    public DefaultRoleCatalog(RoleRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
        this.definitions = List.of(
                new Definition(
                        CHIEF_RADIOLOGY,
                        "Full access to imaging, reporting and department administration",
                        List.of("imaging:*", "report:*", "patient:data:read", "user:manage", "audit:log:read")),
                new Definition(
                        ATTENDING_RADIOLOGIST,
                        "Reads studies, annotates and signs reports",
                        List.of(
                                "imaging:study:*",
                                "imaging:annotation:*",
                                "report:create",
                                "report:approve",
                                "patient:data:read")),
                new Definition(
                        RADIOLOGY_RESIDENT,
                        "Supervised imaging access with draft reporting",
                        List.of("imaging:study:read", "imaging:annotation:create", "report:create:draft")),
                new Definition(SYSTEM_ADMIN, "Unrestricted platform administration", List.of("*")),
                new Definition(
                        EMERGENCY_PHYSICIAN,
                        "Urgent clinical access to patient data and studies",
                        List.of("patient:data:read", "patient:data:write", "imaging:study:read")),
                new Definition(
                        COMPLIANCE_OFFICER,
                        "Audit trail and security oversight",
                        List.of("audit:*", "security:threat:read", "security:incident:*", "report:read")));
    }

    /**
     * The catalog entries, in seeding order.
     */
    public List<Definition> definitions() {
        return definitions;
    }

    /**
     * Insert every catalog role whose id is not taken yet.
     *
     * @return the number of roles inserted
     */
    public int seed() {
        final var now = clock.instant();
        var inserted = 0;
        for (var definition : definitions) {
            if (repository.insert(Role.of(definition.id(), definition.description(), definition.permissions(), now))) {
                inserted++;
            } else {
                LOG.debugf("Built-in role %s already present, leaving it unchanged", definition.id());
            }
        }
        LOG.infof("Seeded %d of %d built-in role(s)", inserted, definitions.size());
        return inserted;
    }

    /**
     * A built-in role definition.
     *
     * @param id          role identifier
     * @param description human-readable description
     * @param permissions permission patterns
     */
    public record Definition(String id, String description, List<String> permissions) {}
}
