package medguard.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import medguard.adapter.out.storage.memory.InMemoryAccessControlRepository;
import medguard.adapter.out.storage.memory.InMemoryIncidentRepository;
import medguard.adapter.out.storage.memory.InMemoryRoleRepository;
import medguard.adapter.out.storage.memory.InMemoryThreatRepository;
import medguard.core.port.out.AccessControlRepository;
import medguard.core.port.out.IncidentRepository;
import medguard.core.port.out.RoleRepository;
import medguard.core.port.out.ThreatRepository;

/**
 * CDI producer for the in-memory repositories.
 *
 * <p>The core evaluates requests against in-memory state only. Deployments that need
 * durable storage replace these beans with alternatives that write through to their
 * store outside the request path.
 */
@ApplicationScoped
public class InMemoryStorageProducer {

    @Produces
    @ApplicationScoped
    public RoleRepository roleRepository() {
        return new InMemoryRoleRepository();
    }

    @Produces
    @ApplicationScoped
    public AccessControlRepository accessControlRepository() {
        return new InMemoryAccessControlRepository();
    }

    @Produces
    @ApplicationScoped
    public ThreatRepository threatRepository() {
        return new InMemoryThreatRepository();
    }

    @Produces
    @ApplicationScoped
    public IncidentRepository incidentRepository() {
        return new InMemoryIncidentRepository();
    }
}
