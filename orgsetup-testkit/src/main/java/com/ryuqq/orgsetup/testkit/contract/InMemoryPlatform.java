package com.ryuqq.orgsetup.testkit.contract;

import com.ryuqq.orgsetup.adapter.runner.PlatformServices;
import com.ryuqq.orgsetup.core.exception.ResourceApiException;
import com.ryuqq.orgsetup.core.model.ApiKeyPolicy;
import com.ryuqq.orgsetup.core.model.RequestContext;
import com.ryuqq.orgsetup.core.model.resource.AdminUser;
import com.ryuqq.orgsetup.core.model.resource.AdminUserDraft;
import com.ryuqq.orgsetup.core.model.resource.ApiKey;
import com.ryuqq.orgsetup.core.model.resource.DomainConfig;
import com.ryuqq.orgsetup.core.model.resource.Organization;
import com.ryuqq.orgsetup.core.model.resource.OrganizationDraft;
import com.ryuqq.orgsetup.core.model.resource.Tenant;
import com.ryuqq.orgsetup.core.model.resource.TenantDraft;
import com.ryuqq.orgsetup.core.spi.AdminUserService;
import com.ryuqq.orgsetup.core.spi.ApiKeyService;
import com.ryuqq.orgsetup.core.spi.DomainService;
import com.ryuqq.orgsetup.core.spi.OrganizationService;
import com.ryuqq.orgsetup.core.spi.TenantService;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory fake of the five platform resource APIs.
 *
 * <p>Behaves like the real platform for the cases the orchestrator cares about:</p>
 * <ul>
 *   <li>Subdomains, custom domains and per-tenant admin e-mails are unique; a duplicate
 *       create fails with a 409 {@link ResourceApiException} carrying the existing resource ID</li>
 *   <li>Deleting something that does not exist fails with 404</li>
 *   <li>Every call is recorded in order ({@link #calls()})</li>
 * </ul>
 *
 * <p><strong>Failure injection:</strong></p>
 * <ul>
 *   <li>{@link #failNext(Operation, RuntimeException...)}: the next calls throw the given errors, in order</li>
 *   <li>{@link #failAlways(Operation, RuntimeException)}: every call throws</li>
 *   <li>{@link #beforeCall(Operation, Runnable)}: runs a hook before the call (blocking, interrupting)</li>
 * </ul>
 *
 * <p>All state is guarded by a single monitor; hooks run outside it so a blocked hook
 * does not stall other threads.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryPlatform {

    /**
     * Recorded platform calls.
     */
    public enum Operation {
        CREATE_ORGANIZATION,
        FIND_ORGANIZATION,
        DELETE_ORGANIZATION,
        CREATE_TENANT,
        FIND_TENANT,
        DELETE_TENANT,
        CREATE_ADMIN_USER,
        FIND_ADMIN_USER,
        DELETE_ADMIN_USER,
        GENERATE_API_KEY,
        REVOKE_API_KEY,
        CONFIGURE_DOMAIN,
        FIND_DOMAIN,
        REMOVE_DOMAIN
    }

    private final Object lock = new Object();
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    private final Map<String, Organization> organizations = new LinkedHashMap<>();
    private final Map<String, Tenant> tenants = new LinkedHashMap<>();
    private final Map<String, AdminUser> adminUsers = new LinkedHashMap<>();
    private final Map<String, ApiKey> apiKeys = new LinkedHashMap<>();
    private final Map<String, DomainConfig> domainsByTenant = new LinkedHashMap<>();

    private final List<Operation> calls = new CopyOnWriteArrayList<>();
    private final Map<Operation, Deque<RuntimeException>> scriptedFailures = new EnumMap<>(Operation.class);
    private final Map<Operation, RuntimeException> persistentFailures = new EnumMap<>(Operation.class);
    private final Map<Operation, Runnable> hooks = new EnumMap<>(Operation.class);

    private final PlatformServices services = new PlatformServices(
        new Organizations(), new Tenants(), new AdminUsers(), new ApiKeys(), new Domains()
    );

    public InMemoryPlatform() {
        this(Clock.systemUTC());
    }

    public InMemoryPlatform(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    /**
     * Returns the five services backed by this platform.
     *
     * @return PlatformServices
     */
    public PlatformServices services() {
        return services;
    }

    // ============================================================
    // Failure injection
    // ============================================================

    public void failNext(Operation operation, RuntimeException... errors) {
        synchronized (lock) {
            Deque<RuntimeException> queue = scriptedFailures.computeIfAbsent(operation, o -> new ArrayDeque<>());
            for (RuntimeException error : errors) {
                queue.addLast(error);
            }
        }
    }

    public void failAlways(Operation operation, RuntimeException error) {
        synchronized (lock) {
            persistentFailures.put(operation, error);
        }
    }

    public void beforeCall(Operation operation, Runnable hook) {
        synchronized (lock) {
            hooks.put(operation, hook);
        }
    }

    /**
     * Removes all resources, recorded calls and injected failures.
     */
    public void reset() {
        synchronized (lock) {
            organizations.clear();
            tenants.clear();
            adminUsers.clear();
            apiKeys.clear();
            domainsByTenant.clear();
            scriptedFailures.clear();
            persistentFailures.clear();
            hooks.clear();
            calls.clear();
        }
    }

    // ============================================================
    // Seeding (does not record calls)
    // ============================================================

    public Organization seedOrganization(String name, String subdomain, String customDomain) {
        synchronized (lock) {
            Organization organization = new Organization(nextId("org"), name, subdomain, customDomain);
            organizations.put(organization.id(), organization);
            return organization;
        }
    }

    public Tenant seedTenant(String organizationId, String name, String subdomain) {
        synchronized (lock) {
            Tenant tenant = new Tenant(nextId("tenant"), organizationId, name, subdomain);
            tenants.put(tenant.id(), tenant);
            return tenant;
        }
    }

    public AdminUser seedAdminUser(String tenantId, String name, String email) {
        synchronized (lock) {
            AdminUser user = new AdminUser(nextId("user"), tenantId, name, email, "organization_admin");
            adminUsers.put(user.id(), user);
            return user;
        }
    }

    public DomainConfig seedDomain(String tenantId, String domain) {
        synchronized (lock) {
            DomainConfig config = new DomainConfig(tenantId, domain, false);
            domainsByTenant.put(tenantId, config);
            return config;
        }
    }

    // ============================================================
    // Inspection
    // ============================================================

    public List<Operation> calls() {
        return List.copyOf(calls);
    }

    public long callCount(Operation operation) {
        return calls.stream().filter(operation::equals).count();
    }

    public int organizationCount() {
        synchronized (lock) {
            return organizations.size();
        }
    }

    public int tenantCount() {
        synchronized (lock) {
            return tenants.size();
        }
    }

    public int adminUserCount() {
        synchronized (lock) {
            return adminUsers.size();
        }
    }

    public int activeApiKeyCount() {
        synchronized (lock) {
            return apiKeys.size();
        }
    }

    public int domainCount() {
        synchronized (lock) {
            return domainsByTenant.size();
        }
    }

    /**
     * Whether no resource of any kind exists.
     *
     * @return true if the platform holds nothing
     */
    public boolean isEmpty() {
        synchronized (lock) {
            return organizations.isEmpty() && tenants.isEmpty() && adminUsers.isEmpty()
                && apiKeys.isEmpty() && domainsByTenant.isEmpty();
        }
    }

    // ============================================================
    // Internals
    // ============================================================

    private void intercept(Operation operation) {
        calls.add(operation);
        Runnable hook;
        RuntimeException failure;
        synchronized (lock) {
            hook = hooks.get(operation);
            Deque<RuntimeException> queue = scriptedFailures.get(operation);
            failure = queue == null ? null : queue.pollFirst();
            if (failure == null) {
                failure = persistentFailures.get(operation);
            }
        }
        if (hook != null) {
            hook.run();
        }
        if (failure != null) {
            throw failure;
        }
    }

    private String nextId(String prefix) {
        return prefix + "_" + sequence.incrementAndGet();
    }

    private static boolean same(String left, String right) {
        return left != null && right != null
            && left.trim().toLowerCase(Locale.ROOT).equals(right.trim().toLowerCase(Locale.ROOT));
    }

    private static ResourceApiException conflict(String code, String field, String existingId, String value) {
        return ResourceApiException.conflict(
            code, List.of(field), existingId, Map.of(field, value),
            field + " '" + value + "' is already in use"
        );
    }

    private final class Organizations implements OrganizationService {

        @Override
        public Organization create(RequestContext context, OrganizationDraft draft) {
            intercept(Operation.CREATE_ORGANIZATION);
            synchronized (lock) {
                for (Organization existing : organizations.values()) {
                    if (same(existing.subdomain(), draft.subdomain())) {
                        throw conflict("subdomain_exists", "subdomain", existing.id(), draft.subdomain());
                    }
                    if (same(existing.customDomain(), draft.customDomain())) {
                        throw conflict("domain_exists", "custom_domain", existing.id(), draft.customDomain());
                    }
                }
                Organization organization = new Organization(
                    nextId("org"), draft.name(), draft.subdomain(), draft.customDomain()
                );
                organizations.put(organization.id(), organization);
                return organization;
            }
        }

        @Override
        public Optional<Organization> findById(RequestContext context, String organizationId) {
            intercept(Operation.FIND_ORGANIZATION);
            synchronized (lock) {
                return Optional.ofNullable(organizations.get(organizationId));
            }
        }

        @Override
        public Optional<Organization> findBySubdomain(RequestContext context, String subdomain) {
            intercept(Operation.FIND_ORGANIZATION);
            synchronized (lock) {
                return organizations.values().stream().filter(o -> same(o.subdomain(), subdomain)).findFirst();
            }
        }

        @Override
        public Optional<Organization> findByDomain(RequestContext context, String domain) {
            intercept(Operation.FIND_ORGANIZATION);
            synchronized (lock) {
                return organizations.values().stream().filter(o -> same(o.customDomain(), domain)).findFirst();
            }
        }

        @Override
        public void delete(RequestContext context, String organizationId) {
            intercept(Operation.DELETE_ORGANIZATION);
            synchronized (lock) {
                if (organizations.remove(organizationId) == null) {
                    throw ResourceApiException.notFound("organization " + organizationId + " not found");
                }
            }
        }
    }

    private final class Tenants implements TenantService {

        @Override
        public Tenant create(RequestContext context, String organizationId, TenantDraft draft) {
            intercept(Operation.CREATE_TENANT);
            synchronized (lock) {
                for (Tenant existing : tenants.values()) {
                    if (same(existing.subdomain(), draft.subdomain())) {
                        throw conflict("subdomain_exists", "subdomain", existing.id(), draft.subdomain());
                    }
                }
                Tenant tenant = new Tenant(nextId("tenant"), organizationId, draft.name(), draft.subdomain());
                tenants.put(tenant.id(), tenant);
                return tenant;
            }
        }

        @Override
        public Optional<Tenant> findById(RequestContext context, String tenantId) {
            intercept(Operation.FIND_TENANT);
            synchronized (lock) {
                return Optional.ofNullable(tenants.get(tenantId));
            }
        }

        @Override
        public void delete(RequestContext context, String tenantId) {
            intercept(Operation.DELETE_TENANT);
            synchronized (lock) {
                if (tenants.remove(tenantId) == null) {
                    throw ResourceApiException.notFound("tenant " + tenantId + " not found");
                }
            }
        }
    }

    private final class AdminUsers implements AdminUserService {

        @Override
        public AdminUser create(RequestContext context, String tenantId, AdminUserDraft draft) {
            intercept(Operation.CREATE_ADMIN_USER);
            synchronized (lock) {
                for (AdminUser existing : adminUsers.values()) {
                    if (existing.tenantId().equals(tenantId) && same(existing.email(), draft.email())) {
                        throw conflict("email_exists", "email", existing.id(), draft.email());
                    }
                }
                AdminUser user = new AdminUser(nextId("user"), tenantId, draft.name(), draft.email(), draft.role());
                adminUsers.put(user.id(), user);
                return user;
            }
        }

        @Override
        public Optional<AdminUser> findById(RequestContext context, String userId) {
            intercept(Operation.FIND_ADMIN_USER);
            synchronized (lock) {
                return Optional.ofNullable(adminUsers.get(userId));
            }
        }

        @Override
        public Optional<AdminUser> findByEmail(RequestContext context, String tenantId, String email) {
            intercept(Operation.FIND_ADMIN_USER);
            synchronized (lock) {
                return adminUsers.values().stream()
                    .filter(u -> u.tenantId().equals(tenantId) && same(u.email(), email))
                    .findFirst();
            }
        }

        @Override
        public void delete(RequestContext context, String userId) {
            intercept(Operation.DELETE_ADMIN_USER);
            synchronized (lock) {
                if (adminUsers.remove(userId) == null) {
                    throw ResourceApiException.notFound("user " + userId + " not found");
                }
            }
        }
    }

    private final class ApiKeys implements ApiKeyService {

        @Override
        public ApiKey generate(RequestContext context, String userId, ApiKeyPolicy policy) {
            intercept(Operation.GENERATE_API_KEY);
            synchronized (lock) {
                ApiKey key = new ApiKey(
                    nextId("key"),
                    userId,
                    "sk_live_" + UUID.randomUUID().toString().replace("-", ""),
                    policy.scope(),
                    clock.instant().plus(Duration.ofDays(policy.maxKeyAgeDays()))
                );
                apiKeys.put(key.id(), key);
                return key;
            }
        }

        @Override
        public void revoke(RequestContext context, String keyId) {
            intercept(Operation.REVOKE_API_KEY);
            synchronized (lock) {
                if (apiKeys.remove(keyId) == null) {
                    throw ResourceApiException.notFound("api key " + keyId + " not found");
                }
            }
        }
    }

    private final class Domains implements DomainService {

        @Override
        public DomainConfig configure(RequestContext context, String tenantId, String domain) {
            intercept(Operation.CONFIGURE_DOMAIN);
            synchronized (lock) {
                for (DomainConfig existing : domainsByTenant.values()) {
                    if (same(existing.domain(), domain)) {
                        throw conflict("domain_exists", "domain", existing.tenantId(), domain);
                    }
                }
                DomainConfig config = new DomainConfig(tenantId, domain, false);
                domainsByTenant.put(tenantId, config);
                return config;
            }
        }

        @Override
        public Optional<DomainConfig> find(RequestContext context, String tenantId) {
            intercept(Operation.FIND_DOMAIN);
            synchronized (lock) {
                return Optional.ofNullable(domainsByTenant.get(tenantId));
            }
        }

        @Override
        public void remove(RequestContext context, String tenantId) {
            intercept(Operation.REMOVE_DOMAIN);
            synchronized (lock) {
                if (domainsByTenant.remove(tenantId) == null) {
                    throw ResourceApiException.notFound("domain for tenant " + tenantId + " not found");
                }
            }
        }
    }
}
