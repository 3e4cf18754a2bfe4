package com.escrow.jobs.access;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** Process-local role registry, used when the ledger is embedded and in tests */
public class InMemoryRoleRegistry extends RoleRegistry {

  private final Map<String, Set<Role>> memberships = new ConcurrentHashMap<>();

  @Override
  protected boolean contains(String callerId, Role role) {
    Set<Role> roles = memberships.get(callerId);
    return roles != null && roles.contains(role);
  }

  @Override
  protected void add(String callerId, Role role) {
    memberships.compute(callerId, (id, roles) -> {
      Set<Role> updated = roles == null ? EnumSet.noneOf(Role.class) : EnumSet.copyOf(roles);
      updated.add(role);
      return updated;
    });
  }

  @Override
  protected void remove(String callerId, Role role) {
    memberships.computeIfPresent(callerId, (id, roles) -> {
      Set<Role> updated = EnumSet.copyOf(roles);
      updated.remove(role);
      return updated.isEmpty() ? null : updated;
    });
  }
}
