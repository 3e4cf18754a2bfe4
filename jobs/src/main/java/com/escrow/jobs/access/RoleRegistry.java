package com.escrow.jobs.access;

import com.escrow.jobs.exceptions.UnauthorizedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Membership rules shared by every registry backend. Subclasses supply the three storage
 * primitives.
 */
public abstract class RoleRegistry implements Authorizer {

  private static final Logger log = LoggerFactory.getLogger(RoleRegistry.class);

  protected abstract boolean contains(String callerId, Role role);

  protected abstract void add(String callerId, Role role);

  protected abstract void remove(String callerId, Role role);

  @Override
  public boolean hasRole(String callerId, Role role) {
    return callerId != null && !callerId.isBlank() && contains(callerId, role);
  }

  @Override
  public void grantSelf(String callerId, Role role) throws UnauthorizedException {
    if (!role.isSelfGrantable()) {
      throw new UnauthorizedException(role.value() + " role cannot be self-granted");
    }
    if (callerId == null || callerId.isBlank()) {
      throw new UnauthorizedException("Caller identity is required");
    }
    if (!contains(callerId, role)) {
      add(callerId, role);
      log.info("RoleGranted callerId={} role={} grantedBy=self", callerId, role.value());
    }
  }

  @Override
  public void seedAdministrator(String adminId) {
    if (adminId == null || adminId.isBlank()) {
      throw new IllegalArgumentException("Bootstrap administrator id is required");
    }
    if (!contains(adminId, Role.ADMINISTRATOR)) {
      add(adminId, Role.ADMINISTRATOR);
      log.info("AdministratorSeeded callerId={}", adminId);
    }
  }

  @Override
  public void grantRole(String adminId, String targetId, Role role) throws UnauthorizedException {
    requireRole(adminId, Role.ADMINISTRATOR);
    if (targetId == null || targetId.isBlank()) {
      throw new IllegalArgumentException("Target identity is required");
    }
    if (!contains(targetId, role)) {
      add(targetId, role);
      log.info("RoleGranted callerId={} role={} grantedBy={}", targetId, role.value(), adminId);
    }
  }

  @Override
  public void revokeRole(String adminId, String targetId, Role role) throws UnauthorizedException {
    requireRole(adminId, Role.ADMINISTRATOR);
    if (role == Role.ADMINISTRATOR && adminId.equals(targetId)) {
      throw new UnauthorizedException("Administrators cannot revoke their own Administrator role");
    }
    if (contains(targetId, role)) {
      remove(targetId, role);
      log.info("RoleRevoked callerId={} role={} revokedBy={}", targetId, role.value(), adminId);
    }
  }
}
