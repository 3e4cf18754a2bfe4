package com.escrow.jobs.access;

import com.escrow.jobs.exceptions.UnauthorizedException;

/**
 * Role membership keyed by (caller identity, role).
 *
 * <p>Client and Freelancer standing is self-service. Administrator standing is seeded once for
 * the initializing identity and afterwards managed only by existing administrators.
 */
public interface Authorizer {

  boolean hasRole(String callerId, Role role);

  /**
   * Grants Client or Freelancer standing to the caller. Idempotent.
   *
   * @throws UnauthorizedException if {@code role} is Administrator
   */
  void grantSelf(String callerId, Role role) throws UnauthorizedException;

  /** Bootstrap path: makes {@code adminId} an Administrator without any check. */
  void seedAdministrator(String adminId);

  void grantRole(String adminId, String targetId, Role role) throws UnauthorizedException;

  /**
   * @throws UnauthorizedException if the caller is not an Administrator, or tries to drop their
   *     own Administrator standing
   */
  void revokeRole(String adminId, String targetId, Role role) throws UnauthorizedException;

  default void requireRole(String callerId, Role role) throws UnauthorizedException {
    if (callerId == null || !hasRole(callerId, role)) {
      throw new UnauthorizedException("Caller " + callerId + " does not hold the " + role.value() + " role");
    }
  }
}
