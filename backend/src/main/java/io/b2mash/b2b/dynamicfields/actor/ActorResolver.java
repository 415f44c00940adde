package io.b2mash.b2b.dynamicfields.actor;

/**
 * Resolves the id of the user performing the current operation, used to stamp the
 * {@code create_by}/{@code change_by} audit columns. Authentication itself happens outside the
 * engine; implementations only read what the authentication layer left behind.
 */
public interface ActorResolver {

  /** Returns the acting user's id, or the configured system user when none is bound. */
  long currentUserId();
}
