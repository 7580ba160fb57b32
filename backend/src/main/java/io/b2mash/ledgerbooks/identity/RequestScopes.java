package io.b2mash.ledgerbooks.identity;

import io.b2mash.ledgerbooks.exception.MissingIdentityException;
import java.util.UUID;

/**
 * Request-scoped identity of the caller. Bound by {@link IdentityFilter} for the duration of the
 * filter chain and cleared when the request completes.
 */
public final class RequestScopes {

  private static final ThreadLocal<Actor> CURRENT_ACTOR = new ThreadLocal<>();

  private RequestScopes() {}

  public static void bind(Actor actor) {
    CURRENT_ACTOR.set(actor);
  }

  public static void clear() {
    CURRENT_ACTOR.remove();
  }

  public static boolean isBound() {
    return CURRENT_ACTOR.get() != null;
  }

  /** Returns the current actor. Throws if the filter chain did not bind one. */
  public static Actor requireActor() {
    Actor actor = CURRENT_ACTOR.get();
    if (actor == null) {
      throw new MissingIdentityException();
    }
    return actor;
  }

  /** Returns the current user's id, or null if not bound. */
  public static UUID getUserIdOrNull() {
    Actor actor = CURRENT_ACTOR.get();
    return actor != null ? actor.userId() : null;
  }
}
