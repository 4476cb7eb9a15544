package io.buildunion.factcore.context;

import io.buildunion.factcore.exception.MissingActorContextException;
import java.util.UUID;

/**
 * Request-scoped identity of the acting member. Bound by {@link ActorContextFilter} for the
 * duration of one request and cleared when the request completes.
 */
public final class RequestScopes {

  private static final ThreadLocal<UUID> MEMBER_ID = new ThreadLocal<>();

  private RequestScopes() {}

  public static void bindMemberId(UUID memberId) {
    MEMBER_ID.set(memberId);
  }

  /** Returns the current member's UUID. Throws if not bound by the filter chain. */
  public static UUID requireMemberId() {
    UUID memberId = MEMBER_ID.get();
    if (memberId == null) {
      throw new MissingActorContextException();
    }
    return memberId;
  }

  /** Returns the current member's UUID, or null if not bound. */
  public static UUID getMemberIdOrNull() {
    return MEMBER_ID.get();
  }

  public static void clear() {
    MEMBER_ID.remove();
  }
}
