package io.b2mash.b2b.dynamicfields.actor;

import io.b2mash.b2b.dynamicfields.config.DynamicFieldProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;

/**
 * Reads the {@code user_id} request attribute set by the authentication filter. Outside a request
 * (imports triggered from jobs, tests) or when the attribute is missing or unusable, the system
 * user from {@link DynamicFieldProperties#systemUserId()} is returned.
 */
@Component
public class RequestAttributeActorResolver implements ActorResolver {

  public static final String USER_ID_ATTRIBUTE = "user_id";

  private final long systemUserId;

  public RequestAttributeActorResolver(DynamicFieldProperties properties) {
    this.systemUserId = properties.systemUserId();
  }

  @Override
  public long currentUserId() {
    RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
    if (attributes == null) {
      return systemUserId;
    }
    Object value = attributes.getAttribute(USER_ID_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
    if (value instanceof Number number) {
      return number.longValue();
    }
    if (value instanceof String str && !str.isBlank()) {
      try {
        return Long.parseLong(str.trim());
      } catch (NumberFormatException e) {
        return systemUserId;
      }
    }
    return systemUserId;
  }
}
