package estate.token.error.exception;

import estate.token.error.CommonErrorCode;

public class NotAuthorizedException extends AuthorizationException {
  public NotAuthorizedException(Long propertyId, String caller) {
    super(CommonErrorCode.NOT_AUTHORIZED, propertyId, caller);
  }
}
