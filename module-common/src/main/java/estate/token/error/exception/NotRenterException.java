package estate.token.error.exception;

import estate.token.error.CommonErrorCode;

public class NotRenterException extends AuthorizationException {
  public NotRenterException(Long propertyId, String caller) {
    super(CommonErrorCode.NOT_RENTER, propertyId, caller);
  }
}
