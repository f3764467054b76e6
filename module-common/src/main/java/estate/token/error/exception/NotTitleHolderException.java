package estate.token.error.exception;

import estate.token.error.CommonErrorCode;

public class NotTitleHolderException extends AuthorizationException {
  public NotTitleHolderException(Long propertyId, String caller) {
    super(CommonErrorCode.NOT_TITLE_HOLDER, propertyId, caller);
  }
}
