package estate.token.error.exception;

import estate.token.error.CommonErrorCode;

public class NotPrivilegedException extends AuthorizationException {
  public NotPrivilegedException(String caller) {
    super(CommonErrorCode.NOT_PRIVILEGED, caller);
  }
}
