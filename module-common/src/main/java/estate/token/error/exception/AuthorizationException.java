package estate.token.error.exception;

import estate.token.error.ErrorCode;
import estate.token.error.exception.base.ClientBaseException;

/** 호출자에게 필요한 역할(소유자, 관리자, 특권 계정, 임차인)이 없을 때의 예외 계열 */
public abstract class AuthorizationException extends ClientBaseException {

  protected AuthorizationException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
