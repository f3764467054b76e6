package estate.token.error.exception;

import estate.token.error.ErrorCode;
import estate.token.error.exception.base.ClientBaseException;

public abstract class NotFoundException extends ClientBaseException {

  protected NotFoundException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
