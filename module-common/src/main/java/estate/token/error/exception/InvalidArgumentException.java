package estate.token.error.exception;

import estate.token.error.CommonErrorCode;
import estate.token.error.exception.base.ClientBaseException;

public class InvalidArgumentException extends ClientBaseException {

  public InvalidArgumentException(String detail) {
    super(CommonErrorCode.INVALID_ARGUMENT, detail);
  }
}
