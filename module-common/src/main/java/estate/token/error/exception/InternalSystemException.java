package estate.token.error.exception;

import estate.token.error.CommonErrorCode;
import estate.token.error.exception.base.ServerBaseException;

/** 관리되지 않은 기술적 예외를 규격화할 때 사용 (원본 cause 보존) */
public class InternalSystemException extends ServerBaseException {

  public InternalSystemException(String taskName, Throwable cause) {
    super(CommonErrorCode.DATA_PROCESSING_ERROR, cause, taskName);
  }

  public InternalSystemException(String detail) {
    super(CommonErrorCode.DATA_PROCESSING_ERROR, detail);
  }
}
