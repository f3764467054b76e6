package estate.token.error.exception;

import estate.token.error.CommonErrorCode;
import estate.token.error.exception.base.ServerBaseException;

/** 매물 단위 배타 구간(락) 획득 실패 시 발생하는 서버 예외 */
public class DistributedLockException extends ServerBaseException {

  public DistributedLockException(String detail) {
    super(CommonErrorCode.LOCK_FAILURE, detail);
  }

  public DistributedLockException(String detail, Throwable cause) {
    super(CommonErrorCode.LOCK_FAILURE, cause, detail);
  }
}
