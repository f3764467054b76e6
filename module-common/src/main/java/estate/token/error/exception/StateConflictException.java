package estate.token.error.exception;

import estate.token.error.ErrorCode;
import estate.token.error.exception.base.ClientBaseException;

/** 매물이 이미 요청과 양립할 수 없는 상업적 상태(임대 중, 판매 중, 경매 진행/종료)에 있을 때의 예외 계열 */
public abstract class StateConflictException extends ClientBaseException {

  protected StateConflictException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
