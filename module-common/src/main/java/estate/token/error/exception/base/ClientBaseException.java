package estate.token.error.exception.base;

import estate.token.error.ErrorCode;

/**
 * ClientBaseException: 호출자의 요청이 매물의 현재 상태와 맞지 않을 때 발생하는 '비즈니스 예외' 4xx 계열의 에러를 처리하며, 호출자에게 구체적인 실패
 * 원인을 전달하는 것이 목적입니다.
 */
public abstract class ClientBaseException extends BaseException {

  protected ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  // "존재하지 않는 매물입니다 (propertyId: %s)"와 같은 메시지 완성용
  protected ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
