package estate.token.error.exception;

import estate.token.error.CommonErrorCode;
import estate.token.error.ErrorCode;
import estate.token.error.exception.base.ClientBaseException;

/**
 * 첨부 금액 부족 예외
 *
 * <p>CommonErrorCode.INSUFFICIENT_PAYMENT 메시지 형식: "첨부 금액이 부족합니다 (필요: %s, 첨부: %s)"
 */
public class InsufficientPaymentException extends ClientBaseException {

  public InsufficientPaymentException(long required, long attached) {
    super(CommonErrorCode.INSUFFICIENT_PAYMENT, required, attached);
  }

  protected InsufficientPaymentException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
