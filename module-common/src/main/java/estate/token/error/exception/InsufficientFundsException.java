package estate.token.error.exception;

import estate.token.error.CommonErrorCode;

/** 호출자 계정 잔액이 첨부하려는 금액보다 적을 때 */
public class InsufficientFundsException extends InsufficientPaymentException {
  public InsufficientFundsException(String account, long required) {
    super(CommonErrorCode.INSUFFICIENT_FUNDS, account, required);
  }
}
