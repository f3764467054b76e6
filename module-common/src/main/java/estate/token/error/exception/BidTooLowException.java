package estate.token.error.exception;

import estate.token.error.CommonErrorCode;

public class BidTooLowException extends InsufficientPaymentException {
  public BidTooLowException(long bid, long highBid, long startPrice) {
    super(CommonErrorCode.BID_TOO_LOW, bid, highBid, startPrice);
  }
}
