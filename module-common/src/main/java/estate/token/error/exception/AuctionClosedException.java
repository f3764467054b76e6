package estate.token.error.exception;

import estate.token.error.CommonErrorCode;

public class AuctionClosedException extends StateConflictException {
  public AuctionClosedException(Long propertyId) {
    super(CommonErrorCode.AUCTION_CLOSED, propertyId);
  }
}
