package estate.token.error.exception;

import estate.token.error.CommonErrorCode;

public class AuctionNotEndedException extends StateConflictException {
  public AuctionNotEndedException(Long propertyId, long endTime) {
    super(CommonErrorCode.AUCTION_NOT_ENDED, propertyId, endTime);
  }
}
