package estate.token.error.exception;

import estate.token.error.CommonErrorCode;

public class AuctionAlreadyEndedException extends StateConflictException {
  public AuctionAlreadyEndedException(Long propertyId) {
    super(CommonErrorCode.AUCTION_ALREADY_ENDED, propertyId);
  }
}
