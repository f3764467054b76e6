package estate.token.error.exception;

import estate.token.error.CommonErrorCode;

public class AuctionNotFoundException extends NotFoundException {
  public AuctionNotFoundException(Long propertyId) {
    super(CommonErrorCode.AUCTION_NOT_FOUND, propertyId);
  }
}
