package estate.token.error.exception;

import estate.token.error.CommonErrorCode;

public class OfferNotFoundException extends NotFoundException {
  public OfferNotFoundException(Long propertyId, String bidder) {
    super(CommonErrorCode.OFFER_NOT_FOUND, propertyId, bidder);
  }
}
