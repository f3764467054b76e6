package estate.token.error.exception;

import estate.token.error.CommonErrorCode;

public class RentalNotListedException extends NotFoundException {
  public RentalNotListedException(Long propertyId) {
    super(CommonErrorCode.RENTAL_NOT_LISTED, propertyId);
  }
}
