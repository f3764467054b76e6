package estate.token.error.exception;

import estate.token.error.CommonErrorCode;

public class PropertyRentedException extends StateConflictException {
  public PropertyRentedException(Long propertyId) {
    super(CommonErrorCode.PROPERTY_RENTED, propertyId);
  }
}
