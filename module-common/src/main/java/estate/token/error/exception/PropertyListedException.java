package estate.token.error.exception;

import estate.token.error.CommonErrorCode;

public class PropertyListedException extends StateConflictException {
  public PropertyListedException(Long propertyId) {
    super(CommonErrorCode.PROPERTY_LISTED, propertyId);
  }
}
