package estate.token.error.exception;

import estate.token.error.CommonErrorCode;

public class PropertyNotFoundException extends NotFoundException {
  public PropertyNotFoundException(Long propertyId) {
    super(CommonErrorCode.PROPERTY_NOT_FOUND, propertyId);
  }
}
