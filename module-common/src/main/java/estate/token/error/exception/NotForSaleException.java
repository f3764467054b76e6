package estate.token.error.exception;

import estate.token.error.CommonErrorCode;

public class NotForSaleException extends StateConflictException {
  public NotForSaleException(Long propertyId) {
    super(CommonErrorCode.NOT_FOR_SALE, propertyId);
  }
}
