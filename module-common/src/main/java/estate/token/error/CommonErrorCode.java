package estate.token.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Authorization (403) ===
  NOT_AUTHORIZED("A001", "권한이 없습니다 (propertyId: %s, caller: %s)", HttpStatus.FORBIDDEN),
  NOT_TITLE_HOLDER("A002", "소유자만 수행할 수 있습니다 (propertyId: %s, caller: %s)", HttpStatus.FORBIDDEN),
  NOT_PRIVILEGED("A003", "특권 계정만 수행할 수 있습니다 (caller: %s)", HttpStatus.FORBIDDEN),
  NOT_RENTER("A004", "현재 임차인만 연장할 수 있습니다 (propertyId: %s, caller: %s)", HttpStatus.FORBIDDEN),

  // === Invalid Argument (400) ===
  INVALID_ARGUMENT("V001", "잘못된 입력값입니다: %s", HttpStatus.BAD_REQUEST),

  // === State Conflict (409) ===
  PROPERTY_RENTED("S101", "임대 중인 매물입니다 (propertyId: %s)", HttpStatus.CONFLICT),
  NOT_FOR_SALE("S102", "판매 중인 매물이 아닙니다 (propertyId: %s)", HttpStatus.CONFLICT),
  PROPERTY_LISTED("S103", "이미 판매 등록된 매물입니다 (propertyId: %s)", HttpStatus.CONFLICT),
  AUCTION_EXISTS("S104", "이미 경매 기록이 존재합니다 (propertyId: %s)", HttpStatus.CONFLICT),
  AUCTION_CLOSED("S105", "마감된 경매입니다 (propertyId: %s)", HttpStatus.CONFLICT),
  AUCTION_NOT_ENDED("S106", "경매 종료 시각 전입니다 (propertyId: %s, endTime: %s)", HttpStatus.CONFLICT),
  AUCTION_ALREADY_ENDED("S107", "이미 종료 처리된 경매입니다 (propertyId: %s)", HttpStatus.CONFLICT),

  // === Insufficient Payment (402) ===
  INSUFFICIENT_PAYMENT("P001", "첨부 금액이 부족합니다 (필요: %s, 첨부: %s)", HttpStatus.PAYMENT_REQUIRED),
  BID_TOO_LOW("P002", "입찰가가 너무 낮습니다 (입찰: %s, 현재 최고가: %s, 시작가: %s)", HttpStatus.PAYMENT_REQUIRED),
  INSUFFICIENT_FUNDS("P003", "계정 잔액이 부족합니다 (account: %s, 필요: %s)", HttpStatus.PAYMENT_REQUIRED),

  // === Not Found (404) ===
  PROPERTY_NOT_FOUND("N001", "존재하지 않는 매물입니다 (propertyId: %s)", HttpStatus.NOT_FOUND),
  OFFER_NOT_FOUND("N002", "유효한 오퍼가 없습니다 (propertyId: %s, bidder: %s)", HttpStatus.NOT_FOUND),
  RENTAL_NOT_LISTED("N003", "임대 등록되지 않은 매물입니다 (propertyId: %s)", HttpStatus.NOT_FOUND),
  AUCTION_NOT_FOUND("N004", "경매가 존재하지 않습니다 (propertyId: %s)", HttpStatus.NOT_FOUND),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR("S001", "서버 내부 오류가 발생했습니다.", HttpStatus.INTERNAL_SERVER_ERROR),
  LOCK_FAILURE("S002", "락 획득에 실패했습니다: %s", HttpStatus.INTERNAL_SERVER_ERROR),
  DATA_PROCESSING_ERROR("S003", "데이터 처리 중 오류 발생 (%s)", HttpStatus.INTERNAL_SERVER_ERROR);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
