package estate.token.error.dto;

import estate.token.error.ErrorCode;
import estate.token.error.exception.base.BaseException;
import java.time.LocalDateTime;
import lombok.Builder;
import org.springframework.http.ResponseEntity;

public record ErrorResponse(int status, String code, String message, LocalDateTime timestamp) {

  @Builder
  public ErrorResponse {}

  /**
   * BaseException을 받는 경우 (비즈니스 예외)
   *
   * <p>e.getMessage()를 통해 동적으로 가공된 메시지(예: 어떤 매물/계정인지)를 전달합니다.
   */
  public static ResponseEntity<ErrorResponse> toResponseEntity(BaseException e) {
    return ResponseEntity.status(e.getErrorCode().getStatus())
        .body(
            ErrorResponse.builder()
                .status(e.getErrorCode().getStatus().value())
                .code(e.getErrorCode().getCode())
                .message(e.getMessage())
                .timestamp(LocalDateTime.now())
                .build());
  }

  /**
   * ErrorCode를 직접 받는 경우 (예상치 못한 서버 예외)
   *
   * <p>Enum에 정의된 기본 메시지를 사용하며, 상세한 에러 내용은 보안을 위해 숨깁니다.
   */
  public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode, Object... args) {
    return ResponseEntity.status(errorCode.getStatus())
        .body(
            ErrorResponse.builder()
                .status(errorCode.getStatus().value())
                .code(errorCode.getCode())
                .message(String.format(errorCode.getMessage(), args))
                .timestamp(LocalDateTime.now())
                .build());
  }
}
