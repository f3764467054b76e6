package estate.token.global.error;

import estate.token.error.CommonErrorCode;
import estate.token.error.dto.ErrorResponse;
import estate.token.error.exception.base.BaseException;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  /** 비즈니스 예외 (동적 메시지 포함) */
  @ExceptionHandler(BaseException.class)
  protected ResponseEntity<ErrorResponse> handleBaseException(BaseException e) {
    log.warn("Business Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
    return ErrorResponse.toResponseEntity(e);
  }

  /** @Valid 검증 실패 */
  @ExceptionHandler(MethodArgumentNotValidException.class)
  protected ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
    String detail =
        e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    log.warn("Validation Failed: {}", detail);
    return ErrorResponse.toResponseEntity(CommonErrorCode.INVALID_ARGUMENT, detail);
  }

  /**
   * 헤더/경로 변수 제약 위반 (@Size 등)
   *
   * <p>파라미터에 제약이 있으면 같은 메서드의 @Valid 본문 오류도 이 예외로 함께 전달됩니다.
   */
  @ExceptionHandler(HandlerMethodValidationException.class)
  protected ResponseEntity<ErrorResponse> handleMethodValidation(
      HandlerMethodValidationException e) {
    String detail =
        e.getAllValidationResults().stream()
            .flatMap(result -> result.getResolvableErrors().stream())
            .map(MessageSourceResolvable::getDefaultMessage)
            .collect(Collectors.joining(", "));
    log.warn("Parameter Validation Failed: {}", detail);
    return ErrorResponse.toResponseEntity(CommonErrorCode.INVALID_ARGUMENT, detail);
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  protected ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
    log.warn("Missing Header: {}", e.getHeaderName());
    return ErrorResponse.toResponseEntity(
        CommonErrorCode.INVALID_ARGUMENT, e.getHeaderName() + " 헤더가 필요합니다");
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class
  })
  protected ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
    log.warn("Malformed Request: {}", e.getMessage());
    return ErrorResponse.toResponseEntity(CommonErrorCode.INVALID_ARGUMENT, "요청 형식이 올바르지 않습니다");
  }

  /** 예측하지 못한 시스템 예외. 상세 메시지는 숨기고 규격화된 공통 코드를 넘깁니다. */
  @ExceptionHandler(Exception.class)
  protected ResponseEntity<ErrorResponse> handleException(Exception e) {
    log.error("Unexpected System Failure: ", e);
    return ErrorResponse.toResponseEntity(CommonErrorCode.INTERNAL_SERVER_ERROR);
  }
}
