package estate.token.core.port.out;

/**
 * 네이티브 통화 이동 Port
 *
 * <p>호출자가 요청에 첨부한 금액은 {@link #collect}로 보관 계정(vault)에 들어오고, 정산 대상에게는 {@link #push}로 지급됩니다. 어느
 * 쪽이든 실패하면 예외를 던져 감싸고 있는 연산 전체가 롤백되어야 합니다.
 *
 * <p><b>순서 규칙:</b> 엔진은 모든 내부 상태 변경을 끝낸 뒤에만 {@link #push}를 호출합니다. 수신 측이 이 시스템으로 중첩 호출을 하더라도
 * 일관된 상태만 관찰하게 하기 위함입니다.
 */
public interface ValueTransferPort {

  /**
   * 첨부 금액 수납 (호출자 → vault)
   *
   * @throws estate.token.error.exception.InsufficientFundsException 호출자 잔액 부족
   */
  void collect(String from, long amount);

  /** 지급 (vault → 수신자) */
  void push(String to, long amount);
}
