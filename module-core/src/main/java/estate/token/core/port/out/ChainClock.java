package estate.token.core.port.out;

/**
 * 단조 증가 시계 Port
 *
 * <p>연속된 연산 사이에서 절대 감소하지 않는 epoch seconds를 반환합니다. 임대/경매 만료는 이 값으로 조회 시점에 계산됩니다.
 */
public interface ChainClock {

  long now();
}
