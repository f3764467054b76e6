package estate.token.infrastructure.persistence.entity;

import estate.token.domain.model.InputLimits;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 네이티브 통화 잔액
 *
 * <p>행 생성과 잔액 변경은 {@code AccountRepository}의 upsert와 원자적 UPDATE로만 수행합니다. 이 엔티티는 스키마와 조회에만 씁니다.
 */
@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "account")
public class AccountEntity {

  /** 계정 식별자 컬럼 길이 (소유자, 임차인, 관리자, 입찰자 컬럼 공통) */
  public static final int ACCOUNT_ID_LENGTH = InputLimits.ACCOUNT_ID_MAX;

  @Id
  @Column(length = ACCOUNT_ID_LENGTH)
  private String accountId;

  @Column(nullable = false)
  private long balance;
}
