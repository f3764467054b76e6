package estate.token.infrastructure.persistence.repository;

import estate.token.infrastructure.persistence.entity.AccountEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AccountRepository extends JpaRepository<AccountEntity, String> {

  /**
   * 잔액 차감 (잔액이 충분할 때만)
   *
   * <p>flushAutomatically: 같은 트랜잭션에서 대기 중인 매물 상태 변경을 먼저 반영합니다. 영속성 컨텍스트는 비우지 않습니다(비우면 아직
   * flush되지 않은 변경이 유실됨).
   *
   * @return 갱신된 행 수 (0이면 잔액 부족 또는 계정 없음)
   */
  @Modifying(flushAutomatically = true)
  @Query(
      "update AccountEntity a set a.balance = a.balance - :amount"
          + " where a.accountId = :accountId and a.balance >= :amount")
  int decreaseBalance(@Param("accountId") String accountId, @Param("amount") long amount);

  /**
   * 입금 Upsert (동시성 안전)
   *
   * <p>처음 보는 계정이면 INSERT, 있으면 잔액에 더합니다. 한 문장이므로 같은 신규 계정으로의 동시 입금도 PK 충돌 없이 행 락으로 순차 처리됩니다.
   * 별도 트랜잭션이나 재시도가 필요 없습니다.
   */
  @Modifying(flushAutomatically = true)
  @Query(
      value =
          """
          INSERT INTO account (account_id, balance)
          VALUES (:accountId, :amount)
          ON DUPLICATE KEY UPDATE balance = balance + :amount
          """,
      nativeQuery = true)
  void upsertBalance(@Param("accountId") String accountId, @Param("amount") long amount);

  /** 영속성 컨텍스트가 아닌 DB의 현재 잔액 (벌크 UPDATE 이후에도 최신 값) */
  @Query("select a.balance from AccountEntity a where a.accountId = :accountId")
  Optional<Long> findBalance(@Param("accountId") String accountId);
}
