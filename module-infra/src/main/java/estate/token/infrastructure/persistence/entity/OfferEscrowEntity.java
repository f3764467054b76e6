package estate.token.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 오퍼 에스크로 ((propertyId, bidder)당 최대 1건)
 *
 * <p>같은 입찰자의 후속 오퍼는 누적되지 않고 금액을 덮어씁니다. 덮어쓰인 이전 금액은 vault에 남고 해당 입찰자는 회수할 수 없습니다.
 */
@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(
    name = "offer_escrow",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_offer_property_bidder",
            columnNames = {"property_id", "bidder"}))
public class OfferEscrowEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "property_id", nullable = false)
  private Long propertyId;

  @Column(nullable = false, length = AccountEntity.ACCOUNT_ID_LENGTH)
  private String bidder;

  @Column(nullable = false)
  private long amount;

  private OfferEscrowEntity(Long propertyId, String bidder, long amount) {
    this.propertyId = propertyId;
    this.bidder = bidder;
    this.amount = amount;
  }

  public static OfferEscrowEntity hold(Long propertyId, String bidder, long amount) {
    return new OfferEscrowEntity(propertyId, bidder, amount);
  }

  public boolean isHeld() {
    return amount > 0;
  }

  public void overwrite(long amount) {
    this.amount = amount;
  }

  /** 보관 금액을 0으로 만들고 반환 */
  public long release() {
    long released = this.amount;
    this.amount = 0L;
    return released;
  }
}
