package estate.token.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/** 소유권 원장 레코드 (자산 ID → 소유자) */
@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "title_deed")
public class TitleDeedEntity {

  @Id private Long propertyId;

  @Column(nullable = false, length = AccountEntity.ACCOUNT_ID_LENGTH)
  private String owner;

  @Version private Long version;

  private TitleDeedEntity(Long propertyId, String owner) {
    this.propertyId = propertyId;
    this.owner = owner;
  }

  public static TitleDeedEntity issue(Long propertyId, String owner) {
    return new TitleDeedEntity(propertyId, owner);
  }

  public boolean isOwnedBy(String account) {
    return owner.equals(account);
  }

  public void transferTo(String newOwner) {
    this.owner = newOwner;
  }
}
