package estate.token.domain.model.notification;

/**
 * 매물 상태 전이 알림 (순수 도메인)
 *
 * <p>외부 인덱서가 소비하는 불변 레코드입니다. 각 구현체의 컴포넌트가 그대로 JSON payload가 됩니다.
 */
public sealed interface PropertyNotification {

  Long propertyId();

  NotificationType type();

  record Minted(Long propertyId, String owner, String location) implements PropertyNotification {
    @Override
    public NotificationType type() {
      return NotificationType.MINTED;
    }
  }

  record Listed(Long propertyId, long price) implements PropertyNotification {
    @Override
    public NotificationType type() {
      return NotificationType.LISTED;
    }
  }

  record RentalListed(Long propertyId, long monthlyRent) implements PropertyNotification {
    @Override
    public NotificationType type() {
      return NotificationType.RENTAL_LISTED;
    }
  }

  record OfferMade(Long propertyId, String bidder, long amount) implements PropertyNotification {
    @Override
    public NotificationType type() {
      return NotificationType.OFFER_MADE;
    }
  }

  record OfferAccepted(Long propertyId, String buyer, long amount)
      implements PropertyNotification {
    @Override
    public NotificationType type() {
      return NotificationType.OFFER_ACCEPTED;
    }
  }

  record OfferWithdrawn(Long propertyId, String bidder) implements PropertyNotification {
    @Override
    public NotificationType type() {
      return NotificationType.OFFER_WITHDRAWN;
    }
  }

  record Rented(Long propertyId, String renter, long months, long totalPaid)
      implements PropertyNotification {
    @Override
    public NotificationType type() {
      return NotificationType.RENTED;
    }
  }

  record Extended(Long propertyId, long additionalMonths, long additionalPaid)
      implements PropertyNotification {
    @Override
    public NotificationType type() {
      return NotificationType.EXTENDED;
    }
  }

  record AuctionStarted(Long propertyId, long startPrice, long endTime)
      implements PropertyNotification {
    @Override
    public NotificationType type() {
      return NotificationType.AUCTION_STARTED;
    }
  }

  record Bid(Long propertyId, String bidder, long amount) implements PropertyNotification {
    @Override
    public NotificationType type() {
      return NotificationType.BID;
    }
  }

  /** 낙찰자가 없으면 winner는 null, amount는 0 */
  record AuctionEnded(Long propertyId, String winner, long amount)
      implements PropertyNotification {
    @Override
    public NotificationType type() {
      return NotificationType.AUCTION_ENDED;
    }
  }

  /** manager가 null이면 위임 해제 */
  record ManagerAssigned(Long propertyId, String manager) implements PropertyNotification {
    @Override
    public NotificationType type() {
      return NotificationType.MANAGER_ASSIGNED;
    }
  }

  record TitleTransferred(Long propertyId, String from, String to)
      implements PropertyNotification {
    @Override
    public NotificationType type() {
      return NotificationType.TITLE_TRANSFERRED;
    }
  }
}
