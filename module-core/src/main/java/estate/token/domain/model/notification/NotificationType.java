package estate.token.domain.model.notification;

public enum NotificationType {
  MINTED,
  LISTED,
  RENTAL_LISTED,
  OFFER_MADE,
  OFFER_ACCEPTED,
  OFFER_WITHDRAWN,
  RENTED,
  EXTENDED,
  AUCTION_STARTED,
  BID,
  AUCTION_ENDED,
  MANAGER_ASSIGNED,
  TITLE_TRANSFERRED
}
