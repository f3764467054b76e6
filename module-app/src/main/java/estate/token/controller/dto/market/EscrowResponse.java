package estate.token.controller.dto.market;

public record EscrowResponse(Long propertyId, String bidder, long amount) {}
