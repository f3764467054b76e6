package estate.token.controller.dto.property;

public record RentedResponse(Long propertyId, boolean rented) {}
