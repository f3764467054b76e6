package estate.token.controller.dto.property;

public record MintResponse(Long propertyId) {}
