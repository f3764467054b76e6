package estate.token.infrastructure.persistence.repository;

import estate.token.infrastructure.persistence.entity.OfferEscrowEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface OfferEscrowRepository extends JpaRepository<OfferEscrowEntity, Long> {

  Optional<OfferEscrowEntity> findByPropertyIdAndBidder(Long propertyId, String bidder);

  List<OfferEscrowEntity> findByPropertyId(Long propertyId);
}
