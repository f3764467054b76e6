package estate.token.infrastructure.persistence.repository;

import estate.token.infrastructure.persistence.entity.TitleDeedEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TitleDeedRepository extends JpaRepository<TitleDeedEntity, Long> {}
