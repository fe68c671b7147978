package quest.gekko.smm.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.smm.domain.Platform;

import java.util.List;
import java.util.Optional;

public interface PlatformRepository extends JpaRepository<Platform, Long> {
    Optional<Platform> findByCode(String code);
    List<Platform> findAllByOrderByIdAsc();
}
