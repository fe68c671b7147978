package quest.gekko.smm.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.smm.domain.Account;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface AccountRepository extends JpaRepository<Account, Long> {
    Optional<Account> findByPlatformIdAndNativeId(Long platformId, String nativeId);
    List<Account> findAllByOrderByIdAsc();
    List<Account> findByPlatformIdOrderByIdAsc(Long platformId);
    List<Account> findByPlatformIdAndActiveTrueOrderByIdAsc(Long platformId);

    // touches only the tag and updated_at
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Account a set a.identityTag = :tag, a.updatedAt = :now " +
            "where a.platformId = :platformId and a.nativeId = :nativeId")
    int updateIdentityTag(@Param("platformId") Long platformId,
                          @Param("nativeId") String nativeId,
                          @Param("tag") String tag,
                          @Param("now") LocalDateTime now);
}
