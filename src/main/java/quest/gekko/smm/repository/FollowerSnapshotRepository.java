package quest.gekko.smm.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.smm.domain.FollowerSnapshot;

import java.util.Optional;

public interface FollowerSnapshotRepository
        extends JpaRepository<FollowerSnapshot, Long>, JpaSpecificationExecutor<FollowerSnapshot> {

    Optional<FollowerSnapshot> findFirstByAccountIdOrderByRecordTimeDescIdDesc(Long accountId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from FollowerSnapshot s where s.accountId = :accountId")
    int deleteByAccountId(@Param("accountId") Long accountId);
}
