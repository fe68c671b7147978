package quest.gekko.smm.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.smm.domain.CrawlTask;

import java.util.List;
import java.util.Optional;

public interface CrawlTaskRepository extends JpaRepository<CrawlTask, Long> {
    Optional<CrawlTask> findByTaskName(String taskName);
    List<CrawlTask> findAllByOrderByIdAsc();
    List<CrawlTask> findByEnabledTrueOrderByIdAsc();
}
