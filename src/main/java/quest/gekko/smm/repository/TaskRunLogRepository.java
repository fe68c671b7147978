package quest.gekko.smm.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.smm.domain.TaskRunLog;

import java.util.List;
import java.util.Optional;

public interface TaskRunLogRepository extends JpaRepository<TaskRunLog, Long> {
    List<TaskRunLog> findByTaskIdOrderByStartTimeDescIdDesc(Long taskId, Pageable pageable);
    List<TaskRunLog> findAllByOrderByStartTimeDescIdDesc(Pageable pageable);
    Optional<TaskRunLog> findFirstByTaskIdOrderByStartTimeDescIdDesc(Long taskId);
}
