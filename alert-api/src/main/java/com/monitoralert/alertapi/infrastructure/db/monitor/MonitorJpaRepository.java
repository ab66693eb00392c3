package com.monitoralert.alertapi.infrastructure.db.monitor;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MonitorJpaRepository extends JpaRepository<MonitorEntity, String> {

    List<MonitorEntity> findAllByOrderByNameAsc();
}
