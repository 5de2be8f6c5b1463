package org.caureq.caureqalertdesk.repo;

import org.caureq.caureqalertdesk.domain.JobRun;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface JobRunRepo extends JpaRepository<JobRun, String> {
    Page<JobRun> findAllByOrderByStartedAtDesc(Pageable pageable);
}
