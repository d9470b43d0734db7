package com.timemultiplier.api.repository;

import com.timemultiplier.api.entity.Backup;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BackupRepository extends JpaRepository<Backup, Long>, BackupRepositoryCustom {}
