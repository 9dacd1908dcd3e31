package com.seshlog.ingest.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.stereotype.Repository;

import com.seshlog.ingest.model.LogUser;

import jakarta.persistence.LockModeType;

@Repository
public interface LogUserRepository extends JpaRepository<LogUser, Long> {

    Optional<LogUser> findByUsername(String username);

    @Lock(LockModeType.PESSIMISTIC_READ)
    Optional<LogUser> findSharedByUsername(String username);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<LogUser> findForUpdateByUsername(String username);
}
