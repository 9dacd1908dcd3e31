package com.seshlog.ingest.repository;

import java.util.Collection;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.seshlog.ingest.model.Swell;

@Repository
public interface SwellRepository extends JpaRepository<Swell, Long> {

    @Modifying
    @Query("DELETE FROM Swell r WHERE r.swellId IN :ids")
    int deleteByIds(@Param("ids") Collection<Long> ids);
}
