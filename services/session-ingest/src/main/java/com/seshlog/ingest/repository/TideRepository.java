package com.seshlog.ingest.repository;

import java.util.Collection;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.seshlog.ingest.model.Tide;

@Repository
public interface TideRepository extends JpaRepository<Tide, Long> {

    @Modifying
    @Query("DELETE FROM Tide r WHERE r.tideId IN :ids")
    int deleteByIds(@Param("ids") Collection<Long> ids);
}
