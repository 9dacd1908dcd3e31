package com.seshlog.ingest.repository;

import java.util.Collection;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.seshlog.ingest.model.Wind;

@Repository
public interface WindRepository extends JpaRepository<Wind, Long> {

    @Modifying
    @Query("DELETE FROM Wind r WHERE r.windId IN :ids")
    int deleteByIds(@Param("ids") Collection<Long> ids);
}
