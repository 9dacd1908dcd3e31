package com.seshlog.ingest.repository;

import java.util.Collection;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.seshlog.ingest.model.Temperature;

@Repository
public interface TemperatureRepository extends JpaRepository<Temperature, Long> {

    @Modifying
    @Query("DELETE FROM Temperature r WHERE r.tempId IN :ids")
    int deleteByIds(@Param("ids") Collection<Long> ids);
}
