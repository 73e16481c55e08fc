package com.primemath.backend.modules.center.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.primemath.backend.modules.center.domain.TutoringClass;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TutoringClassRepository extends JpaRepository<TutoringClass, UUID> {

    @Query("""
            select c
              from TutoringClass c
              join ClassEnrollment e on e.classId = c.id
             where e.studentId = :studentId
               and c.centerId = :centerId
               and c.archived = false
             order by c.name
            """)
    List<TutoringClass> findActiveEnrolledClasses(@Param("studentId") UUID studentId, @Param("centerId") UUID centerId);

    List<TutoringClass> findByIdIn(Collection<UUID> ids);
}
