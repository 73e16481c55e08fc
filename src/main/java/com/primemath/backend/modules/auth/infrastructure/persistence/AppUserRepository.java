package com.primemath.backend.modules.auth.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.primemath.backend.modules.auth.domain.AppUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    @Query("select u from AppUser u where lower(u.loginId) = lower(:loginId)")
    Optional<AppUser> findByLoginIdIgnoreCase(@Param("loginId") String loginId);

    @Query("""
            select distinct u
              from AppUser u
              join CenterMembership m on m.userId = u.id
              join UserRole ur on ur.user = u
             where m.centerId = :centerId
               and u.status = com.primemath.backend.modules.auth.domain.AppUserStatus.ACTIVE
               and ur.revokedAt is null
               and ur.role.code in :roleCodes
             order by u.fullName
            """)
    List<AppUser> findActiveCenterMembersWithRoles(
            @Param("centerId") UUID centerId,
            @Param("roleCodes") Collection<String> roleCodes
    );

    @Query("""
            select distinct u
              from AppUser u
              join UserRole ur on ur.user = u
             where ur.revokedAt is null
               and ur.role.code = 'STUDENT'
               and u.grade is not null
            """)
    List<AppUser> findStudentsWithGrade();

    @Query("""
            select case when count(ur) > 0 then true else false end
              from UserRole ur
             where ur.user.id = :userId
               and ur.revokedAt is null
               and ur.role.code in :roleCodes
            """)
    boolean hasAnyActiveRole(@Param("userId") UUID userId, @Param("roleCodes") Collection<String> roleCodes);
}
