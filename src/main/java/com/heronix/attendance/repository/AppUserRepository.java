package com.heronix.attendance.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.heronix.attendance.model.domain.AppUser;
import com.heronix.attendance.model.enums.UserRole;

@Repository
public interface AppUserRepository extends JpaRepository<AppUser, Long> {

    /**
     * Active users of a role, ordered by name (the roster order used for alerting).
     */
    List<AppUser> findByRoleAndActiveTrueOrderByFullNameAsc(UserRole role);
}
