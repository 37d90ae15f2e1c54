package com.courtbook.court.repository;

import com.courtbook.court.domain.Club;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface ClubRepository extends JpaRepository<Club, Long> {

    @Query("SELECT DISTINCT c FROM Club c LEFT JOIN FETCH c.businessHours WHERE c.id = :id")
    Optional<Club> findByIdWithBusinessHours(@Param("id") Long id);
}
