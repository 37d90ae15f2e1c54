package com.courtbook.court.repository;

import com.courtbook.court.domain.ClubSpecialHours;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.Optional;

public interface ClubSpecialHoursRepository extends JpaRepository<ClubSpecialHours, Long> {

    Optional<ClubSpecialHours> findByClubIdAndDate(Long clubId, LocalDate date);
}
