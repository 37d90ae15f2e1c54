package com.courtbook.court.repository;

import com.courtbook.court.domain.Court;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CourtRepository extends JpaRepository<Court, Long> {

    List<Court> findByClubIdAndActiveTrueOrderByIdAsc(Long clubId);
}
