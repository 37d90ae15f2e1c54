package com.courtbook.court.repository;

import com.courtbook.court.domain.HolidayDate;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface HolidayDateRepository extends JpaRepository<HolidayDate, Long> {

    List<HolidayDate> findAllByOrderByDateAsc();
}
