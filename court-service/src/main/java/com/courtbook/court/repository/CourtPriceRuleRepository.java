package com.courtbook.court.repository;

import com.courtbook.court.domain.CourtPriceRule;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CourtPriceRuleRepository extends JpaRepository<CourtPriceRule, Long> {

    List<CourtPriceRule> findByCourtId(Long courtId);
}
