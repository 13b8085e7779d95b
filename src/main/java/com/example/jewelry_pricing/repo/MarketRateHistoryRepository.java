package com.example.jewelry_pricing.repo;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.jewelry_pricing.entity.MarketRateHistory;
import com.example.jewelry_pricing.market.Market;

@Repository
public interface MarketRateHistoryRepository extends JpaRepository<MarketRateHistory, Long> {

    Optional<MarketRateHistory> findTopByMarketOrderByFetchedAtDesc(Market market);

    List<MarketRateHistory> findTop50ByMarketOrderByFetchedAtDesc(Market market);

    List<MarketRateHistory> findTop100ByAnomalyTrueOrderByFetchedAtDesc();
}
