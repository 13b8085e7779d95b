package com.example.jewelry_pricing.repo;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.jewelry_pricing.entity.StoneType;

@Repository
public interface StoneTypeRepository extends JpaRepository<StoneType, Long> {

    Optional<StoneType> findByNameIgnoreCase(String name);

    List<StoneType> findByActiveTrueOrderByDisplayOrderAscNameAsc();
}
