package com.example.jewelry_pricing.repo;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.jewelry_pricing.entity.MetalType;

@Repository
public interface MetalTypeRepository extends JpaRepository<MetalType, Long> {

    Optional<MetalType> findByNameIgnoreCase(String name);

    List<MetalType> findByActiveTrueOrderByDisplayOrderAscNameAsc();
}
