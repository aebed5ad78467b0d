package com.example.syncengine.repository;

import com.example.syncengine.entity.Integration;
import com.example.syncengine.entity.ServiceType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface IntegrationRepository extends JpaRepository<Integration, UUID> {

    Optional<Integration> findByUserIdAndProviderAndService(UUID userId, String provider, ServiceType service);
}
