package com.cloudimages.repository;

import com.cloudimages.entity.ProviderDefaultLockEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ProviderDefaultLockRepository extends JpaRepository<ProviderDefaultLockEntity, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM ProviderDefaultLockEntity l WHERE l.userId = :userId")
    Optional<ProviderDefaultLockEntity> lockByUserId(@Param("userId") String userId);
}
