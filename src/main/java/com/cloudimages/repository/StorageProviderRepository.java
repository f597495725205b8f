package com.cloudimages.repository;

import com.cloudimages.entity.StorageProviderEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface StorageProviderRepository extends JpaRepository<StorageProviderEntity, Long> {

    Optional<StorageProviderEntity> findByIdAndUserId(Long id, String userId);

    Optional<StorageProviderEntity> findByIdAndUserIdAndIsActiveTrue(Long id, String userId);

    Optional<StorageProviderEntity> findFirstByUserIdAndIsDefaultTrueAndIsActiveTrue(String userId);

    List<StorageProviderEntity> findByUserIdOrderByIsDefaultDescCreatedAtDescIdDesc(String userId);

    long countByUserIdAndIsDefaultTrue(String userId);

    /**
     * Locks every provider row of a user (SELECT ... FOR UPDATE) so that
     * default switches for the same user run one at a time.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM StorageProviderEntity p WHERE p.userId = :userId ORDER BY p.id")
    List<StorageProviderEntity> lockAllByUserId(@Param("userId") String userId);
}
