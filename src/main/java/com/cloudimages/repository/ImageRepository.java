package com.cloudimages.repository;

import com.cloudimages.entity.ImageEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ImageRepository extends JpaRepository<ImageEntity, Long> {

    Optional<ImageEntity> findByIdAndUserId(Long id, String userId);

    List<ImageEntity> findByUserIdOrderByCreatedAtDescIdDesc(String userId);

    List<ImageEntity> findByStorageProviderId(Long storageProviderId);

    long countByStorageProviderId(Long storageProviderId);

    long countByUserId(String userId);

    long countByUserIdAndIsOptimizedTrue(String userId);

    @Query("SELECT COALESCE(SUM(i.fileSize), 0) FROM ImageEntity i WHERE i.userId = :userId")
    long sumFileSizeByUserId(@Param("userId") String userId);

    @Query("SELECT COALESCE(SUM(i.fileSize - i.optimizedSize), 0) FROM ImageEntity i "
            + "WHERE i.userId = :userId AND i.isOptimized = true AND i.optimizedSize IS NOT NULL")
    long sumSavedBytesByUserId(@Param("userId") String userId);
}
