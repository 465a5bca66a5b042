package com.factory.stockkeeper.repository;

import com.factory.stockkeeper.model.DocumentSequence;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import java.time.LocalDate;
import java.util.Optional;

public interface DocumentSequenceRepository extends JpaRepository<DocumentSequence, Long> {
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM DocumentSequence s WHERE s.prefix = :prefix AND s.sequenceDate = :date")
    Optional<DocumentSequence> findForUpdate(@Param("prefix") String prefix, @Param("date") LocalDate date);
}
