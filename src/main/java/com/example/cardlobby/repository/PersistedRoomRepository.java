package com.example.cardlobby.repository;

import com.example.cardlobby.model.PersistedRoom;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PersistedRoomRepository extends JpaRepository<PersistedRoom, String> {

    // SELECT ... FOR UPDATE
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from PersistedRoom r where r.id = :id")
    Optional<PersistedRoom> findByIdForUpdate(@Param("id") String id);
}
