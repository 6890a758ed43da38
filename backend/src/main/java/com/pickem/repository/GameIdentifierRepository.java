package com.pickem.repository;

import com.pickem.model.ApiSource;
import com.pickem.model.GameIdentifier;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface GameIdentifierRepository extends JpaRepository<GameIdentifier, Long> {

    boolean existsBySourceAndExternalId(ApiSource source, String externalId);

    Optional<GameIdentifier> findByGameIdAndSource(String gameId, ApiSource source);
}
