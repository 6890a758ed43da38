package com.pickem.repository;

import com.pickem.model.ApiSource;
import com.pickem.model.TeamIdentifier;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TeamIdentifierRepository extends JpaRepository<TeamIdentifier, Long> {

    Optional<TeamIdentifier> findBySourceAndExternalId(ApiSource source, String externalId);

    boolean existsByTeamIdAndSource(String teamId, ApiSource source);

    List<TeamIdentifier> findBySource(ApiSource source);
}
