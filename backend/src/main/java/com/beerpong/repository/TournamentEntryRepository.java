package com.beerpong.repository;

import com.beerpong.model.TournamentEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface TournamentEntryRepository extends JpaRepository<TournamentEntry, Integer> {

    List<TournamentEntry> findByTournamentIdOrderByIdAsc(Integer tournamentId);

    long countByTournamentId(Integer tournamentId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from TournamentEntry e where e.tournamentId = :tournamentId")
    int deleteAllForTournament(@Param("tournamentId") Integer tournamentId);

    @Query("""
            select e.tournamentId as tournamentId, p.name as playerName, e.placement as placement
            from TournamentEntry e, Player p
            where p.id = e.playerId and e.tournamentId in :tournamentIds
            order by e.tournamentId asc, e.id asc
            """)
    List<TournamentParticipantRow> findParticipantRows(@Param("tournamentIds") Collection<Integer> tournamentIds);
}
