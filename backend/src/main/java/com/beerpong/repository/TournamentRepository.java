package com.beerpong.repository;

import com.beerpong.model.Tournament;
import com.beerpong.model.TournamentType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

@Repository
public interface TournamentRepository extends JpaRepository<Tournament, Integer> {

    List<Tournament> findAllByOrderByDateDescIdDesc();

    /**
     * Overwrites the tournament metadata in one statement.
     *
     * @return number of rows updated, zero when the id does not exist
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Tournament t
            set t.date = :date, t.type = :type, t.flavor = :flavor, t.updatedAt = :updatedAt
            where t.id = :id
            """)
    int updateDetails(
            @Param("id") Integer id,
            @Param("date") LocalDate date,
            @Param("type") TournamentType type,
            @Param("flavor") String flavor,
            @Param("updatedAt") OffsetDateTime updatedAt
    );

    /**
     * Entries of the tournament are removed by the schema's ON DELETE CASCADE.
     *
     * @return number of rows deleted, zero when the id does not exist
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Tournament t where t.id = :id")
    int deleteTournamentById(@Param("id") Integer id);
}
