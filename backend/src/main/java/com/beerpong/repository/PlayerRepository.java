package com.beerpong.repository;

import com.beerpong.model.Player;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PlayerRepository extends JpaRepository<Player, Integer> {
    Optional<Player> findByName(String name);

    List<Player> findAllByOrderByNameAsc();
}
