package uk.gegc.livequiz.features.leaderboard.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.livequiz.features.leaderboard.domain.model.LeaderboardSnapshot;

public interface LeaderboardSnapshotRepository extends JpaRepository<LeaderboardSnapshot, String> {
}
