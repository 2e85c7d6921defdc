package ch.minigolf.minigolfbackend.service;

import ch.minigolf.minigolfbackend.domain.Player;
import ch.minigolf.minigolfbackend.domain.Room;
import ch.minigolf.minigolfbackend.domain.enums.RoomStatus;
import ch.minigolf.minigolfbackend.repository.RoomRepository;
import ch.minigolf.minigolfbackend.web.api.dto.RoomEventDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Turn and scoring rules of a room: start, record a shot, rotate the turn, detect the end of the
 * game, determine the winner and reset for a replay.
 *
 * <p>Every operation runs under the room lock and works on a detached copy that is written back
 * as a whole. Rule violations are reported as {@code false} or empty results, never thrown.
 */
@Service
@Slf4j
public class GameService {

    private final RoomRepository roomRepository;
    private final RoomEventPublisher eventPublisher;

    public GameService(RoomRepository roomRepository,
                       RoomEventPublisher eventPublisher) {
        this.roomRepository = roomRepository;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Starts the game of a waiting room. The first player in list order gets the turn.
     *
     * @param roomId public room identifier
     * @return {@code false} if the room is unknown, not waiting or has fewer than two players
     */
    public boolean startGame(String roomId) {
        return roomRepository.executeLocked(roomId, () -> {
            Optional<Room> maybeRoom = roomRepository.findById(roomId);
            if (maybeRoom.isEmpty()) {
                return false;
            }

            Room room = maybeRoom.get();
            if (room.getStatus() != RoomStatus.WAITING) {
                log.debug("Cannot start room {} in status {}", roomId, room.getStatus());
                return false;
            }
            if (room.getPlayers().size() < 2) {
                log.debug("Cannot start room {} with {} player(s)", roomId, room.getPlayers().size());
                return false;
            }

            room.setStatus(RoomStatus.PLAYING);
            room.assignTurnTo(0);

            Room saved = roomRepository.save(room);
            log.info("Game started in room {} with {} players", roomId, saved.getPlayers().size());

            eventPublisher.publish(RoomEventDto.gameStarted(saved, saved.getPlayers().get(0)));
            return true;
        });
    }

    /**
     * Records the result of one shot for the player whose turn it is.
     *
     * <p>Adds {@code score} to the player's total and uses up one shot. The turn is NOT advanced,
     * callers invoke {@link #advanceTurn(String)} separately.
     *
     * @param roomId public room identifier
     * @param playerId id of the shooting player
     * @param score points of the shot, not negative
     * @return {@code false} if room or player is unknown, the game is not running, it is not
     *         this player's turn, the player has no shots left or the score is negative
     */
    public boolean recordScore(String roomId, String playerId, int score) {
        if (score < 0) {
            return false;
        }

        return roomRepository.executeLocked(roomId, () -> {
            Optional<Room> maybeRoom = roomRepository.findById(roomId);
            if (maybeRoom.isEmpty()) {
                return false;
            }

            Room room = maybeRoom.get();
            Optional<Player> maybePlayer = room.findPlayer(playerId);
            if (maybePlayer.isEmpty()) {
                return false;
            }

            Player player = maybePlayer.get();
            if (room.getStatus() != RoomStatus.PLAYING || !player.isCurrentTurn()) {
                log.debug("Rejected out-of-turn score from player {} in room {}", playerId, roomId);
                return false;
            }
            if (player.getShotsRemaining() <= 0) {
                return false;
            }

            player.setScore(player.getScore() + score);
            player.setShotsRemaining(player.getShotsRemaining() - 1);

            Room saved = roomRepository.save(room);
            Player savedPlayer = saved.findPlayer(playerId)
                    .orElseThrow(() -> new IllegalStateException("Scored player not found in saved room"));

            eventPublisher.publish(RoomEventDto.scoreUpdated(saved, savedPlayer));
            return true;
        });
    }

    /**
     * Passes the turn to the next eligible player.
     *
     * <p>Scans circularly starting right after the current player, the current player itself is
     * checked last. Eligible means connected and at least one shot left. If nobody is eligible the
     * game is completed and no player keeps the turn flag.
     *
     * @param roomId public room identifier
     * @return {@code false} if the room is unknown or not playing
     */
    public boolean advanceTurn(String roomId) {
        return roomRepository.executeLocked(roomId, () -> {
            Optional<Room> maybeRoom = roomRepository.findById(roomId);
            if (maybeRoom.isEmpty()) {
                return false;
            }

            Room room = maybeRoom.get();
            if (room.getStatus() != RoomStatus.PLAYING) {
                return false;
            }

            int nextIndex = findNextEligibleIndex(room);
            if (nextIndex < 0) {
                completeGame(room);
                return true;
            }

            room.assignTurnTo(nextIndex);

            Room saved = roomRepository.save(room);
            Player next = saved.getPlayers().get(nextIndex);
            log.debug("Turn in room {} passed to player {}", roomId, next.getId());

            eventPublisher.publish(RoomEventDto.turnChanged(saved, next));
            return true;
        });
    }

    /**
     * Returns the winner of a completed game.
     *
     * <p>Highest score wins. On a tie the player listed first wins. If the highest score is not
     * positive and shared by several players there is no winner.
     *
     * @param roomId public room identifier
     * @return the winning player, empty if the room is unknown, not completed or has no winner
     */
    public Optional<Player> getWinner(String roomId) {
        return roomRepository.findById(roomId)
                .filter(room -> room.getStatus() == RoomStatus.COMPLETED)
                .flatMap(GameService::determineWinner);
    }

    /**
     * Resets scores and shots of all players and returns the room to the waiting phase.
     *
     * @param roomId public room identifier
     * @return {@code false} if the room is unknown
     */
    public boolean resetGame(String roomId) {
        return roomRepository.executeLocked(roomId, () -> {
            Optional<Room> maybeRoom = roomRepository.findById(roomId);
            if (maybeRoom.isEmpty()) {
                return false;
            }

            Room room = maybeRoom.get();
            for (Player player : room.getPlayers()) {
                player.setScore(0);
                player.setShotsRemaining(room.getShotsPerPlayer());
            }
            room.setStatus(RoomStatus.WAITING);
            room.assignTurnTo(0);

            Room saved = roomRepository.save(room);
            log.info("Game reset in room {}", roomId);

            eventPublisher.publish(RoomEventDto.gameReset(saved));
            return true;
        });
    }

    // ----------------- helpers -----------------

    private void completeGame(Room room) {
        room.setStatus(RoomStatus.COMPLETED);
        room.clearTurns();

        Room saved = roomRepository.save(room);
        Player winner = determineWinner(saved).orElse(null);

        log.info("Game completed in room {}, winner: {}",
                saved.getId(), winner == null ? "none" : winner.getId());

        eventPublisher.publish(RoomEventDto.gameCompleted(saved, winner));
    }

    private static int findNextEligibleIndex(Room room) {
        List<Player> players = room.getPlayers();
        int size = players.size();

        for (int step = 1; step <= size; step++) {
            int index = (room.getCurrentPlayerIndex() + step) % size;
            Player candidate = players.get(index);
            if (candidate.getShotsRemaining() > 0 && candidate.isConnected()) {
                return index;
            }
        }
        return -1;
    }

    private static Optional<Player> determineWinner(Room room) {
        Player winner = null;
        for (Player player : room.getPlayers()) {
            // strictly greater: on a tie the earlier player stays winner
            if (winner == null || player.getScore() > winner.getScore()) {
                winner = player;
            }
        }
        if (winner == null) {
            return Optional.empty();
        }

        int highestScore = winner.getScore();
        long playersWithHighestScore = room.getPlayers().stream()
                .filter(p -> p.getScore() == highestScore)
                .count();
        if (highestScore <= 0 && playersWithHighestScore > 1) {
            return Optional.empty();
        }
        return Optional.of(winner);
    }
}
