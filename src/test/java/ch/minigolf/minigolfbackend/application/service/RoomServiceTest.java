package ch.minigolf.minigolfbackend.application.service;

import ch.minigolf.minigolfbackend.domain.Player;
import ch.minigolf.minigolfbackend.domain.Room;
import ch.minigolf.minigolfbackend.domain.RoomUpdate;
import ch.minigolf.minigolfbackend.domain.enums.RoomEventType;
import ch.minigolf.minigolfbackend.domain.enums.RoomStatus;
import ch.minigolf.minigolfbackend.repository.InMemoryRoomRepository;
import ch.minigolf.minigolfbackend.service.GameService;
import ch.minigolf.minigolfbackend.service.RoomEventPublisher;
import ch.minigolf.minigolfbackend.service.RoomService;
import ch.minigolf.minigolfbackend.testutil.MutableClock;
import ch.minigolf.minigolfbackend.web.api.dto.RoomEventDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link RoomService}.
 *
 * <p>Focus areas:
 * <ul>
 *   <li>Room creation with defaults and explicit settings</li>
 *   <li>Joining, re-joining and capacity limits</li>
 *   <li>Leaving in the waiting and the playing phase, host hand-over and room removal</li>
 *   <li>Direct player and room updates</li>
 *   <li>Listing of active rooms</li>
 * </ul>
 *
 * <p>Notes:
 * <ul>
 *   <li>Uses a real {@link InMemoryRoomRepository} with a {@link MutableClock}</li>
 *   <li>Uses ReflectionTestUtils to set @Value properties</li>
 * </ul>
 */
@ExtendWith(MockitoExtension.class)
class RoomServiceTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private RoomEventPublisher eventPublisher;

    private MutableClock clock;
    private InMemoryRoomRepository roomRepository;
    private RoomService roomService;
    private GameService gameService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        roomRepository = new InMemoryRoomRepository(clock);
        gameService = new GameService(roomRepository, eventPublisher);
        roomService = new RoomService(roomRepository, gameService, eventPublisher, clock);

        ReflectionTestUtils.setField(roomService, "defaultMaxPlayers", 4);
        ReflectionTestUtils.setField(roomService, "defaultShotsPerPlayer", 3);
        ReflectionTestUtils.setField(roomService, "defaultRewardAmount", 10_000_000L);
        ReflectionTestUtils.setField(roomService, "activeThresholdHours", 24);
    }

    // ------------------------------------------------------------------------------------
    // createRoom
    // ------------------------------------------------------------------------------------

    @Test
    void createRoom_shouldApplyDefaultsAndSeatHost_whenSettingsMissing() {
        // Act
        Room room = roomService.createRoom("host-1", "Hanna", null, "Sunday Putt", null, null, null);

        // Assert
        assertThat(room.getId()).matches("[0-9A-Z]{8}");
        assertThat(room.getName()).isEqualTo("Sunday Putt");
        assertThat(room.getHostId()).isEqualTo("host-1");
        assertThat(room.getStatus()).isEqualTo(RoomStatus.WAITING);
        assertThat(room.getMaxPlayers()).isEqualTo(4);
        assertThat(room.getShotsPerPlayer()).isEqualTo(3);
        assertThat(room.getRewardAmount()).isEqualTo(10_000_000L);
        assertThat(room.getCreated()).isEqualTo(START);

        assertThat(room.getPlayers()).hasSize(1);
        Player host = room.getPlayers().get(0);
        assertThat(host.getId()).isEqualTo("host-1");
        assertThat(host.getWalletAddress()).isEmpty();
        assertThat(host.getShotsRemaining()).isEqualTo(3);
        assertThat(host.isCurrentTurn()).isTrue();
        assertThat(host.isConnected()).isTrue();

        assertThat(roomRepository.existsById(room.getId())).isTrue();

        ArgumentCaptor<RoomEventDto> captor = ArgumentCaptor.forClass(RoomEventDto.class);
        verify(eventPublisher).publish(captor.capture());
        assertThat(captor.getValue().type()).isEqualTo(RoomEventType.ROOM_CREATED);
        assertThat(captor.getValue().roomId()).isEqualTo(room.getId());
    }

    @Test
    void createRoom_shouldUseExplicitSettings() {
        // Act
        Room room = roomService.createRoom("host-1", "Hanna", "GABC", "Big Game", 6, 5, 50_000_000L);

        // Assert
        assertThat(room.getMaxPlayers()).isEqualTo(6);
        assertThat(room.getShotsPerPlayer()).isEqualTo(5);
        assertThat(room.getRewardAmount()).isEqualTo(50_000_000L);
        assertThat(room.getPlayers().get(0).getWalletAddress()).isEqualTo("GABC");
        assertThat(room.getPlayers().get(0).getShotsRemaining()).isEqualTo(5);
    }

    @Test
    void createRoom_shouldGenerateDistinctIds() {
        // Act
        Room first = roomService.createRoom("h1", "A", "", "One", null, null, null);
        Room second = roomService.createRoom("h2", "B", "", "Two", null, null, null);

        // Assert
        assertThat(first.getId()).isNotEqualTo(second.getId());
        assertThat(roomRepository.count()).isEqualTo(2);
    }

    // ------------------------------------------------------------------------------------
    // addPlayer
    // ------------------------------------------------------------------------------------

    @Test
    void addPlayer_shouldAppendPlayerWithoutTurn_whenRoomHasSpace() {
        // Arrange
        Room room = roomService.createRoom("host-1", "Hanna", "", "Course", null, null, null);
        Player joining = new Player("p-2", "Paul", "GXYZ");
        joining.setScore(99);
        joining.setCurrentTurn(true);

        // Act
        boolean joined = roomService.addPlayer(room.getId(), joining);

        // Assert
        assertThat(joined).isTrue();

        Room stored = roomRepository.peek(room.getId()).orElseThrow();
        assertThat(stored.getPlayers()).extracting(Player::getId).containsExactly("host-1", "p-2");

        Player paul = stored.findPlayer("p-2").orElseThrow();
        assertThat(paul.getScore()).isZero();
        assertThat(paul.getShotsRemaining()).isEqualTo(3);
        assertThat(paul.isConnected()).isTrue();
        assertThat(paul.isCurrentTurn()).isFalse();
        assertThat(paul.getWalletAddress()).isEqualTo("GXYZ");

        assertThat(lastEvent().type()).isEqualTo(RoomEventType.PLAYER_JOINED);
    }

    @Test
    void addPlayer_shouldResetProgressAndKeepTurnFlag_whenPlayerRejoins() {
        // Arrange
        Room room = roomService.createRoom("host-1", "Hanna", "", "Course", null, null, null);
        Room stored = roomRepository.peek(room.getId()).orElseThrow();
        stored.getPlayers().get(0).setScore(12);
        stored.getPlayers().get(0).setShotsRemaining(1);
        roomRepository.save(stored);

        // Act
        boolean joined = roomService.addPlayer(room.getId(), new Player("host-1", "Hanna again", ""));

        // Assert
        assertThat(joined).isTrue();

        Room after = roomRepository.peek(room.getId()).orElseThrow();
        assertThat(after.getPlayers()).hasSize(1);

        Player host = after.getPlayers().get(0);
        assertThat(host.getName()).isEqualTo("Hanna again");
        assertThat(host.getScore()).isZero();
        assertThat(host.getShotsRemaining()).isEqualTo(3);
        assertThat(host.isCurrentTurn()).isTrue();
    }

    @Test
    void addPlayer_shouldFail_whenRoomFull() {
        // Arrange
        Room room = roomService.createRoom("host-1", "Hanna", "", "Duel", 2, null, null);
        assertThat(roomService.addPlayer(room.getId(), new Player("p-2", "Paul", ""))).isTrue();

        // Act
        boolean joined = roomService.addPlayer(room.getId(), new Player("p-3", "Petra", ""));

        // Assert
        assertThat(joined).isFalse();
        assertThat(roomRepository.peek(room.getId()).orElseThrow().getPlayers()).hasSize(2);
    }

    @Test
    void addPlayer_shouldFail_whenGameAlreadyStarted() {
        // Arrange
        Room room = roomService.createRoom("host-1", "Hanna", "", "Course", null, null, null);
        roomService.addPlayer(room.getId(), new Player("p-2", "Paul", ""));
        gameService.startGame(room.getId());

        // Act + Assert
        assertThat(roomService.addPlayer(room.getId(), new Player("p-3", "Petra", ""))).isFalse();
    }

    @Test
    void addPlayer_shouldFail_whenRoomUnknown() {
        assertThat(roomService.addPlayer("UNKNOWN1", new Player("p-2", "Paul", ""))).isFalse();
        verifyNoInteractions(eventPublisher);
    }

    // ------------------------------------------------------------------------------------
    // removePlayer
    // ------------------------------------------------------------------------------------

    @Test
    void removePlayer_shouldHandOverHost_whenHostLeavesWaitingRoom() {
        // Arrange
        Room room = roomService.createRoom("H", "Host", "", "Course", null, null, null);
        roomService.addPlayer(room.getId(), new Player("P", "Paul", ""));

        // Act
        boolean removed = roomService.removePlayer(room.getId(), "H");

        // Assert
        assertThat(removed).isTrue();

        Room stored = roomRepository.peek(room.getId()).orElseThrow();
        assertThat(stored.getHostId()).isEqualTo("P");
        assertThat(stored.getPlayers()).extracting(Player::getId).containsExactly("P");
        assertThat(lastEvent().type()).isEqualTo(RoomEventType.PLAYER_LEFT);
    }

    @Test
    void removePlayer_shouldDeleteRoom_whenLastPlayerLeaves() {
        // Arrange
        Room room = roomService.createRoom("H", "Host", "", "Course", null, null, null);

        // Act
        boolean removed = roomService.removePlayer(room.getId(), "H");

        // Assert
        assertThat(removed).isTrue();
        assertThat(roomRepository.existsById(room.getId())).isFalse();

        ArgumentCaptor<RoomEventDto> captor = ArgumentCaptor.forClass(RoomEventDto.class);
        verify(eventPublisher, atLeastOnce()).publish(captor.capture());
        List<RoomEventType> types = captor.getAllValues().stream().map(RoomEventDto::type).toList();
        assertThat(types).containsExactly(
                RoomEventType.ROOM_CREATED,
                RoomEventType.PLAYER_LEFT,
                RoomEventType.ROOM_REMOVED
        );
    }

    @Test
    void removePlayer_shouldMarkDisconnectedAndAdvanceTurn_whenCurrentPlayerLeavesRunningGame() {
        // Arrange
        Room room = roomService.createRoom("A", "Anna", "", "Course", null, null, null);
        roomService.addPlayer(room.getId(), new Player("B", "Ben", ""));
        roomService.addPlayer(room.getId(), new Player("C", "Cleo", ""));
        gameService.startGame(room.getId());

        // Act
        boolean removed = roomService.removePlayer(room.getId(), "A");

        // Assert
        assertThat(removed).isTrue();

        Room stored = roomRepository.peek(room.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(RoomStatus.PLAYING);
        assertThat(stored.getPlayers()).hasSize(3);

        Player anna = stored.findPlayer("A").orElseThrow();
        assertThat(anna.isConnected()).isFalse();
        assertThat(anna.isCurrentTurn()).isFalse();
        assertThat(stored.findPlayer("B").orElseThrow().isCurrentTurn()).isTrue();
        assertThat(stored.getCurrentPlayerIndex()).isEqualTo(1);
        assertThat(stored.getHostId()).isEqualTo("B");
    }

    @Test
    void removePlayer_shouldKeepTurn_whenOtherPlayerLeavesRunningGame() {
        // Arrange
        Room room = roomService.createRoom("A", "Anna", "", "Course", null, null, null);
        roomService.addPlayer(room.getId(), new Player("B", "Ben", ""));
        roomService.addPlayer(room.getId(), new Player("C", "Cleo", ""));
        gameService.startGame(room.getId());

        // Act
        roomService.removePlayer(room.getId(), "B");

        // Assert
        Room stored = roomRepository.peek(room.getId()).orElseThrow();
        assertThat(stored.findPlayer("A").orElseThrow().isCurrentTurn()).isTrue();
        assertThat(stored.findPlayer("B").orElseThrow().isConnected()).isFalse();
        assertThat(stored.getHostId()).isEqualTo("A");
    }

    @Test
    void removePlayer_shouldDeleteRoom_whenOnlyDisconnectedPlayersRemainInRunningGame() {
        // Arrange
        Room room = roomService.createRoom("A", "Anna", "", "Course", null, null, null);
        roomService.addPlayer(room.getId(), new Player("B", "Ben", ""));
        gameService.startGame(room.getId());
        roomService.removePlayer(room.getId(), "B");

        // Act
        boolean removed = roomService.removePlayer(room.getId(), "A");

        // Assert
        assertThat(removed).isTrue();
        assertThat(roomRepository.existsById(room.getId())).isFalse();
        assertThat(lastEvent().type()).isEqualTo(RoomEventType.ROOM_REMOVED);
    }

    @Test
    void removePlayer_shouldFail_whenPlayerUnknown() {
        // Arrange
        Room room = roomService.createRoom("A", "Anna", "", "Course", null, null, null);

        // Act + Assert
        assertThat(roomService.removePlayer(room.getId(), "nobody")).isFalse();
        assertThat(roomRepository.existsById(room.getId())).isTrue();
    }

    // ------------------------------------------------------------------------------------
    // updatePlayer / updateRoom / removeRoom
    // ------------------------------------------------------------------------------------

    @Test
    void updatePlayer_shouldReplacePlayerState() {
        // Arrange
        Room room = roomService.createRoom("A", "Anna", "", "Course", null, null, null);
        Player updated = new Player("A", "Anna B.", "GNEW");
        updated.setScore(40);
        updated.setShotsRemaining(1);

        // Act
        boolean result = roomService.updatePlayer(room.getId(), updated);

        // Assert
        assertThat(result).isTrue();

        Player stored = roomRepository.peek(room.getId()).orElseThrow().findPlayer("A").orElseThrow();
        assertThat(stored.getName()).isEqualTo("Anna B.");
        assertThat(stored.getWalletAddress()).isEqualTo("GNEW");
        assertThat(stored.getScore()).isEqualTo(40);
        assertThat(stored.getShotsRemaining()).isEqualTo(1);
        assertThat(lastEvent().type()).isEqualTo(RoomEventType.PLAYER_UPDATED);
    }

    @Test
    void updatePlayer_shouldFail_whenShotsNegativeOrPlayerUnknown() {
        // Arrange
        Room room = roomService.createRoom("A", "Anna", "", "Course", null, null, null);
        Player negative = new Player("A", "Anna", "");
        negative.setShotsRemaining(-1);

        // Act + Assert
        assertThat(roomService.updatePlayer(room.getId(), negative)).isFalse();
        assertThat(roomService.updatePlayer(room.getId(), new Player("Z", "Zed", ""))).isFalse();
    }

    @Test
    void updateRoom_shouldApplyOnlyNonNullFields() {
        // Arrange
        Room room = roomService.createRoom("A", "Anna", "", "Course", null, null, null);
        roomService.addPlayer(room.getId(), new Player("B", "Ben", ""));

        // Act
        boolean result = roomService.updateRoom(room.getId(),
                new RoomUpdate("Renamed", "B", null, 5, null));

        // Assert
        assertThat(result).isTrue();

        Room stored = roomRepository.peek(room.getId()).orElseThrow();
        assertThat(stored.getName()).isEqualTo("Renamed");
        assertThat(stored.getHostId()).isEqualTo("B");
        assertThat(stored.getMaxPlayers()).isEqualTo(4);
        assertThat(stored.getShotsPerPlayer()).isEqualTo(5);
        assertThat(stored.getRewardAmount()).isEqualTo(10_000_000L);
        assertThat(stored.getStatus()).isEqualTo(RoomStatus.WAITING);
        assertThat(lastEvent().type()).isEqualTo(RoomEventType.ROOM_UPDATED);
    }

    @Test
    void updateRoom_shouldFail_whenUpdateInvalid() {
        // Arrange
        Room room = roomService.createRoom("A", "Anna", "", "Course", null, null, null);
        roomService.addPlayer(room.getId(), new Player("B", "Ben", ""));
        roomService.addPlayer(room.getId(), new Player("C", "Cleo", ""));
        String roomId = room.getId();

        // Act + Assert
        assertThat(roomService.updateRoom(roomId, new RoomUpdate(null, "ghost", null, null, null))).isFalse();
        assertThat(roomService.updateRoom(roomId, new RoomUpdate(null, null, 1, null, null))).isFalse();
        assertThat(roomService.updateRoom(roomId, new RoomUpdate(null, null, 2, null, null))).isFalse();
        assertThat(roomService.updateRoom(roomId, new RoomUpdate(null, null, null, 0, null))).isFalse();
        assertThat(roomService.updateRoom("UNKNOWN1", new RoomUpdate("x", null, null, null, null))).isFalse();

        assertThat(roomRepository.peek(roomId).orElseThrow().getMaxPlayers()).isEqualTo(4);
    }

    @Test
    void removeRoom_shouldDeleteAndPublishRoomRemoved() {
        // Arrange
        Room room = roomService.createRoom("A", "Anna", "", "Course", null, null, null);

        // Act
        boolean removed = roomService.removeRoom(room.getId());

        // Assert
        assertThat(removed).isTrue();
        assertThat(roomRepository.existsById(room.getId())).isFalse();
        assertThat(lastEvent().type()).isEqualTo(RoomEventType.ROOM_REMOVED);
        assertThat(roomService.removeRoom(room.getId())).isFalse();
    }

    // ------------------------------------------------------------------------------------
    // listActiveRooms
    // ------------------------------------------------------------------------------------

    @Test
    void listActiveRooms_shouldHideStaleRunningGames_butKeepWaitingRooms() {
        // Arrange
        Room waiting = roomService.createRoom("A", "Anna", "", "Waiting", null, null, null);

        clock.advance(Duration.ofMinutes(1));
        Room running = roomService.createRoom("B", "Ben", "", "Running", null, null, null);
        roomService.addPlayer(running.getId(), new Player("C", "Cleo", ""));
        gameService.startGame(running.getId());

        clock.advance(Duration.ofMinutes(1));
        Room fresh = roomService.createRoom("D", "Dora", "", "Fresh", null, null, null);

        // Act
        List<Room> beforeTimeout = roomService.listActiveRooms();
        clock.advance(Duration.ofHours(25));
        List<Room> afterTimeout = roomService.listActiveRooms();

        // Assert
        assertThat(beforeTimeout).extracting(Room::getId)
                .containsExactly(fresh.getId(), running.getId(), waiting.getId());
        assertThat(afterTimeout).extracting(Room::getId)
                .containsExactly(fresh.getId(), waiting.getId());
    }

    // ------------------------------------------------------------------------------------
    // helpers
    // ------------------------------------------------------------------------------------

    private RoomEventDto lastEvent() {
        ArgumentCaptor<RoomEventDto> captor = ArgumentCaptor.forClass(RoomEventDto.class);
        verify(eventPublisher, atLeastOnce()).publish(captor.capture());
        return captor.getValue();
    }
}
