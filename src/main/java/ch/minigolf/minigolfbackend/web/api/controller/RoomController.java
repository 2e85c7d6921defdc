package ch.minigolf.minigolfbackend.web.api.controller;

import ch.minigolf.minigolfbackend.domain.Player;
import ch.minigolf.minigolfbackend.domain.Room;
import ch.minigolf.minigolfbackend.service.GameService;
import ch.minigolf.minigolfbackend.service.RoomService;
import ch.minigolf.minigolfbackend.web.api.dto.*;

import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * JSON façade of the room coordinator.
 *
 * <p>Every response is wrapped in {@link ApiResponse}. Unknown rooms map to 404, rejected
 * operations and missing fields to 400. Mutating endpoints answer with the room state after the
 * change.
 */
@RestController
@RequestMapping("/api/rooms")
public class RoomController {

    private static final String ROOM_NOT_FOUND = "Room not found";
    private static final String MISSING_FIELDS = "Missing required fields";

    private final RoomService roomService;
    private final GameService gameService;

    public RoomController(RoomService roomService, GameService gameService) {
        this.roomService = roomService;
        this.gameService = gameService;
    }

    @Operation(summary = "List waiting rooms and recently active games")
    @GetMapping
    public ResponseEntity<ApiResponse<List<RoomDto>>> listRooms() {
        List<RoomDto> rooms = roomService.listActiveRooms().stream()
                .map(RoomDto::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.ok(rooms));
    }

    @Operation(summary = "Get a room by id")
    @GetMapping("/{roomId}")
    public ResponseEntity<ApiResponse<RoomDto>> getRoom(@PathVariable String roomId) {
        return roomService.getRoom(roomId)
                .map(room -> ResponseEntity.ok(ApiResponse.ok(RoomDto.from(room))))
                .orElseGet(() -> notFound(ROOM_NOT_FOUND));
    }

    @Operation(summary = "Create a new room with the host as first player")
    @PostMapping
    public ResponseEntity<ApiResponse<RoomDto>> createRoom(@RequestBody CreateRoomRequest request) {
        if (isBlank(request.hostId()) || isBlank(request.hostName()) || isBlank(request.roomName())) {
            return badRequest(MISSING_FIELDS);
        }
        if (request.maxPlayers() != null && request.maxPlayers() < 2) {
            return badRequest("maxPlayers must be at least 2");
        }
        if (request.shotsPerPlayer() != null && request.shotsPerPlayer() < 1) {
            return badRequest("shotsPerPlayer must be at least 1");
        }

        Room room = roomService.createRoom(
                request.hostId(),
                request.hostName(),
                request.walletAddress(),
                request.roomName(),
                request.maxPlayers(),
                request.shotsPerPlayer(),
                request.rewardAmount()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(RoomDto.from(room)));
    }

    @Operation(summary = "Join a waiting room")
    @PostMapping("/{roomId}/join")
    public ResponseEntity<ApiResponse<RoomDto>> joinRoom(@PathVariable String roomId,
                                                         @RequestBody JoinRoomRequest request) {
        if (isBlank(request.playerId()) || isBlank(request.playerName())) {
            return badRequest(MISSING_FIELDS);
        }
        if (!roomService.roomExists(roomId)) {
            return notFound(ROOM_NOT_FOUND);
        }

        Player player = new Player(request.playerId(), request.playerName(), request.walletAddress());
        if (!roomService.addPlayer(roomId, player)) {
            return badRequest("Failed to join room");
        }
        return currentState(roomId);
    }

    @Operation(summary = "Leave a room")
    @PostMapping("/{roomId}/leave")
    public ResponseEntity<ApiResponse<RoomDto>> leaveRoom(@PathVariable String roomId,
                                                          @RequestBody LeaveRoomRequest request) {
        if (isBlank(request.playerId())) {
            return badRequest("Missing player ID");
        }
        if (!roomService.removePlayer(roomId, request.playerId())) {
            return notFound("Room or player not found");
        }

        // the room is gone when the last connected player left
        RoomDto room = roomService.getRoom(roomId).map(RoomDto::from).orElse(null);
        return ResponseEntity.ok(ApiResponse.ok(room));
    }

    @Operation(summary = "Replace a player's state (no turn or score checks)")
    @PutMapping("/{roomId}/players/{playerId}")
    public ResponseEntity<ApiResponse<RoomDto>> updatePlayer(@PathVariable String roomId,
                                                             @PathVariable String playerId,
                                                             @RequestBody UpdatePlayerRequest request) {
        PlayerDto dto = request.player();
        if (dto == null || (dto.id() != null && !dto.id().equals(playerId)) || dto.shotsRemaining() < 0) {
            return badRequest("Invalid player data");
        }

        Player player = dto.toDomain();
        player.setId(playerId);
        if (!roomService.updatePlayer(roomId, player)) {
            return notFound("Room or player not found");
        }
        return currentState(roomId);
    }

    @Operation(summary = "Record the score of one shot for the player whose turn it is")
    @PostMapping("/{roomId}/score")
    public ResponseEntity<ApiResponse<RoomDto>> recordScore(@PathVariable String roomId,
                                                            @RequestBody ScoreRequest request) {
        if (isBlank(request.playerId()) || request.score() == null) {
            return badRequest(MISSING_FIELDS);
        }
        if (!roomService.roomExists(roomId)) {
            return notFound(ROOM_NOT_FOUND);
        }
        if (!gameService.recordScore(roomId, request.playerId(), request.score())) {
            return badRequest("Failed to update score");
        }
        return currentState(roomId);
    }

    @Operation(summary = "Update room settings")
    @PutMapping("/{roomId}")
    public ResponseEntity<ApiResponse<RoomDto>> updateRoom(@PathVariable String roomId,
                                                           @RequestBody UpdateRoomRequest request) {
        if (request.updates() == null) {
            return badRequest("Missing room updates");
        }
        if (!roomService.roomExists(roomId)) {
            return notFound(ROOM_NOT_FOUND);
        }
        if (!roomService.updateRoom(roomId, request.updates())) {
            return badRequest("Failed to update room");
        }
        return currentState(roomId);
    }

    @Operation(summary = "Start the game of a waiting room")
    @PostMapping("/{roomId}/start")
    public ResponseEntity<ApiResponse<RoomDto>> startGame(@PathVariable String roomId) {
        if (!roomService.roomExists(roomId)) {
            return notFound(ROOM_NOT_FOUND);
        }
        if (!gameService.startGame(roomId)) {
            return badRequest("Failed to start game");
        }
        return currentState(roomId);
    }

    @Operation(summary = "Pass the turn to the next player, completing the game if nobody is left")
    @PostMapping("/{roomId}/next-turn")
    public ResponseEntity<ApiResponse<RoomDto>> nextTurn(@PathVariable String roomId) {
        if (!roomService.roomExists(roomId)) {
            return notFound(ROOM_NOT_FOUND);
        }
        if (!gameService.advanceTurn(roomId)) {
            return badRequest("Failed to advance turn");
        }
        return currentState(roomId);
    }

    @Operation(summary = "Reset scores and shots and return the room to waiting")
    @PostMapping("/{roomId}/reset")
    public ResponseEntity<ApiResponse<RoomDto>> resetGame(@PathVariable String roomId) {
        if (!gameService.resetGame(roomId)) {
            return notFound(ROOM_NOT_FOUND);
        }
        return currentState(roomId);
    }

    @Operation(summary = "Get the winner of a completed game (null if none)")
    @GetMapping("/{roomId}/winner")
    public ResponseEntity<ApiResponse<PlayerDto>> getWinner(@PathVariable String roomId) {
        PlayerDto winner = gameService.getWinner(roomId).map(PlayerDto::from).orElse(null);
        return ResponseEntity.ok(ApiResponse.ok(winner));
    }

    // ----------------- helpers -----------------

    private ResponseEntity<ApiResponse<RoomDto>> currentState(String roomId) {
        return getRoom(roomId);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static <T> ResponseEntity<ApiResponse<T>> notFound(String error) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.failure(error));
    }

    private static <T> ResponseEntity<ApiResponse<T>> badRequest(String error) {
        return ResponseEntity.badRequest().body(ApiResponse.failure(error));
    }
}
