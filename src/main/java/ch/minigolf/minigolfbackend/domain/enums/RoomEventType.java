package ch.minigolf.minigolfbackend.domain.enums;

public enum RoomEventType
{
    ROOM_CREATED,
    PLAYER_JOINED,
    PLAYER_LEFT,
    PLAYER_UPDATED,
    ROOM_UPDATED,
    GAME_STARTED,
    TURN_CHANGED,
    SCORE_UPDATED,
    GAME_COMPLETED,
    GAME_RESET,
    ROOM_REMOVED
}
