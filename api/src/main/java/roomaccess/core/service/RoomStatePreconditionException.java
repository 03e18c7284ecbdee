package roomaccess.core.service;

/**
 * Thrown when the room state needed for a decision cannot be read.
 *
 * <p>This is an infrastructure fault and must not be reported as a policy denial.
 */
public class RoomStatePreconditionException extends RuntimeException {

    private final String roomId;

    public RoomStatePreconditionException(String roomId, String message) {
        super(message);
        this.roomId = roomId;
    }

    public RoomStatePreconditionException(String roomId, String message, Throwable cause) {
        super(message, cause);
        this.roomId = roomId;
    }

    public String roomId() {
        return roomId;
    }
}
