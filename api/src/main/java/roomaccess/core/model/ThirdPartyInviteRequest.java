package roomaccess.core.model;

/**
 * An invite addressed to a third-party identifier rather than a user id.
 *
 * @param roomId  the room
 * @param sender  the inviting user
 * @param medium  the kind of address, e.g. "email" or "msisdn"
 * @param address the address itself
 */
public record ThirdPartyInviteRequest(String roomId, String sender, String medium, String address) {}
