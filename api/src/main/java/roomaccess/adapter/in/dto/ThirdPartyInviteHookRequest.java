package roomaccess.adapter.in.dto;

/**
 * DTO for the third-party invite hook.
 *
 * @param sender  the inviting user (required)
 * @param medium  the kind of address, e.g. "email" (required)
 * @param address the address (required)
 */
public record ThirdPartyInviteHookRequest(String sender, String medium, String address) {}
