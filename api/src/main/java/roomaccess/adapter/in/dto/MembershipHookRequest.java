package roomaccess.adapter.in.dto;

/**
 * DTO for the membership hook.
 *
 * @param sender     the acting user (required)
 * @param target     the user whose membership would change (required)
 * @param membership the requested membership, e.g. "invite" (required)
 */
public record MembershipHookRequest(String sender, String target, String membership) {}
