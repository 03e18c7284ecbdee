package roomaccess.adapter.in.dto;

/**
 * Response of an admission hook when the change is allowed.
 */
public record DecisionResponse(boolean allowed) {}
