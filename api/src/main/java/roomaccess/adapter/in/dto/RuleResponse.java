package roomaccess.adapter.in.dto;

import roomaccess.core.model.AccessRule;

/**
 * Response of the room creation hook: the rule the host must store.
 */
public record RuleResponse(AccessRule rule) {}
