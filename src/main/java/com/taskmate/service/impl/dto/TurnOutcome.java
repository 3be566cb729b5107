package com.taskmate.service.impl.dto;

/**
 * Result of one completed turn.
 *
 * @param finalText text sent back to the originating session
 * @param mutated   whether any create, update or delete succeeded during the turn
 * @param truncated whether the turn hit the model-call bound
 * @param rounds    number of model calls made
 */
public record TurnOutcome(String finalText, boolean mutated, boolean truncated, int rounds) {
}
