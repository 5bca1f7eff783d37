package fr.lapetina.ollama.council.pipeline;

import fr.lapetina.ollama.council.domain.model.CouncilRoster;

/**
 * One user turn to deliberate on.
 *
 * @param question      the user's question
 * @param roster        council captured for this turn
 * @param generateTitle whether to produce a conversation title alongside the stages
 */
public record DeliberationRequest(String question, CouncilRoster roster, boolean generateTitle) {

    public static DeliberationRequest of(String question, CouncilRoster roster) {
        return new DeliberationRequest(question, roster, false);
    }
}
