package fr.lapetina.ollama.council.pipeline;

import fr.lapetina.ollama.council.domain.model.AdvisorResponse;
import fr.lapetina.ollama.council.domain.model.Label;
import fr.lapetina.ollama.council.domain.model.LabelMap;
import fr.lapetina.ollama.council.domain.model.RankingEntry;

import java.util.List;

/**
 * User-message templates for the ranking, synthesis and title calls.
 * Ranking prompts only ever see labels, never advisor names.
 */
final class PromptTemplates {

    private PromptTemplates() {
        // Utility class
    }

    static String ranking(String question, List<AdvisorResponse> candidates, LabelMap labelMap) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are evaluating different responses to the following question:\n\n");
        sb.append("Question: ").append(question).append("\n\n");
        sb.append("Here are the responses from different individuals (anonymized):\n\n");

        for (AdvisorResponse candidate : candidates) {
            Label label = labelMap.labelFor(candidate.model())
                    .orElseThrow(() -> new IllegalStateException("Unlabeled candidate: " + candidate.model()));
            sb.append(label.value()).append(":\n");
            sb.append(candidate.response()).append("\n\n");
        }

        sb.append("""
                Your task:
                1. Evaluate each response on its own: say what it does well and what it does poorly.
                2. Then, at the very end of your answer, give your final ranking.

                IMPORTANT: your final ranking MUST be formatted EXACTLY as follows:
                - Start with the line "FINAL RANKING:" (all caps, with the colon)
                - Then list the responses from best to worst as a numbered list
                - Each line is: a number, a period, a space, then ONLY the response label (e.g. "1. Response A")
                - Add no other text or explanation in the ranking section

                Example of the required format for your whole answer:

                Response A gives good detail on X but misses Y...
                Response B is accurate but lacks depth on Z...
                Response C offers the most complete answer...

                FINAL RANKING:
                1. Response C
                2. Response A
                3. Response B

                Now provide your evaluation and ranking:""");
        return sb.toString();
    }

    static String synthesis(String question, List<AdvisorResponse> stage1, List<RankingEntry> stage2) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are the Chairman of a council of advisors. Several advisors answered a user's ");
        sb.append("question, then ranked each other's answers.\n\n");
        sb.append("Original Question: ").append(question).append("\n\n");

        sb.append("STAGE 1 - Individual Responses:\n\n");
        for (AdvisorResponse response : stage1) {
            sb.append("Advisor: ").append(response.model()).append('\n');
            sb.append("Response: ").append(response.isEmpty() ? "(no response)" : response.response());
            sb.append("\n\n");
        }

        sb.append("STAGE 2 - Peer Rankings:\n\n");
        for (RankingEntry entry : stage2) {
            sb.append("Advisor: ").append(entry.model()).append('\n');
            sb.append("Ranking: ").append(entry.ranking().isBlank() ? "(no ranking)" : entry.ranking());
            sb.append("\n\n");
        }

        sb.append("""
                Your task as Chairman is to synthesize all of this into a single, comprehensive, \
                accurate answer to the user's original question. Consider:
                - The individual responses and their insights
                - The peer rankings and what they reveal about response quality
                - Any patterns of agreement or disagreement

                Provide a clear, well-reasoned final answer that represents the council's collective wisdom:""");
        return sb.toString();
    }

    static String title(String question) {
        return """
                Generate a very short title (3-5 words maximum) that summarizes the following question.
                The title should be concise and descriptive. Do not use quotes or punctuation in the title.

                Question: %s

                Title:""".formatted(question);
    }
}
