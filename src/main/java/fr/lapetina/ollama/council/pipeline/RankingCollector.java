package fr.lapetina.ollama.council.pipeline;

import fr.lapetina.ollama.council.domain.model.AdvisorResponse;
import fr.lapetina.ollama.council.domain.model.AdvisorSpec;
import fr.lapetina.ollama.council.domain.model.ChatMessage;
import fr.lapetina.ollama.council.domain.model.GatewayResponse;
import fr.lapetina.ollama.council.domain.model.Label;
import fr.lapetina.ollama.council.domain.model.LabelMap;
import fr.lapetina.ollama.council.domain.model.RankingEntry;
import fr.lapetina.ollama.council.domain.port.SystemPromptLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Stage 2: blind peer review.
 *
 * <p>Non-empty Stage 1 answers are labeled "Response A", "Response B", ... in Stage 1 order
 * and shown without attribution to every advisor that answered in Stage 1. Each reviewer
 * returns a free-form evaluation ending with a {@code FINAL RANKING:} list, parsed by
 * {@link RankingParser}.
 */
public final class RankingCollector {

    static final String STAGE = "stage2";

    private static final Logger log = LoggerFactory.getLogger(RankingCollector.class);

    private final AdvisorInvoker invoker;
    private final SystemPromptLoader promptLoader;
    private final Duration timeout;

    public RankingCollector(AdvisorInvoker invoker, SystemPromptLoader promptLoader, Duration timeout) {
        this.invoker = invoker;
        this.promptLoader = promptLoader != null ? promptLoader : SystemPromptLoader.NONE;
        this.timeout = timeout;
    }

    /**
     * Rankings plus the label assignment they refer to.
     */
    public record RankingOutcome(List<RankingEntry> entries, LabelMap labelMap) {
        public RankingOutcome {
            entries = entries != null ? List.copyOf(entries) : List.of();
            if (labelMap == null) {
                labelMap = LabelMap.empty();
            }
        }

        public static RankingOutcome empty() {
            return new RankingOutcome(List.of(), LabelMap.empty());
        }
    }

    public RankingOutcome rank(String question, List<AdvisorResponse> stage1, List<AdvisorSpec> advisors) {
        List<AdvisorResponse> candidates = stage1.stream()
                .filter(response -> !response.isEmpty())
                .toList();

        if (candidates.isEmpty()) {
            log.warn("Stage 2 skipped: no Stage 1 answers to rank");
            return RankingOutcome.empty();
        }

        LabelMap labelMap = LabelMap.assign(candidates);
        List<ChatMessage> messages = List.of(ChatMessage.user(PromptTemplates.ranking(question, candidates, labelMap)));

        Set<String> answered = new HashSet<>(labelMap.models());
        List<AdvisorSpec> reviewers = advisors.stream()
                .filter(advisor -> answered.contains(advisor.name()))
                .toList();

        List<CompletableFuture<GatewayResponse>> calls = new ArrayList<>(reviewers.size());
        for (AdvisorSpec reviewer : reviewers) {
            String systemPrompt = PromptResolver.resolve(promptLoader, reviewer.name(), reviewer.promptFile());
            calls.add(invoker.invoke(STAGE, reviewer.name(), reviewer.model(), messages, systemPrompt, timeout));
        }

        List<GatewayResponse> outcomes = AdvisorInvoker.joinAll(calls);

        List<RankingEntry> entries = new ArrayList<>(reviewers.size());
        for (int i = 0; i < reviewers.size(); i++) {
            String text = ResponseSanitizer.clean(outcomes.get(i).contentOrEmpty());
            List<Label> parsed = RankingParser.parse(text);
            if (!text.isEmpty() && parsed.isEmpty()) {
                log.warn("Ranking not parseable: advisor={}", reviewers.get(i).name());
            }
            entries.add(new RankingEntry(reviewers.get(i).name(), text, parsed));
        }

        long parsedCount = entries.stream().filter(RankingEntry::hasParsedRanking).count();
        log.info("Stage 2 collected: candidates={}, reviewers={}, parsed={}",
                candidates.size(), reviewers.size(), parsedCount);
        return new RankingOutcome(entries, labelMap);
    }
}
