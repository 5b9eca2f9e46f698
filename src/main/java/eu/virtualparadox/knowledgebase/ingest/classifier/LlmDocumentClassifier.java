package eu.virtualparadox.knowledgebase.ingest.classifier;

import eu.virtualparadox.knowledgebase.error.ProviderException;
import eu.virtualparadox.knowledgebase.util.ProviderCalls;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.Prompt;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Asks a chat model for the document class. Any provider failure or unusable answer
 * degrades to the heuristic classifier.
 */
@Slf4j
@RequiredArgsConstructor
public class LlmDocumentClassifier implements DocumentClassifier {

    private static final String INSTRUCTIONS = String.join("\n",
            "You label documents for a search index.",
            "Answer with exactly one word from: text, code, table, markdown, config, log, mixed.",
            "Use mixed only when the sample clearly combines several of the other kinds.");

    private final ChatModel chatModel;
    private final HeuristicDocumentClassifier fallback;
    private final Duration retryBackoff;

    @Override
    public DocumentClass classify(final String sample, final String origin) {
        try {
            final String answer = ProviderCalls.withRetry("classifying", retryBackoff, () -> ask(sample, origin));
            final DocumentClass parsed = parse(answer);
            if (parsed != null) {
                return parsed;
            }
            log.warn("Unusable classifier answer '{}', using heuristics", answer);
        } catch (final ProviderException e) {
            log.warn("LLM classifier unavailable, using heuristics: {}", e.getMessage());
        }
        return fallback.classify(sample, origin);
    }

    private String ask(final String sample, final String origin) {
        final String user = "Origin: " + (origin == null ? "unknown" : origin) + "\n\nSample:\n" + sample;
        final Prompt prompt = new Prompt(List.of(new SystemMessage(INSTRUCTIONS), new UserMessage(user)));
        return chatModel.call(prompt)
                .getResult()
                .getOutput()
                .getText();
    }

    static DocumentClass parse(final String answer) {
        if (answer == null) {
            return null;
        }
        for (final String word : answer.toLowerCase(Locale.ROOT).split("[^a-z]+")) {
            for (final DocumentClass candidate : DocumentClass.values()) {
                if (candidate.value().equals(word)) {
                    return candidate;
                }
            }
        }
        return null;
    }
}
