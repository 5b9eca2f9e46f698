package eu.virtualparadox.knowledgebase.api.dto;

import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * @param contentHash optional SHA-256 (hex) of the normalized content
 * @param documentClass optional class overriding classification
 */
public record IngestRequest(@NotNull String content,
                            @NotBlank @Size(max = 1024) String origin,
                            @Size(max = 128) String knowledgeBase,
                            @Pattern(regexp = "[0-9a-fA-F]{64}") String contentHash,
                            DocumentClass documentClass) {
}
