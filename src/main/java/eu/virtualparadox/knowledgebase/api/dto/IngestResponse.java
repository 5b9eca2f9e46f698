package eu.virtualparadox.knowledgebase.api.dto;

public record IngestResponse(String jobId) {
}
