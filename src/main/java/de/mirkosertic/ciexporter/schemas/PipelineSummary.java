package de.mirkosertic.ciexporter.schemas;

/**
 * One entry of a pipeline listing. Only carries what the listing endpoint returns.
 */
public record PipelineSummary(long id, String ref, String status) {
}
