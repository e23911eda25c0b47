package org.eao.jsa.domain.header;

/**
 * Proposal facts of a file; every component may be {@code null}.
 *
 * @param project survey the data belong to ({@code SURVEY})
 * @param id proposal id ({@code PROJECT})
 * @param pi principal investigator ({@code PI})
 * @param title proposal title ({@code TITLE})
 * @since 0.1.0
 */
public record ProposalFields(String project, String id, String pi, String title) {}
