package com.vidnyan.guardian.domain.normalize;

/**
 * One issue as a parser read it, before severity mapping and path normalization.
 *
 * @param level tool-native severity level, looked up in the analyzer's severity table
 */
public record ParsedIssue(
    String file,
    Integer line,
    String level,
    String message,
    String ruleId
) {
}
