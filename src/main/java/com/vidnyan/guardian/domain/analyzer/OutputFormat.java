package com.vidnyan.guardian.domain.analyzer;

/**
 * Output format tag carried by every analyzer; selects exactly one parser.
 */
public enum OutputFormat {
    SARIF,
    BANDIT_JSON,
    ESLINT_JSON,
    SEMGREP_JSON,
    PIP_AUDIT_JSON,
    PMD_JSON,
    RUBOCOP_JSON,
    PHPCS_JSON,
    GENERIC_JSON,
    LINE
}
