package com.vidnyan.guardian.domain.normalize.parser;

import com.vidnyan.guardian.domain.analyzer.AnalyzerSpec;
import com.vidnyan.guardian.domain.analyzer.OutputFormat;
import com.vidnyan.guardian.domain.analyzer.RawOutput;
import com.vidnyan.guardian.domain.error.OutputParseException;
import com.vidnyan.guardian.domain.normalize.OutputParser;
import com.vidnyan.guardian.domain.normalize.ParsedIssue;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented compiler-style diagnostics. Understands
 * <ul>
 *   <li>{@code [WARN] path:12:5: message [RuleName]} (Checkstyle plain)</li>
 *   <li>{@code path(12,5): warning CS0168: message [project]} (MSBuild)</li>
 *   <li>{@code path:12:5: message (SA1000)} and {@code path:12: message} (go vet, staticcheck and friends)</li>
 * </ul>
 * Reads stdout, or stderr when stdout is blank. Lines matching none of these are ignored,
 * but output with no matching line at all is a parse error.
 */
public class LineOutputParser implements OutputParser {

    static final String DEFAULT_LEVEL = "warning";

    private static final Pattern CHECKSTYLE = Pattern.compile(
            "^\\[(?<level>[A-Z]+)]\\s+(?<file>.+?):(?<line>\\d+)(?::\\d+)?:\\s+(?<msg>.+?)(?:\\s+\\[(?<rule>[\\w.]+)])?$");
    private static final Pattern MSBUILD = Pattern.compile(
            "^(?<file>[^()]+?)\\((?<line>\\d+)(?:,\\d+)?\\):\\s*(?<level>error|warning|info)\\s+(?<rule>[A-Za-z]+\\d+):\\s*(?<msg>.+?)(?:\\s+\\[[^\\]]+])?$");
    private static final Pattern COLON = Pattern.compile(
            "^(?<file>[^:\\s][^:]*?):(?<line>\\d+)(?::\\d+)?:\\s*(?<msg>.+?)(?:\\s+\\((?<rule>[A-Z]+\\d+)\\))?$");

    @Override
    public OutputFormat format() {
        return OutputFormat.LINE;
    }

    @Override
    public List<ParsedIssue> parse(RawOutput output, AnalyzerSpec spec) {
        String text = output.primaryText();
        if (text.isBlank()) {
            return List.of();
        }
        List<ParsedIssue> issues = new ArrayList<>();
        for (String line : text.split("\\R")) {
            ParsedIssue issue = parseLine(line.strip());
            if (issue != null) {
                issues.add(issue);
            }
        }
        if (issues.isEmpty()) {
            throw new OutputParseException("LINE: no diagnostic lines recognized");
        }
        return issues;
    }

    static ParsedIssue parseLine(String line) {
        if (line.isEmpty()) {
            return null;
        }
        Matcher m = CHECKSTYLE.matcher(line);
        if (m.matches()) {
            return issue(m, m.group("level"));
        }
        m = MSBUILD.matcher(line);
        if (m.matches()) {
            return issue(m, m.group("level"));
        }
        m = COLON.matcher(line);
        if (m.matches()) {
            return issue(m, DEFAULT_LEVEL);
        }
        return null;
    }

    private static ParsedIssue issue(Matcher m, String level) {
        return new ParsedIssue(m.group("file").strip(), Integer.parseInt(m.group("line")), level,
                m.group("msg").strip(), m.group("rule"));
    }
}
