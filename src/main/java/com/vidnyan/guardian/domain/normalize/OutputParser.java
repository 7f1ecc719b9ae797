package com.vidnyan.guardian.domain.normalize;

import com.vidnyan.guardian.domain.analyzer.AnalyzerSpec;
import com.vidnyan.guardian.domain.analyzer.OutputFormat;
import com.vidnyan.guardian.domain.analyzer.RawOutput;
import com.vidnyan.guardian.domain.error.OutputParseException;

import java.util.List;

/**
 * Parser for one output format. Pure: same output in, same issues out.
 */
public interface OutputParser {

    OutputFormat format();

    /**
     * @throws OutputParseException if the output does not have the expected structure
     */
    List<ParsedIssue> parse(RawOutput output, AnalyzerSpec spec);
}
