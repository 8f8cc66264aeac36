package com.raditha.approx.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Finds the lines of a kernel that may be approximated.
 * <p>
 * A marker comment such as {@code //anotacao:} or {@code /*anotacao:*}{@code /}, alone on
 * its line and optionally followed by a line-continuation backslash, flags the line
 * directly below it. The marker line itself is never modifiable and is left out of the
 * logical index, as are blank lines.
 */
public class AnnotationParser {

    private static final Logger logger = LoggerFactory.getLogger(AnnotationParser.class);

    public static final String DEFAULT_MARKER = "anotacao:";

    private final String marker;
    private final Pattern annotationPattern;

    public AnnotationParser() {
        this(DEFAULT_MARKER);
    }

    public AnnotationParser(String marker) {
        if (marker == null || marker.isBlank()) {
            throw new IllegalArgumentException("annotation marker cannot be blank");
        }
        this.marker = marker;
        String quoted = Pattern.quote(marker);
        this.annotationPattern = Pattern.compile(
                "^\\s*(?://" + quoted + "|/\\*" + quoted + "\\*/)\\s*(?:\\\\)?\\s*$");
    }

    /**
     * Read and parse a source file.
     *
     * @throws ParseException if the file cannot be read
     */
    public ParsedSource parse(Path sourceFile) throws ParseException {
        List<String> lines;
        try {
            lines = Files.readAllLines(sourceFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ParseException("Cannot read source file " + sourceFile + ": " + e.getMessage(), e);
        }
        ParsedSource parsed = parse(lines);
        if (parsed.isEmpty()) {
            logger.warn("No lines annotated with '{}' in {}; nothing to explore", marker, sourceFile);
        }
        return parsed;
    }

    public ParsedSource parse(List<String> lines) {
        List<Integer> modifiable = new ArrayList<>();
        SortedMap<Integer, Integer> physicalToLogical = new TreeMap<>();
        int logical = 0;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            if (isAnnotation(line)) {
                int next = i + 1;
                if (next < lines.size() && !lines.get(next).isBlank() && !isAnnotation(lines.get(next))) {
                    modifiable.add(next);
                }
                continue;
            }
            physicalToLogical.put(i, ++logical);
        }

        logger.debug("Parsed {} lines: {} logical, {} modifiable", lines.size(), logical, modifiable.size());
        return new ParsedSource(lines, modifiable, physicalToLogical);
    }

    public boolean isAnnotation(String line) {
        return annotationPattern.matcher(line).matches();
    }

    public String getMarker() {
        return marker;
    }
}
