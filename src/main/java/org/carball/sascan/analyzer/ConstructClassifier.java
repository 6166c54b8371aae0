package org.carball.sascan.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.sascan.model.construct.ClassifiedConstruct;
import org.carball.sascan.model.construct.ConstructKind;
import org.carball.sascan.model.construct.MacroDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical, line-oriented classification of SAS constructs.
 * <p>
 * Every keyword test is case-insensitive and works on a single physical line, so a construct whose
 * keywords are spread over several lines (an {@code IF} on one line and its {@code THEN} on the next)
 * is not recognised. Keywords inside comments and string literals are matched like any other text.
 * Classification never fails: malformed input simply yields fewer or more constructs.
 */
@Slf4j
public class ConstructClassifier {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private static final Pattern IF_KEYWORD = Pattern.compile("\\bif\\b", FLAGS);
    private static final Pattern THEN_KEYWORD = Pattern.compile("\\bthen\\b", FLAGS);

    private static final Pattern DO_KEYWORD = Pattern.compile("\\bdo\\b", FLAGS);
    private static final Pattern ITERATION_KEYWORD = Pattern.compile("\\b(?:while|until)\\b", FLAGS);

    private static final Pattern END_KEYWORD = Pattern.compile("\\bend\\s*;", FLAGS);

    private static final Pattern DATA_STEP_HEADER =
            Pattern.compile("^\\s*data\\s+([A-Za-z_&][\\w.&]*+)[^;]*+;", FLAGS);

    private static final Pattern PROC_STEP_HEADER =
            Pattern.compile("^\\s*proc\\s+(\\w+)", FLAGS);

    // Parameter list may be unterminated; it then runs to the end of the line
    private static final Pattern MACRO_DEFINITION =
            Pattern.compile("%macro\\s+(\\w+)\\s*(?:\\(([^)]*)\\)?)?", FLAGS);

    private static final Pattern MACRO_CALL = Pattern.compile("%(\\w+)\\(");

    private static final Pattern MERGE_KEYWORD = Pattern.compile("\\bmerge\\b", FLAGS);
    private static final Pattern QUERY_BLOCK = Pattern.compile("\\bproc\\s+sql\\b", FLAGS);

    /**
     * Classifies every line of {@code text} in document order, feeding each construct to {@code tracker}
     * as it is produced so that {@code end;} is judged against the blocks open at that point.
     */
    public List<ClassifiedConstruct> classify(String text, NestingTracker tracker) {
        List<ClassifiedConstruct> constructs = new ArrayList<>();

        String[] lines = text.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            for (ClassifiedConstruct construct : classifyLine(lines[i], i + 1, tracker.getDepth())) {
                tracker.accept(construct);
                constructs.add(construct);
            }
        }

        return constructs;
    }

    /**
     * Classifies one physical line.
     *
     * @param line        the line text, without terminator
     * @param lineNumber  1-based position of the line, copied into each construct
     * @param openBlocks  blocks open before this line; {@code end;} only closes a block when one is open,
     *                    counting a loop opened earlier on the same line
     */
    public List<ClassifiedConstruct> classifyLine(String line, int lineNumber, int openBlocks) {
        List<ClassifiedConstruct> constructs = new ArrayList<>();
        if (line == null || line.isBlank()) {
            return constructs;
        }

        Matcher dataStep = DATA_STEP_HEADER.matcher(line);
        if (dataStep.find()) {
            constructs.add(ClassifiedConstruct.named(ConstructKind.DATA_STEP, lineNumber, dataStep.group(1)));
        }

        Matcher procStep = PROC_STEP_HEADER.matcher(line);
        if (procStep.find()) {
            constructs.add(ClassifiedConstruct.named(ConstructKind.PROC_STEP, lineNumber, procStep.group(1)));
        }

        Matcher macroDefinition = MACRO_DEFINITION.matcher(line);
        if (macroDefinition.find()) {
            MacroDefinition macro = new MacroDefinition(
                    macroDefinition.group(1), countParameters(macroDefinition.group(2)));
            constructs.add(ClassifiedConstruct.macroDefinition(lineNumber, macro));
        }

        Matcher macroCall = MACRO_CALL.matcher(line);
        while (macroCall.find()) {
            constructs.add(ClassifiedConstruct.named(ConstructKind.MACRO_CALL, lineNumber, macroCall.group(1)));
        }

        if (IF_KEYWORD.matcher(line).find() && THEN_KEYWORD.matcher(line).find()) {
            constructs.add(ClassifiedConstruct.of(ConstructKind.CONDITIONAL, lineNumber));
        }

        boolean loopOpen = isLoopOpen(line);
        if (loopOpen) {
            constructs.add(ClassifiedConstruct.of(ConstructKind.LOOP_OPEN, lineNumber));
        }

        int openAfterLoop = loopOpen ? openBlocks + 1 : openBlocks;
        if (END_KEYWORD.matcher(line).find()) {
            if (openAfterLoop > 0) {
                constructs.add(ClassifiedConstruct.of(ConstructKind.BLOCK_CLOSE, lineNumber));
            } else {
                log.trace("Ignoring 'end;' on line {} with no open block", lineNumber);
            }
        }

        if (MERGE_KEYWORD.matcher(line).find()) {
            constructs.add(ClassifiedConstruct.of(ConstructKind.DATA_MERGE, lineNumber));
        }

        if (QUERY_BLOCK.matcher(line).find()) {
            constructs.add(ClassifiedConstruct.of(ConstructKind.QUERY_BLOCK, lineNumber));
        }

        return constructs;
    }

    private boolean isLoopOpen(String line) {
        if (!DO_KEYWORD.matcher(line).find()) {
            return false;
        }
        return ITERATION_KEYWORD.matcher(line).find() || line.indexOf(';') >= 0;
    }

    /**
     * Number of declared parameters: commas plus one for a non-blank list, zero otherwise.
     */
    static int countParameters(String parameterList) {
        if (parameterList == null || parameterList.isBlank()) {
            return 0;
        }
        int commas = 0;
        for (int i = 0; i < parameterList.length(); i++) {
            if (parameterList.charAt(i) == ',') {
                commas++;
            }
        }
        return commas + 1;
    }
}
