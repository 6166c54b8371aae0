package org.carball.sascan.analyzer;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.carball.sascan.model.construct.ClassifiedConstruct;

/**
 * Counts concurrently open blocks. Opens increment the depth, closes decrement it, and a close with
 * nothing open is ignored so the depth never goes negative.
 */
@Slf4j
@Getter
public class NestingTracker {

    private int depth;
    private int maxDepth;

    public void accept(ClassifiedConstruct construct) {
        switch (construct.kind()) {
            case LOOP_OPEN:
                open();
                break;
            case BLOCK_CLOSE:
                close(construct.lineNumber());
                break;
            default:
                break;
        }
    }

    public void open() {
        depth++;
        if (depth > maxDepth) {
            maxDepth = depth;
        }
    }

    public void close(int lineNumber) {
        if (depth == 0) {
            log.debug("Unmatched block close on line {} ignored", lineNumber);
            return;
        }
        depth--;
    }
}
