package ai.gamedata.translator.batch;

import ai.gamedata.translator.context.HistoryEntry;
import java.util.List;

/**
 * One unit run through the translator.
 *
 * @param text unmasked translation, ready to store on the unit
 * @param historyEntry masked pair for the history window
 * @param leakageRetried whether the stricter second call was needed
 * @param retryFailed whether that second call failed, leaving the first output in place
 * @param repairedTokens placeholders the model dropped and that were reinserted
 */
record PipelineResult(String text, HistoryEntry historyEntry, boolean leakageRetried, boolean retryFailed,
                      List<String> repairedTokens) {

    PipelineResult {
        repairedTokens = List.copyOf(repairedTokens);
    }
}
