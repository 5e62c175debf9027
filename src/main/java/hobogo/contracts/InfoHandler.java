package hobogo.contracts;

import hobogo.records.SearchInfo;

/**
 * Callback for incremental search updates ("info" lines in protocol terms).
 *
 * <p>The search calls {@link #onInfo} at a fixed interval while it thinks and
 * once more when it finishes. Front-ends and test harnesses can render or
 * record the progress without parsing text output.</p>
 */
@FunctionalInterface
public interface InfoHandler {

    InfoHandler NONE = info -> {};

    /**
     * Invoked by the search whenever it generates a new {@link SearchInfo}
     * snapshot.
     *
     * @param info immutable data object describing the current search state
     */
    void onInfo(SearchInfo info);
}
