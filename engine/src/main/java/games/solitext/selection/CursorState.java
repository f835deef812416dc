package games.solitext.selection;

import games.solitext.game.GameState;

/**
 * What the player is pointing at and what they have picked up.
 * <p>
 * Lives beside a {@link GameState}, never inside it: replacing the game leaves the cursor to be
 * {@link #reset()} by the caller. Also carries the two lines of text the turn pipeline derives
 * each turn (context help and status).
 */
public class CursorState {
    private Selection cursor = Selection.deck();
    private Selection selected;
    private boolean debugMode;
    private String contextHelp = "";
    private String statusMessage = "";

    public CursorState() {
    }

    public CursorState(boolean debugMode) {
        this.debugMode = debugMode;
    }

    /**
     * Puts the cursor back on the deck and drops any picked-up cards and messages.
     * Debug mode is kept.
     */
    public void reset() {
        cursor = Selection.deck();
        selected = null;
        contextHelp = "";
        statusMessage = "";
    }

    /**
     * Re-applies the column selection rules to the cursor and the picked-up selection.
     */
    public void clamp(GameState state) {
        cursor = cursor.applyColumnSelectionRules(state, debugMode);
        if (selected != null) {
            selected = selected.applyColumnSelectionRules(state, debugMode);
        }
    }

    public Selection getCursor() {
        return cursor;
    }

    public void setCursor(Selection cursor) {
        this.cursor = cursor;
    }

    /**
     * Returns the picked-up selection, or {@code null} if nothing is picked up.
     */
    public Selection getSelected() {
        return selected;
    }

    public void setSelected(Selection selected) {
        this.selected = selected;
    }

    public void clearSelected() {
        this.selected = null;
    }

    public boolean hasSelected() {
        return selected != null;
    }

    public boolean isDebugMode() {
        return debugMode;
    }

    public void toggleDebugMode() {
        this.debugMode = !debugMode;
    }

    public String getContextHelp() {
        return contextHelp;
    }

    public void setContextHelp(String contextHelp) {
        this.contextHelp = contextHelp;
    }

    public String getStatusMessage() {
        return statusMessage;
    }

    public void setStatusMessage(String statusMessage) {
        this.statusMessage = statusMessage;
    }
}
