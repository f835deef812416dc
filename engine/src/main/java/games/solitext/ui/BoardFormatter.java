package games.solitext.ui;

import games.solitext.game.Card;
import games.solitext.game.CardColumn;
import games.solitext.game.CardState;
import games.solitext.game.FoundationPile;
import games.solitext.game.GameState;
import games.solitext.selection.CursorState;
import games.solitext.selection.Selection;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a game and the player's selections as plain console text.
 * <p>
 * The board has three boxed sections: foundations (F1–F4), the tableau (C1–C7, face-down cards
 * shown as {@code ##}) and the deck with the exposed waste cards. Cards under the cursor are
 * prefixed with {@code >}; picked-up cards with {@code *}.
 * <p>
 * Red cards carry ANSI colour codes. All width calculations ignore those codes so that cells
 * stay aligned.
 */
public class BoardFormatter {
    private static final int CELL_WIDTH = 7;
    private static final String CURSOR_MARK = ">";
    private static final String PICKED_MARK = "*";
    private static final String FACE_DOWN = "##";

    private final GameState state;
    private final CursorState cursorState;

    public BoardFormatter(GameState state, CursorState cursorState) {
        this.state = state;
        this.cursorState = cursorState;
    }

    /**
     * Creates a formatter that shows the cards only, without selections or messages (menus and
     * the victory screen).
     */
    public BoardFormatter(GameState state) {
        this(state, null);
    }

    /**
     * Renders the board, followed by the help and status lines when there is a cursor.
     */
    public String format() {
        if (cursorState == null) {
            StringBuilder sb = new StringBuilder();
            appendFoundationSection(sb);
            appendTableauSection(sb);
            appendDeckSection(sb);
            return sb.toString();
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Solitext  (").append(state.getGameMode()).append(")    h: Help  esc: Menu\n");
        appendFoundationSection(sb);
        appendTableauSection(sb);
        appendDeckSection(sb);
        sb.append("select: Select/Move cards\n");
        if (!cursorState.getContextHelp().isEmpty()) {
            sb.append(cursorState.getContextHelp()).append('\n');
        }
        if (cursorState.isDebugMode()) {
            sb.append("[debug] cursor=").append(cursorState.getCursor())
                    .append(" selected=").append(cursorState.hasSelected() ? cursorState.getSelected() : "-")
                    .append('\n');
            if (!cursorState.getStatusMessage().isEmpty()) {
                sb.append("[debug] ").append(cursorState.getStatusMessage()).append('\n');
            }
        } else if (!cursorState.getStatusMessage().isEmpty()) {
            sb.append(cursorState.getStatusMessage()).append('\n');
        }
        return sb.toString();
    }

    private void appendFoundationSection(StringBuilder sb) {
        sb.append("FOUNDATION\n");
        List<String> labels = new ArrayList<>();
        List<String> values = new ArrayList<>();
        for (int i = 0; i < GameState.FOUNDATION_COUNT; i++) {
            FoundationPile pile = state.getFoundation(i);
            labels.add("F" + (i + 1));
            Card top = pile.peek();
            String value = top == null ? pile.getSuit().getSymbol() + "_" : top.toString();
            values.add(marks(Selection.pile(i)) + value);
        }
        appendBoxRow(sb, labels, values, "  ", width(labels, values));
        sb.append('\n');
    }

    private void appendTableauSection(StringBuilder sb) {
        sb.append("TABLEAU\n");
        List<String> labels = new ArrayList<>();
        List<List<String>> columns = new ArrayList<>();
        for (int i = 0; i < GameState.COLUMN_COUNT; i++) {
            CardColumn column = state.getColumn(i);
            labels.add("C" + (i + 1) + " [" + column.faceDownCards() + "]");
            columns.add(columnCells(i, column));
        }

        int width = Math.max(width(labels, labels), maxVisibleLengthColumns(columns));
        String indent = "  ";
        String border = buildBorder(labels.size(), indent, width);
        sb.append(border).append('\n');
        sb.append(buildRow(labels, indent, width)).append('\n');

        int maxRows = 0;
        for (List<String> col : columns) {
            maxRows = Math.max(maxRows, col.size());
        }
        for (int row = 0; row < maxRows; row++) {
            List<String> rowCells = new ArrayList<>();
            for (List<String> col : columns) {
                rowCells.add(row < col.size() ? col.get(row) : "");
            }
            sb.append(buildRow(rowCells, indent, width)).append('\n');
        }
        sb.append(border).append('\n');
    }

    private List<String> columnCells(int index, CardColumn column) {
        List<String> cells = new ArrayList<>();
        if (column.isEmpty()) {
            cells.add(marks(Selection.column(index, 0)) + "(empty)");
            return cells;
        }
        int size = column.size();
        for (int i = 0; i < size; i++) {
            String face = column.stateAt(i) == CardState.FACE_UP ? column.cardAt(i).toString() : FACE_DOWN;
            cells.add(columnMarks(index, size - i) + face);
        }
        return cells;
    }

    /**
     * Marks for the card {@code depth} places from the top of column {@code index} (1 = top).
     */
    private String columnMarks(int index, int depth) {
        if (cursorState == null) {
            return "";
        }
        StringBuilder marks = new StringBuilder();
        Selection selected = cursorState.getSelected();
        if (selected != null && selected.isColumn() && selected.index() == index && depth <= selected.cardCount()) {
            marks.append(PICKED_MARK);
        }
        Selection cursor = cursorState.getCursor();
        if (cursor.isColumn() && cursor.index() == index && depth <= cursor.cardCount()) {
            marks.append(CURSOR_MARK);
        }
        return marks.toString();
    }

    private void appendDeckSection(StringBuilder sb) {
        sb.append("DECK & WASTE\n");
        List<String> labels = new ArrayList<>();
        List<String> values = new ArrayList<>();
        labels.add("DECK");
        labels.add("WASTE");

        values.add(state.getDeck().isEmpty() ? "( O )" : state.getDeck().size() + " down");
        List<Card> visible = state.getVisibleWaste();
        if (visible.isEmpty()) {
            values.add(marks(Selection.deck()) + "--");
        } else {
            List<String> shown = new ArrayList<>();
            for (int i = 0; i < visible.size(); i++) {
                boolean top = i == visible.size() - 1;
                shown.add((top ? marks(Selection.deck()) : "") + visible.get(i));
            }
            values.add(String.join(" ", shown));
        }
        appendBoxRow(sb, labels, values, "  ", width(labels, values));
        sb.append('\n');
    }

    /**
     * Marks for a whole pile: picked-up and/or under the cursor.
     */
    private String marks(Selection pile) {
        if (cursorState == null) {
            return "";
        }
        StringBuilder marks = new StringBuilder();
        Selection selected = cursorState.getSelected();
        if (selected != null && selected.sameCollection(pile)) {
            marks.append(PICKED_MARK);
        }
        if (cursorState.getCursor().sameCollection(pile)) {
            marks.append(CURSOR_MARK);
        }
        return marks.toString();
    }

    private void appendBoxRow(StringBuilder sb, List<String> labels, List<String> contents, String indent, int width) {
        String top = buildBorder(labels.size(), indent, width);
        sb.append(top).append('\n')
                .append(buildRow(labels, indent, width)).append('\n')
                .append(buildRow(contents, indent, width)).append('\n')
                .append(top);
    }

    private String buildBorder(int count, String indent, int cellWidth) {
        StringBuilder line = new StringBuilder(indent);
        for (int i = 0; i < count; i++) {
            line.append("+").append("-".repeat(cellWidth + 2)).append("+");
            if (i < count - 1) {
                line.append("  ");
            }
        }
        return line.toString();
    }

    private String buildRow(List<String> cells, String indent, int cellWidth) {
        StringBuilder line = new StringBuilder(indent);
        for (int i = 0; i < cells.size(); i++) {
            line.append("| ").append(padCell(cells.get(i), cellWidth)).append(" |");
            if (i < cells.size() - 1) {
                line.append("  ");
            }
        }
        return line.toString();
    }

    /**
     * Centres {@code value} within {@code width} visible characters.
     */
    private String padCell(String value, int width) {
        int visible = visibleLength(value);
        if (visible >= width) {
            return value;
        }
        int totalPad = width - visible;
        int left = totalPad / 2;
        return " ".repeat(left) + value + " ".repeat(totalPad - left);
    }

    /**
     * Length of {@code value} on screen, excluding ANSI colour escape sequences.
     */
    static int visibleLength(String value) {
        return value.replaceAll("\\u001B\\[[;\\d]*m", "").length();
    }

    private int width(List<String> labels, List<String> values) {
        int max = CELL_WIDTH;
        for (String item : labels) {
            max = Math.max(max, visibleLength(item));
        }
        for (String item : values) {
            max = Math.max(max, visibleLength(item));
        }
        return max;
    }

    private int maxVisibleLengthColumns(List<List<String>> columns) {
        int max = 0;
        for (List<String> col : columns) {
            for (String item : col) {
                max = Math.max(max, visibleLength(item));
            }
        }
        return max;
    }
}
