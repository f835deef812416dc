package games.solitext.game;

/**
 * Whether a card in a tableau column is showing its face.
 */
public enum CardState {
    FACE_UP,
    FACE_DOWN
}
