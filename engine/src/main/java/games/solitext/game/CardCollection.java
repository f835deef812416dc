package games.solitext.game;

import java.util.List;

/**
 * A pile of cards that can give up cards from its top and accept cards onto it.
 * <p>
 * Implemented by the three physical pile types of the layout:
 * <ul>
 *   <li>{@link WastePile}: the face-up pile fed by draws from the deck.</li>
 *   <li>{@link CardColumn}: a tableau column with per-card face-up/face-down state.</li>
 *   <li>{@link FoundationPile}: an ascending single-suit pile.</li>
 * </ul>
 * <p>
 * The operations here only enforce the <em>shape</em> of a transfer (how many cards a pile
 * gives or accepts at a time). Whether a particular card may land on a particular pile under
 * Solitaire rules is decided beforehand by {@code MoveValidator}, using {@link #peek()} and
 * {@link #peekN(int)} which never mutate.
 * <p>
 * Card sequences are always ordered bottom first: the last element of a returned list is the
 * topmost card.
 */
public interface CardCollection {

    /**
     * Removes the top {@code count} cards.
     *
     * @param count number of cards to remove
     * @return the removed cards, bottom first, or {@code null} if {@code count} is less than 1,
     *         exceeds the cards available, or exceeds what this pile allows in one removal
     */
    List<Card> take(int count);

    /**
     * Places cards on top of this pile.
     *
     * @param cards the cards to add, bottom first
     * @return {@code true} if the cards were added; {@code false} if this pile does not accept
     *         that many cards in one call (nothing is added in that case)
     */
    boolean receive(List<Card> cards);

    /**
     * Checks whether {@link #receive(List)} would accept {@code count} cards.
     *
     * @param count the number of cards about to be received
     * @return {@code true} if a receive of that size would succeed
     */
    boolean canReceive(int count);

    /**
     * Returns the top card without removing it.
     *
     * @return the top card, or {@code null} if the pile is empty
     */
    Card peek();

    /**
     * Returns the top {@code count} cards without removing them.
     *
     * @param count number of cards to inspect
     * @return the cards, bottom first, or {@code null} if fewer than {@code count} are present
     *         or {@code count} is less than 1
     */
    List<Card> peekN(int count);

    /**
     * Returns the number of cards in this pile.
     */
    int size();

    default boolean isEmpty() {
        return size() == 0;
    }
}
