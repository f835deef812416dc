package games.solitext.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A tableau column: cards bottom to top, each face-up or face-down.
 * <p>
 * A column normally holds some face-down cards under a contiguous face-up run. Any number of
 * cards may be taken or received at once. Taken cards lose their {@link CardState}; received
 * cards are always placed face-up, so a take followed by a receive of the same cards restores
 * the card order but turns any face-down cards among them face-up.
 */
public class CardColumn implements CardCollection {
    private final List<Card> cards = new ArrayList<>();
    private final List<CardState> states = new ArrayList<>();

    /**
     * Appends a card with an explicit state. Used when dealing.
     */
    public void add(Card card, CardState state) {
        cards.add(card);
        states.add(state);
    }

    /**
     * Returns the state of the card at {@code index} (0 is the bottom card).
     *
     * @throws IndexOutOfBoundsException if the index is outside the column
     */
    public CardState stateAt(int index) {
        return states.get(index);
    }

    /**
     * Returns the card at {@code index} (0 is the bottom card).
     *
     * @throws IndexOutOfBoundsException if the index is outside the column
     */
    public Card cardAt(int index) {
        return cards.get(index);
    }

    /**
     * Counts the contiguous face-up cards at the top of the column.
     *
     * @return the face-up run length; 0 for an empty column or a face-down top card
     */
    public int faceUpCards() {
        int count = 0;
        for (int i = states.size() - 1; i >= 0 && states.get(i) == CardState.FACE_UP; i--) {
            count++;
        }
        return count;
    }

    /**
     * Returns the number of face-down cards in the column.
     */
    public int faceDownCards() {
        int count = 0;
        for (CardState state : states) {
            if (state == CardState.FACE_DOWN) {
                count++;
            }
        }
        return count;
    }

    /**
     * Turns the top card face-up if it is face-down.
     *
     * @return {@code true} if a card was turned
     */
    public boolean turnTopFaceUp() {
        int top = states.size() - 1;
        if (top < 0 || states.get(top) == CardState.FACE_UP) {
            return false;
        }
        states.set(top, CardState.FACE_UP);
        return true;
    }

    @Override
    public List<Card> take(int count) {
        if (count < 1 || count > cards.size()) {
            return null;
        }
        int from = cards.size() - count;
        List<Card> top = cards.subList(from, cards.size());
        List<Card> taken = new ArrayList<>(top);
        top.clear();
        states.subList(from, states.size()).clear();
        return taken;
    }

    @Override
    public boolean receive(List<Card> incoming) {
        if (incoming == null || !canReceive(incoming.size())) {
            return false;
        }
        for (Card card : incoming) {
            add(card, CardState.FACE_UP);
        }
        return true;
    }

    @Override
    public boolean canReceive(int count) {
        return count >= 1;
    }

    @Override
    public Card peek() {
        return cards.isEmpty() ? null : cards.get(cards.size() - 1);
    }

    @Override
    public List<Card> peekN(int count) {
        if (count < 1 || count > cards.size()) {
            return null;
        }
        return new ArrayList<>(cards.subList(cards.size() - count, cards.size()));
    }

    @Override
    public int size() {
        return cards.size();
    }

    /**
     * Returns the face-up run only, bottom first.
     */
    public List<Card> visibleCards() {
        int faceUp = faceUpCards();
        return Collections.unmodifiableList(new ArrayList<>(cards.subList(cards.size() - faceUp, cards.size())));
    }

    public List<Card> asUnmodifiableList() {
        return Collections.unmodifiableList(cards);
    }

    @Override
    public String toString() {
        return "CardColumn(size=" + cards.size() + ", faceUp=" + faceUpCards() + ")";
    }
}
