package games.solitext.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The face-up pile that draws from the deck land on (the "drawn" pile).
 * <p>
 * Only the top card is playable, but any number of top cards may be removed in one take so
 * that recycling can empty it. Receives are limited to a single card at a time.
 */
public class WastePile implements CardCollection {
    private final List<Card> cards = new ArrayList<>();

    @Override
    public List<Card> take(int count) {
        if (count < 1 || count > cards.size()) {
            return null;
        }
        List<Card> top = cards.subList(cards.size() - count, cards.size());
        List<Card> taken = new ArrayList<>(top);
        top.clear();
        return taken;
    }

    @Override
    public boolean receive(List<Card> incoming) {
        if (incoming == null || !canReceive(incoming.size())) {
            return false;
        }
        cards.add(incoming.get(0));
        return true;
    }

    @Override
    public boolean canReceive(int count) {
        return count == 1;
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
     * Returns up to {@code max} top cards, bottom first, for display.
     */
    public List<Card> topCards(int max) {
        int from = Math.max(0, cards.size() - Math.max(0, max));
        return Collections.unmodifiableList(new ArrayList<>(cards.subList(from, cards.size())));
    }

    /**
     * Returns an unmodifiable view of the whole pile, bottom first.
     */
    public List<Card> asUnmodifiableList() {
        return Collections.unmodifiableList(cards);
    }

    /**
     * Appends a card drawn from the deck.
     */
    void push(Card card) {
        cards.add(card);
    }

    /**
     * Removes every card, bottom first.
     */
    List<Card> drain() {
        List<Card> all = new ArrayList<>(cards);
        cards.clear();
        return all;
    }

    @Override
    public String toString() {
        return "WastePile(size=" + cards.size() + ")";
    }
}
