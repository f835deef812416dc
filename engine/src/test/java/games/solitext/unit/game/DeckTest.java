package games.solitext.unit.game;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import games.solitext.game.Card;
import games.solitext.game.Deck;
import games.solitext.game.Rank;
import games.solitext.game.Suit;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

/**
 * Deck construction, drawing and shuffling.
 *
 * <p><b>Tests and their intentions:</b>
 * <ul>
 *   <li><b>orderedDeckIsSuitMajor</b> - Hearts A..K first, Clubs K last</li>
 *   <li><b>shuffledDeckIsAPermutation</b> - Shuffling never adds, drops or duplicates cards</li>
 *   <li><b>sameSeedSameOrder</b> - A seeded generator reproduces the deal</li>
 *   <li><b>drawTakesFromTheEnd</b> - The top of a deck is its last card; an empty deck draws null</li>
 *   <li><b>shuffleIsRoughlyUniform</b> - Every card reaches the first position about 1/52 of the time</li>
 * </ul>
 */
class DeckTest {

    @Test
    void orderedDeckIsSuitMajor() {
        List<Card> cards = Deck.orderedCards();

        assertEquals(Deck.SIZE, cards.size());
        assertEquals(new Card(Rank.ACE, Suit.HEARTS), cards.get(0));
        assertEquals(new Card(Rank.KING, Suit.HEARTS), cards.get(12));
        assertEquals(new Card(Rank.ACE, Suit.SPADES), cards.get(13));
        assertEquals(new Card(Rank.KING, Suit.CLUBS), cards.get(51));
    }

    @Test
    void shuffledDeckIsAPermutation() {
        Deck deck = Deck.shuffled(new Random(7));

        List<Card> order = deck.originalOrder();
        assertEquals(Deck.SIZE, order.size());
        assertEquals(new HashSet<>(Deck.orderedCards()), new HashSet<>(order));
        assertNotEquals(Deck.orderedCards(), order);
    }

    @Test
    void sameSeedSameOrder() {
        assertEquals(Deck.shuffled(new Random(42)).originalOrder(), Deck.shuffled(new Random(42)).originalOrder());
    }

    @Test
    void drawTakesFromTheEnd() {
        Deck deck = new Deck(List.of(new Card(Rank.ACE, Suit.HEARTS), new Card(Rank.TWO, Suit.CLUBS)));

        assertEquals(new Card(Rank.TWO, Suit.CLUBS), deck.draw());
        assertEquals(new Card(Rank.ACE, Suit.HEARTS), deck.draw());
        assertTrue(deck.isEmpty());
        assertNull(deck.draw());
        assertEquals(2, deck.originalOrder().size(), "original order survives drawing");
    }

    @Test
    void shuffleIsRoughlyUniform() {
        Random random = new Random(20240501L);
        int rounds = 20000;
        Map<Card, Integer> firstPosition = new HashMap<>();
        for (int i = 0; i < rounds; i++) {
            Card first = Deck.shuffled(random).originalOrder().get(0);
            firstPosition.merge(first, 1, Integer::sum);
        }

        // Expected ~385 each; bounds are far outside normal variation.
        assertEquals(Deck.SIZE, firstPosition.size());
        for (Map.Entry<Card, Integer> entry : firstPosition.entrySet()) {
            int count = entry.getValue();
            assertTrue(count >= 250 && count <= 520,
                    entry.getKey().shortName() + " was first " + count + " times");
        }
    }
}
