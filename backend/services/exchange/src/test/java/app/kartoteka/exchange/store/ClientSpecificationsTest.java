package app.kartoteka.exchange.store;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ClientSpecificationsTest {

    @Test
    void searchTermIsMatchedAnywhereIgnoringCase() {
        assertEquals("%acme sp. z o.o.%", ClientSpecifications.containsPattern("  ACME Sp. z o.o. "));
    }

    @Test
    void wildcardsInSearchTermMatchLiterally() {
        assertEquals("%50\\%%", ClientSpecifications.containsPattern("50%"));
        assertEquals("%biuro\\_1%", ClientSpecifications.containsPattern("biuro_1"));
        assertEquals("%a\\\\b%", ClientSpecifications.containsPattern("a\\b"));
    }
}
