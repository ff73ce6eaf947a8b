package org.example.inventory_photos.model;

import org.example.inventory_photos.exception.InputValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SubItemCatalogTest {

    @Nested
    @DisplayName("parseSelection")
    class ParseSelection {

        @Test
        @DisplayName("keeps input order and trims spaces")
        void keepsOrder() {
            assertEquals(List.of("ACRILICO_3", "ACRILICO_1", "ACRILICO_4"),
                    SubItemCatalog.parseSelection(" 3, 1 ,4 "));
        }

        @Test
        @DisplayName("drops duplicates, first occurrence wins")
        void dropsDuplicates() {
            assertEquals(List.of("ACRILICO_2", "ACRILICO_5"),
                    SubItemCatalog.parseSelection("2,5,2,5"));
        }

        @Test
        @DisplayName("silently drops numbers outside 1..9")
        void dropsOutOfRange() {
            assertEquals(List.of("ACRILICO_9"), SubItemCatalog.parseSelection("0,9,10,-1"));
        }

        @Test
        @DisplayName("number too large for int is dropped like any out-of-range one")
        void dropsOverflowingNumber() {
            assertEquals(List.of("ACRILICO_1"), SubItemCatalog.parseSelection("1,99999999999"));
            assertEquals(List.of("ACRILICO_2"), SubItemCatalog.parseSelection("-99999999999, 2"));
            assertThrows(InputValidationException.class, () -> SubItemCatalog.parseSelection("99999999999"));
        }

        @Test
        @DisplayName("trailing comma rejects the input like an empty token in the middle")
        void trailingComma() {
            assertThrows(InputValidationException.class, () -> SubItemCatalog.parseSelection("1,2,"));
            assertThrows(InputValidationException.class, () -> SubItemCatalog.parseSelection("1,2, "));
            assertThrows(InputValidationException.class, () -> SubItemCatalog.parseSelection(",1"));
        }

        @Test
        @DisplayName("only out-of-range numbers is an error")
        void onlyOutOfRange() {
            assertThrows(InputValidationException.class, () -> SubItemCatalog.parseSelection("10,11"));
        }

        @Test
        @DisplayName("non-numeric token rejects the whole input")
        void nonNumericToken() {
            assertThrows(InputValidationException.class, () -> SubItemCatalog.parseSelection("1,dos,3"));
            assertThrows(InputValidationException.class, () -> SubItemCatalog.parseSelection("1,,3"));
        }

        @Test
        @DisplayName("blank input is an error")
        void blankInput() {
            assertThrows(InputValidationException.class, () -> SubItemCatalog.parseSelection("   "));
            assertThrows(InputValidationException.class, () -> SubItemCatalog.parseSelection(null));
        }
    }

    @Test
    void nameOfRejectsIndexOutsideCatalog() {
        assertEquals("ACRILICO_1", SubItemCatalog.nameOf(1));
        assertThrows(IllegalArgumentException.class, () -> SubItemCatalog.nameOf(0));
        assertThrows(IllegalArgumentException.class, () -> SubItemCatalog.nameOf(10));
    }

    @Test
    void menuTextListsAllNineInThreeRows() {
        String menu = SubItemCatalog.menuText();

        String[] rows = menu.split("\n");
        assertEquals(3, rows.length);
        assertEquals("ACRILICO 1, ACRILICO 2, ACRILICO 3", rows[0]);
        assertEquals("ACRILICO 7, ACRILICO 8, ACRILICO 9", rows[2]);
    }
}
