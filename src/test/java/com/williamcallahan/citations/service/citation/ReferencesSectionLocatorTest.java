package com.williamcallahan.citations.service.citation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests detection of the bibliography heading.
 */
class ReferencesSectionLocatorTest {

    private final ReferencesSectionLocator locator = new ReferencesSectionLocator();

    @Test
    void split_strongParagraphHeading_cutsBeforeIt() {
        ReferencesSectionLocator.MarkupSections sections =
            locator.split("<p>Body [1].</p><p><strong>References</strong></p><p>1. Marcus</p>");

        assertEquals("<p>Body [1].</p>", sections.body());
        assertEquals("<p><strong>References</strong></p><p>1. Marcus</p>", sections.referencesSection());
    }

    @Test
    void split_headingElement_isCaseInsensitive() {
        ReferencesSectionLocator.MarkupSections sections = locator.split("<p>Body</p><h3 id=\"wc\">WORKS CITED</h3><ol></ol>");

        assertEquals("<p>Body</p>", sections.body());
        assertTrue(sections.referencesSection().startsWith("<h3"));
    }

    @Test
    void split_earlierShapeWinsEvenWhenItOccursLater() {
        String markup = "<h2>Bibliography</h2><p>Text</p><p><strong>References</strong></p>";

        ReferencesSectionLocator.MarkupSections sections = locator.split(markup);

        assertEquals("<h2>Bibliography</h2><p>Text</p>", sections.body());
    }

    @Test
    void split_plainTextHeadingLine_isRecognized() {
        ReferencesSectionLocator.MarkupSections sections =
            locator.split("Findings were clear [3].\nReferences\n1. Marcus, G. (2019)");

        assertEquals("Findings were clear [3].\n", sections.body());
        assertTrue(sections.referencesSection().startsWith("References"));
    }

    @Test
    void split_headingWordInsideSentence_isIgnored() {
        String markup = "<p>See the references below for details.</p>";

        ReferencesSectionLocator.MarkupSections sections = locator.split(markup);

        assertEquals(markup, sections.body());
        assertFalse(sections.hasReferencesSection());
    }

    @Test
    void split_nullMarkup_isEmpty() {
        ReferencesSectionLocator.MarkupSections sections = locator.split(null);

        assertEquals("", sections.body());
        assertEquals("", sections.referencesSection());
    }
}
