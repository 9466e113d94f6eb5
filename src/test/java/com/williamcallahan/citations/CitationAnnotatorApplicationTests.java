package com.williamcallahan.citations;

import com.williamcallahan.citations.config.AnnotationProperties;
import com.williamcallahan.citations.service.citation.CitationAnnotationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest(properties = "app.citations.range-span-limit=20")
class CitationAnnotatorApplicationTests {

    @Autowired
    private CitationAnnotationService citationAnnotationService;

    @Autowired
    private AnnotationProperties annotationProperties;

    @Test
    void contextLoads() {
        assertNotNull(citationAnnotationService);
        assertEquals(20, annotationProperties.getRangeSpanLimit());
        assertEquals(1000, annotationProperties.getMaxCitationNumber());
    }

}
