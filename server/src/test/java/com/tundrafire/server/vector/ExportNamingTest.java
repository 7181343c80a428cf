package com.tundrafire.server.vector;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ExportNamingTest {

    @Test
    void testNames() {
        assertEquals("candidateFires__2019__ROIsub_03_0px60m",
                ExportNaming.exportName(2019, ExportNaming.tileId(3), 0, 60));
        assertEquals("candidateFires__2005__drawROI_10px60m",
                ExportNaming.exportName(2005, ExportNaming.DRAWN_ROI_ID, 10, 60.0));
        assertEquals("candidateFires__2005__drawROI_0px7.5m",
                ExportNaming.exportName(2005, ExportNaming.DRAWN_ROI_ID, 0, 7.5));
        assertEquals("ROIsub_12", ExportNaming.tileId(12));
    }
}
