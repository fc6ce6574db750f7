package com.example.pdfcrop.service;

import com.example.pdfcrop.model.PageBox;
import com.example.pdfcrop.model.PageInfo;
import com.example.pdfcrop.model.SideValues;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CropBoxBuilderTest {

    private final CropBoxBuilder builder = new CropBoxBuilder();

    @Test
    void marginsShrinkTheCropBoxNotTheMediaBox() {
        PageInfo page = new PageInfo(0, PageBox.of(0, 0, 612, 792), PageBox.of(36, 36, 576, 756), 0);

        PageBox box = builder.build(page, SideValues.all(10));

        assertEquals(PageBox.of(46, 46, 566, 746), box);
    }

    @Test
    void negativeMarginsNeverLeaveTheMediaBox() {
        PageInfo page = new PageInfo(0, PageBox.of(0, 0, 100, 100), PageBox.of(10, 10, 90, 90), 0);

        PageBox box = builder.build(page, SideValues.all(-20));

        assertEquals(PageBox.of(0, 0, 100, 100), box);
    }

    @Test
    void samePageSizeUsesSmallestWidthAndHeightRecentered() {
        Map<Integer, PageInfo> pages = Map.of(
                0, new PageInfo(0, PageBox.of(0, 0, 100, 140), null, 0),
                1, new PageInfo(1, PageBox.of(0, 0, 90, 150), null, 0));
        Map<Integer, SideValues> margins = Map.of(0, SideValues.zero(), 1, SideValues.zero());

        SortedMap<Integer, PageBox> boxes = builder.buildAll(pages, margins, null, true);

        assertEquals(PageBox.of(5, 0, 95, 140), boxes.get(0));
        assertEquals(PageBox.of(0, 5, 90, 145), boxes.get(1));
    }

    @Test
    void samePageSizeWithContentGrowsToLargestContent() {
        Map<Integer, PageInfo> pages = Map.of(
                0, new PageInfo(0, PageBox.of(0, 0, 200, 200), null, 0),
                1, new PageInfo(1, PageBox.of(0, 0, 200, 200), null, 0));
        Map<Integer, SideValues> margins = Map.of(
                0, SideValues.of(50, 50, 50, 50),
                1, SideValues.of(20, 20, 20, 20));
        Map<Integer, PageBox> content = Map.of(
                0, PageBox.of(50, 50, 150, 150),
                1, PageBox.of(20, 20, 180, 180));

        SortedMap<Integer, PageBox> boxes = builder.buildAll(pages, margins, content, true);

        for (int page = 0; page < 2; page++) {
            assertEquals(160.0, boxes.get(page).getWidth(), 1e-9);
            assertEquals(160.0, boxes.get(page).getHeight(), 1e-9);
            assertTrue(boxes.get(page).contains(content.get(page)));
            assertTrue(pages.get(page).getMediaBox().contains(boxes.get(page)));
        }
    }
}
