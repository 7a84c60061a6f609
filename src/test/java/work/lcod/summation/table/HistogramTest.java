package work.lcod.summation.table;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class HistogramTest {
    @Test
    void compoundTitleSetsAxisTitles() {
        var h = Histogram.create1D("adc", "ADC;adc counts;#entries", 10, 0.0, 10.0);
        assertEquals("ADC", h.title());
        assertEquals("adc counts", h.xAxis().title());
        assertEquals("#entries", h.yAxis().title());
        assertEquals(1, h.dimension());

        var plain = Histogram.create2D("map", "Map", 2, 0.0, 2.0, 3, 0.0, 3.0);
        assertEquals("Map", plain.title());
        assertEquals("", plain.xAxis().title());
    }

    @Test
    void outOfRangeFillsGoToUnderAndOverflow() {
        var h = Histogram.create1D("h", "h", 4, 0.0, 4.0);
        h.fill(-1.0);
        h.fill(0.0);
        h.fill(3.999);
        h.fill(4.0);

        assertEquals(1.0, h.getBinContent(0));
        assertEquals(1.0, h.getBinContent(1));
        assertEquals(1.0, h.getBinContent(4));
        assertEquals(1.0, h.getBinContent(5));
        assertEquals(2.0, h.integral());
        assertEquals(4.0, h.entries());
    }

    @Test
    void twoDimensionalBinsAreIndependent() {
        var h = Histogram.create2D("map", "map;x;y", 2, 0.0, 2.0, 2, 0.0, 2.0);
        h.fill(0.5, 1.5);
        h.fill(0.5, 1.5);
        h.fill(1.5, 0.5);

        assertEquals(2.0, h.getBinContent(1, 2));
        assertEquals(1.0, h.getBinContent(2, 1));
        assertEquals(0.0, h.getBinContent(1, 1));
        assertArrayEquals(new double[] {0.0, 1.0, 2.0, 0.0}, h.binContents());
    }

    @Test
    void oneDimensionalIgnoresSecondBinIndex() {
        var h = Histogram.create1D("h", "h", 3, 0.0, 3.0);
        h.fill(1.5);
        assertEquals(1.0, h.getBinContent(2, 7));
        h.fill(1.5, 99.0);
        assertEquals(2.0, h.getBinContent(2));
    }

    @Test
    void meanUsesBinCenters() {
        var h = Histogram.create1D("h", "h", 3, -0.5, 2.5);
        h.fill(0.0);
        h.fill(1.0);
        h.fill(1.0);
        h.fill(2.0);
        assertEquals(1.0, h.mean(), 1e-12);
    }

    @Test
    void addSumsContentAndEntries() {
        var a = Histogram.create1D("a", "a", 2, 0.0, 2.0);
        var b = Histogram.create1D("b", "b", 2, 0.0, 2.0);
        a.fill(0.5);
        b.fill(0.5);
        b.fill(1.5);

        a.add(b);
        assertArrayEquals(new double[] {2.0, 1.0}, a.binContents());
        assertEquals(3.0, a.entries());
    }

    @Test
    void addRejectsDifferentBinning() {
        var a = Histogram.create1D("a", "a", 2, 0.0, 2.0);
        var b = Histogram.create1D("b", "b", 3, 0.0, 3.0);
        assertThrows(IllegalArgumentException.class, () -> a.add(b));
    }

    @Test
    void copyIsDetached() {
        var h = Histogram.create1D("h", "h;x", 2, 0.0, 2.0);
        h.fill(0.5);
        var copy = h.copy();
        copy.fill(0.5);
        assertEquals(1.0, h.getBinContent(1));
        assertEquals(2.0, copy.getBinContent(1));
        assertEquals("x", copy.xAxis().title());
    }

    @Test
    void setBinContentCountsAsEntry() {
        var h = Histogram.create1D("h", "h", 1, 0.0, 1.0);
        h.setBinContent(1, 42.0);
        assertEquals(42.0, h.getBinContent(1));
        assertEquals(1.0, h.entries());
        assertThrows(IndexOutOfBoundsException.class, () -> h.getBinContent(3));
    }
}
