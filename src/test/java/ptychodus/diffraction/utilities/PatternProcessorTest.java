package ptychodus.diffraction.utilities;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import ptychodus.diffraction.PatternFixtures;
import ptychodus.diffraction.model.BadPixels;
import ptychodus.diffraction.model.DiffractionPatterns;
import ptychodus.diffraction.model.ImageExtent;
import ptychodus.diffraction.model.InvalidBinningException;
import ptychodus.diffraction.model.InvalidShapeException;
import ptychodus.diffraction.model.PatternDataType;
import ptychodus.diffraction.model.ProcessorConfig;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatternProcessorTest {

    // 4x4 pattern with pixel (y, x) = 4y + x
    private static DiffractionPatterns ramp() {
        return PatternFixtures.rampPattern(PatternDataType.UINT16, 4, 4);
    }

    private static DiffractionPatterns process(ProcessorConfig.Builder builder, DiffractionPatterns input) {
        return new PatternProcessor(builder.build()).process(input);
    }

    @Test
    void identityReturnsEqualCopy() {
        DiffractionPatterns input = ramp();
        DiffractionPatterns output = PatternProcessor.identity().process(input);
        assertEquals(input, output);
        assertNotSame(input, output);
    }

    @Nested
    class IntensityFilter {

        @Test
        void zeroesValuesOutsideBounds() {
            DiffractionPatterns input = ramp();
            DiffractionPatterns output = process(ProcessorConfig.builder().lowerBound(3).upperBound(10), input);

            for (int y = 0; y < 4; y++) {
                for (int x = 0; x < 4; x++) {
                    long value = 4L * y + x;
                    long expected = (value >= 3 && value < 10) ? value : 0;
                    assertEquals(expected, output.getLong(0, y, x), "pixel " + value);
                }
            }
            // Input is untouched
            assertEquals(15, input.getLong(0, 3, 3));
        }

        @Test
        void doesNotApplyToMask() {
            BadPixels mask = BadPixels.of(new boolean[][]{{true, false}, {false, true}});
            PatternProcessor processor = new PatternProcessor(
                    ProcessorConfig.builder().lowerBound(1).upperBound(2).build());
            assertEquals(mask, processor.processBadPixels(mask));
        }
    }

    @Nested
    class Crop {

        @Test
        void keepsWindowAroundCenter() {
            DiffractionPatterns output = process(ProcessorConfig.builder().crop(2, 2, 2, 2), ramp());

            assertEquals(2, output.getWidth());
            assertEquals(2, output.getHeight());
            assertEquals(5, output.getLong(0, 0, 0));
            assertEquals(6, output.getLong(0, 0, 1));
            assertEquals(9, output.getLong(0, 1, 0));
            assertEquals(10, output.getLong(0, 1, 1));
        }

        @Test
        void oddWidthKeepsExactSize() {
            DiffractionPatterns output = process(ProcessorConfig.builder().crop(2, 2, 3, 1), ramp());
            assertEquals(3, output.getWidth());
            assertEquals(1, output.getHeight());
            assertEquals(9, output.getLong(0, 0, 0));
        }

        @Test
        void windowOutsideImageFails() {
            assertThrows(InvalidShapeException.class,
                    () -> process(ProcessorConfig.builder().crop(0, 0, 2, 2), ramp()));
            assertThrows(InvalidShapeException.class,
                    () -> process(ProcessorConfig.builder().crop(2, 2, 8, 2), ramp()));
        }
    }

    @Nested
    class Binning {

        @Test
        void conservesTotalIntensity() {
            DiffractionPatterns input = ramp();
            DiffractionPatterns output = process(ProcessorConfig.builder().binning(2, 2), input);

            assertEquals(2, output.getWidth());
            assertEquals(2, output.getHeight());
            assertEquals(0 + 1 + 4 + 5, output.getLong(0, 0, 0));
            assertEquals(10 + 11 + 14 + 15, output.getLong(0, 1, 1));
            assertEquals(input.sum(), output.sum());
        }

        @Test
        void supportsRectangularBins() {
            DiffractionPatterns output = process(ProcessorConfig.builder().binning(4, 1), ramp());
            assertEquals(1, output.getWidth());
            assertEquals(4, output.getHeight());
            assertEquals(0 + 1 + 2 + 3, output.getLong(0, 0, 0));
        }

        @Test
        void indivisibleExtentFails() {
            assertThrows(InvalidBinningException.class,
                    () -> process(ProcessorConfig.builder().binning(3, 3), ramp()));
        }

        @Test
        void sumsWrapInNativeType() {
            DiffractionPatterns input = PatternFixtures.constantPatterns(PatternDataType.UINT8, 1, 2, 2, 200);
            DiffractionPatterns output = process(ProcessorConfig.builder().binning(2, 2), input);
            assertEquals(800 & 0xFF, output.getLong(0, 0, 0));
        }

        @Test
        void maskBlockIsBadOnlyIfAllPixelsAreBad() {
            BadPixels mask = BadPixels.of(new boolean[][]{
                    {true, true, true, false},
                    {true, true, true, true},
            });
            BadPixels binned = new PatternProcessor(ProcessorConfig.builder().binning(2, 2).build())
                    .processBadPixels(mask);

            assertEquals(new ImageExtent(2, 1), binned.getExtent());
            assertTrue(binned.isBad(0, 0));
            assertFalse(binned.isBad(0, 1));
        }
    }

    @Test
    void paddingAddsZeroBorder() {
        DiffractionPatterns output = process(ProcessorConfig.builder().padding(1, 2), ramp());

        assertEquals(6, output.getWidth());
        assertEquals(8, output.getHeight());
        assertEquals(0, output.getLong(0, 0, 0));
        assertEquals(0, output.getLong(0, 7, 5));
        assertEquals(0, output.getLong(0, 2, 1));
        assertEquals(5, output.getLong(0, 3, 2));
        assertEquals(15, output.getLong(0, 5, 4));
    }

    @Test
    void horizontalFlipMirrorsColumns() {
        DiffractionPatterns output = process(ProcessorConfig.builder().flipHorizontal(true), ramp());
        assertEquals(3, output.getLong(0, 0, 0));
        assertEquals(12, output.getLong(0, 3, 3));
    }

    @Test
    void verticalFlipMirrorsRows() {
        DiffractionPatterns output = process(ProcessorConfig.builder().flipVertical(true), ramp());
        assertEquals(12, output.getLong(0, 0, 0));
        assertEquals(3, output.getLong(0, 3, 3));
    }

    @Test
    void transposeSwapsAxes() {
        DiffractionPatterns input = PatternFixtures.rampPattern(PatternDataType.UINT16, 2, 3);
        DiffractionPatterns output = process(ProcessorConfig.builder().transpose(true), input);

        assertEquals(2, output.getWidth());
        assertEquals(3, output.getHeight());
        for (int y = 0; y < 3; y++) {
            for (int x = 0; x < 2; x++) {
                assertEquals(input.getLong(0, x, y), output.getLong(0, y, x));
            }
        }
    }

    @Test
    void flipRunsBeforeTranspose() {
        DiffractionPatterns input = PatternFixtures.rampPattern(PatternDataType.UINT16, 2, 3);
        DiffractionPatterns output = process(ProcessorConfig.builder().flipHorizontal(true).transpose(true), input);

        // out(y, x) = flipped(x, y) = in(x, w - 1 - y)
        for (int y = 0; y < 3; y++) {
            for (int x = 0; x < 2; x++) {
                assertEquals(input.getLong(0, x, 2 - y), output.getLong(0, y, x));
            }
        }
    }

    @Test
    void processedExtentFollowsAllSteps() {
        PatternProcessor processor = new PatternProcessor(ProcessorConfig.builder()
                .crop(8, 8, 8, 4)
                .binning(2, 2)
                .padding(1, 0)
                .transpose(true)
                .build());

        // crop 8x4 -> bin 4x2 -> pad 6x2 -> transpose 2x6
        assertEquals(new ImageExtent(2, 6), processor.getProcessedExtent(new ImageExtent(16, 16)));
    }

    @Test
    void maskFollowsSameGeometryAsPatterns() {
        boolean[][] rows = new boolean[4][4];
        rows[1][2] = true;
        BadPixels mask = BadPixels.of(rows);
        PatternProcessor processor = new PatternProcessor(ProcessorConfig.builder()
                .crop(2, 2, 2, 2)
                .flipHorizontal(true)
                .build());

        BadPixels processed = processor.processBadPixels(mask);
        // crop keeps rows/cols 1..2, so (1, 2) -> (0, 1), then flip -> (0, 0)
        assertTrue(processed.isBad(0, 0));
        assertEquals(1, processed.countBadPixels());
    }
}
