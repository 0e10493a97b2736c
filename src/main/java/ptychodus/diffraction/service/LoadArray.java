package ptychodus.diffraction.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ptychodus.diffraction.api.DiffractionArray;
import ptychodus.diffraction.model.AssembledDiffractionData;
import ptychodus.diffraction.model.BadPixels;
import ptychodus.diffraction.model.DiffractionPatterns;
import ptychodus.diffraction.utilities.PatternProcessor;

import java.io.FileNotFoundException;
import java.nio.file.NoSuchFileException;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads and processes one raw array off the consumer thread.
 * <p>
 * Everything the task needs is captured at construction, so later changes to the
 * dataset do not affect a load already in flight. The result is handed back as a
 * {@link ForegroundTask} that passes it to the {@link ArrayAssembler}.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public class LoadArray implements BackgroundTask {

    private static final Logger logger = LoggerFactory.getLogger(LoadArray.class);

    private final int arrayIndex;
    private final DiffractionArray array;
    private final BadPixels badPixels;
    private final PatternProcessor processor;
    private final ArrayAssembler assembler;

    /**
     * @param arrayIndex submission index
     * @param array      raw array to read
     * @param badPixels  processed bad-pixel mask used for pattern counts
     * @param processor  processor to apply, or null to keep raw patterns
     * @param assembler  destination for the result
     */
    public LoadArray(int arrayIndex, DiffractionArray array, BadPixels badPixels,
                     PatternProcessor processor, ArrayAssembler assembler) {
        this.arrayIndex = arrayIndex;
        this.array = Objects.requireNonNull(array, "Array must not be null");
        this.badPixels = Objects.requireNonNull(badPixels, "Bad pixels must not be null");
        this.processor = processor;
        this.assembler = Objects.requireNonNull(assembler, "Assembler must not be null");
    }

    public int getArrayIndex() {
        return arrayIndex;
    }

    @Override
    public Optional<ForegroundTask> call() throws Exception {
        String label = array.getLabel();
        DiffractionPatterns patterns;

        try {
            patterns = array.getPatterns();
        } catch (FileNotFoundException | NoSuchFileException e) {
            logger.warn("Skipping array \"{}\": file not found ({})", label, e.getMessage());
            return Optional.empty();
        }

        if (processor != null) {
            patterns = processor.process(patterns);
        }

        AssembledDiffractionData data = AssembledDiffractionData.create(array.getIndexes(), patterns, badPixels);
        logger.debug("Loaded array {} \"{}\" with {} patterns", arrayIndex, label, data.getNumPatterns());
        return Optional.of(() -> assembler.assembleArray(arrayIndex, label, data));
    }

    @Override
    public String toString() {
        return String.format("LoadArray{%d, %s}", arrayIndex, array.getLabel());
    }
}
