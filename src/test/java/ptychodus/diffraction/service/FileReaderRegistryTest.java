package ptychodus.diffraction.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileReaderRegistryTest {

    private final FileReaderRegistry<String> registry = new FileReaderRegistry<>();

    @Test
    void lookupIgnoresCase() {
        registry.register("hdf5", "reader");

        assertTrue(registry.hasReader("HDF5"));
        assertEquals("reader", registry.getReader(" Hdf5 ").orElseThrow());
        assertTrue(registry.getReader("npy").isEmpty());
        assertTrue(registry.getReader(null).isEmpty());
    }

    @Test
    void registeringAgainReplacesReader() {
        String second = "second";
        registry.register("NPY", "first");
        registry.register("npy", second);

        assertSame(second, registry.getReader("NPY").orElseThrow());
        assertEquals(1, registry.getFileTypes().size());
    }

    @Test
    void unregisterRemovesReader() {
        registry.register("TIFF", "reader");

        assertTrue(registry.unregister("tiff"));
        assertFalse(registry.unregister("tiff"));
        assertFalse(registry.hasReader("TIFF"));
    }

    @Test
    void fileTypesAreSorted() {
        registry.register("tiff", "a");
        registry.register("HDF5", "b");
        registry.register("npy", "c");

        assertEquals(List.of("HDF5", "NPY", "TIFF"), List.copyOf(registry.getFileTypes()));
    }

    @Test
    void blankTypeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.register(" ", "reader"));
        assertThrows(IllegalArgumentException.class, () -> registry.register("HDF5", null));
    }
}
