package org.imagebatch.codecs;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ImageMagickCodecFactoryTest {

    @TempDir
    Path tempDir;

    private Path executable(Path dir, String name) throws IOException {
        Files.createDirectories(dir);
        Path file = Files.writeString(dir.resolve(name), "#!/bin/sh\n");
        Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rwxr-xr-x"));
        return file;
    }

    @Test
    void testLocatePrefersMagickOverConvert() throws IOException {
        Path im6 = executable(tempDir.resolve("first"), "convert");
        Path im7 = executable(tempDir.resolve("second"), "magick");
        String searchPath = tempDir.resolve("first") + File.pathSeparator + tempDir.resolve("second");

        assertEquals(Optional.of(im7), ImageMagickCodecFactory.locate(searchPath));
        Files.delete(im7);
        assertEquals(Optional.of(im6), ImageMagickCodecFactory.locate(searchPath));
    }

    @Test
    void testLocateIgnoresNonExecutables() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("bin"));
        Files.writeString(dir.resolve("magick"), "not executable");
        assertTrue(ImageMagickCodecFactory.locate(dir.toString()).isEmpty());
        assertTrue(ImageMagickCodecFactory.locate(null).isEmpty());
    }

    @Test
    void testCreateWithOverride() throws IOException {
        Path tool = executable(tempDir, "my-magick");
        ImageMagickCodecFactory factory = new ImageMagickCodecFactory(tool);
        assertEquals(Optional.of(tool), factory.executable());
        assertNotNull(factory.create());
    }

    @Test
    void testCreateFailsForMissingOverride() {
        ImageMagickCodecFactory factory = new ImageMagickCodecFactory(tempDir.resolve("missing"));
        assertThrows(IllegalStateException.class, factory::create);
    }
}
