/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.sentinelrecall.filesystem.utils;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.escape.Escaper;
import com.google.common.net.PercentEscaper;
import lombok.experimental.UtilityClass;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

@UtilityClass
public class FileUtils {
    private static final Escaper NAME_ESCAPER = new PercentEscaper("-_", false);

    /**
     * Ensures that the provided path exists and is a readable, writable directory. If the path does not exist and
     * createIfNotExists is true, it will attempt to create the directory.
     *
     * @param path              The path to check or create.
     * @param createIfNotExists Whether to create the directory if it does not exist.
     * @return The absolute, normalized Path object representing the directory.
     * @throws IllegalArgumentException If the path is invalid, does not have the required permissions, or does not
     *                                  exist and was not to be created.
     */
    public static Path ensurePath(String path, boolean createIfNotExists) {
        final var absolutePath = Path.of(path).toAbsolutePath().normalize();
        if (!Files.exists(absolutePath)) {
            if (!createIfNotExists) {
                throw new IllegalArgumentException("Provided path does not exist: " + absolutePath);
            }
            try {
                Files.createDirectories(absolutePath);
            }
            catch (IOException e) {
                throw new UncheckedIOException("Failed to create directory: " + absolutePath, e);
            }
        }
        if (!Files.isDirectory(absolutePath) || !Files.isReadable(absolutePath) || !Files.isWritable(absolutePath)) {
            throw new IllegalArgumentException("Sanity check for %s Failed. Please check it is a directory and has the required permissions"
                    .formatted(absolutePath));
        }
        return absolutePath;
    }

    /**
     * Writes data to a file atomically. Data goes to a temporary file in the same directory which is then moved over
     * the target, so readers never see a partially written file.
     *
     * @param filePath The path of the file to write to.
     * @param data     The byte array data to write.
     * @throws IOException if the write or the move fails. The temporary file is removed in that case.
     */
    public static void writeAtomically(Path filePath, byte[] data) throws IOException {
        final var tempFile = Files.createTempFile(filePath.getParent(), filePath.getFileName().toString(), ".tmp");
        try {
            Files.write(tempFile, data);
            Files.move(tempFile, filePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        }
        finally {
            Files.deleteIfExists(tempFile);
        }
    }

    /**
     * Maps an arbitrary name to a single path segment. Everything except letters, digits, {@code -} and {@code _} is
     * percent encoded, so distinct names always give distinct segments.
     */
    public static String safeName(String name) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "Name cannot be empty");
        return NAME_ESCAPER.escape(name);
    }
}
