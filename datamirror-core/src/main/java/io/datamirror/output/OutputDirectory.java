package io.datamirror.output;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/// The directory a mirror run writes into.
///
/// All artifacts live flat in the root: the manifest snapshot, one `{id}_metadata.json`
/// per processed asset, file blobs under their published names and tables as `{id}.csv`.
/// The presence of an asset's details file marks the asset as done.
public class OutputDirectory {
    private static final String DETAILS_SUFFIX = "_metadata.json";
    private static final String TABLE_SUFFIX = ".csv";

    private final Path root;
    private final ObjectMapper mapper;

    public OutputDirectory(Path root) {
        this(root, new ObjectMapper());
    }

    public OutputDirectory(Path root, ObjectMapper mapper) {
        this.root = root;
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /// @return the root directory
    public Path root() {
        return root;
    }

    /// Creates the root directory and any missing parents.
    ///
    /// @throws IOException if the directory cannot be created
    public void ensureExists() throws IOException {
        Files.createDirectories(root);
    }

    /// Resolves a file name directly inside the root.
    ///
    /// @param fileName A file name inside the root
    /// @return the resolved path
    /// @throws IllegalArgumentException if the name would place the file anywhere but
    ///     directly in the root, such as `../x` or `a/b`
    public Path resolve(String fileName) {
        Path resolved = root.resolve(fileName);
        Path parent = resolved.toAbsolutePath().normalize().getParent();
        if (!root.toAbsolutePath().normalize().equals(parent)) {
            throw new IllegalArgumentException("'" + fileName + "' is not a file name inside " + root);
        }
        return resolved;
    }

    /// @param assetId The asset id
    /// @return the path of the asset's persisted details
    public Path detailsFile(String assetId) {
        return resolve(assetId + DETAILS_SUFFIX);
    }

    /// @param assetId The asset id
    /// @return true if the asset's details were already persisted
    public boolean isDone(String assetId) {
        return Files.exists(detailsFile(assetId));
    }

    /// @param assetId The asset id
    /// @return the path a dataset asset's CSV export is written to
    public Path tableFile(String assetId) {
        return resolve(assetId + TABLE_SUFFIX);
    }

    /// Writes a JSON document, replacing any existing file.
    ///
    /// @param target The file to write
    /// @param document The document
    /// @throws IOException if the file cannot be written
    public void writeJson(Path target, JsonNode document) throws IOException {
        mapper.writeValue(target.toFile(), document);
    }

    /// @return the mapper used to read and write documents
    public ObjectMapper mapper() {
        return mapper;
    }
}
