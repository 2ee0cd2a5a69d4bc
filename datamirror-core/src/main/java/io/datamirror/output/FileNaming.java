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

import java.util.Optional;

/// Helpers for naming mirrored files.
public final class FileNaming {

    private FileNaming() {
    }

    /// Reduces a server-provided file name to its last path segment.
    ///
    /// @param name The name as given, possibly containing `/` or `\` separators
    /// @return the last segment, or empty when nothing usable remains
    public static Optional<String> safeFileName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        int cut = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        String last = name.substring(cut + 1).trim();
        if (last.isEmpty() || last.equals(".") || last.equals("..")) {
            return Optional.empty();
        }
        return Optional.of(last);
    }

    /// The suffix of a file name, from its last dot.
    ///
    /// A leading dot does not start a suffix, and neither does a trailing one.
    /// `report.tar.gz` has suffix `.gz`, `.env` and `notes.` have none.
    ///
    /// @param name The file name
    /// @return the suffix including its dot, or an empty string
    public static String suffix(String name) {
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot);
    }

    /// @param name The file name
    /// @return the name without its {@link #suffix(String)}
    public static String stem(String name) {
        return name.substring(0, name.length() - suffix(name).length());
    }

    /// The name used when a file of the desired name already exists.
    ///
    /// @param name The desired file name
    /// @param assetId The asset id to insert
    /// @return `{stem}_{assetId}{suffix}`
    public static String collisionName(String name, String assetId) {
        return stem(name) + "_" + assetId + suffix(name);
    }
}
