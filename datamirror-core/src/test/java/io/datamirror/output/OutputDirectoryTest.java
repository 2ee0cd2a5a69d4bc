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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class OutputDirectoryTest {

    @TempDir
    Path tempDir;

    @Test
    void testLayout() throws Exception {
        OutputDirectory output = new OutputDirectory(tempDir.resolve("nested/out"));
        output.ensureExists();

        assertThat(output.root()).isDirectory();
        assertThat(output.detailsFile("abc")).hasFileName("abc_metadata.json");
        assertThat(output.tableFile("abc")).hasFileName("abc.csv");
        assertThat(output.isDone("abc")).isFalse();

        output.writeJson(output.detailsFile("abc"), new ObjectMapper().readTree("{\"assetType\":\"dataset\"}"));

        assertThat(output.isDone("abc")).isTrue();
        assertThat(new ObjectMapper().readTree(Files.readString(output.detailsFile("abc")))
            .path("assetType").asText()).isEqualTo("dataset");
    }

    @Test
    void testNamesOutsideTheRootAreRejected() {
        OutputDirectory output = new OutputDirectory(tempDir.resolve("out"));

        assertThatThrownBy(() -> output.detailsFile("../escape")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> output.tableFile("..")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> output.resolve("sub/dir.csv")).isInstanceOf(IllegalArgumentException.class);
        assertThat(output.resolve("..report.pdf")).isEqualTo(tempDir.resolve("out").resolve("..report.pdf"));
    }
}
