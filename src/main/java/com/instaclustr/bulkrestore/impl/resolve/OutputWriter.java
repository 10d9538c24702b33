package com.instaclustr.bulkrestore.impl.resolve;

import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;

final class OutputWriter {

    private OutputWriter() {
    }

    /**
     * Writes the document as JSON to the file, or to standard output when there is no file.
     */
    static void write(final ObjectMapper objectMapper, final Object document, final Path outputFile) throws Exception {
        if (outputFile == null) {
            System.out.println(objectMapper.writeValueAsString(document));
            return;
        }

        try (final PrintStream ps = new PrintStream(new FileOutputStream(outputFile.toFile()), true, StandardCharsets.UTF_8.name())) {
            ps.println(objectMapper.writeValueAsString(document));
        }
    }
}
