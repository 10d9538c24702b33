package com.instaclustr.bulkrestore.impl.resolve;

import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.instaclustr.bulkrestore.impl.ValidationException;
import com.instaclustr.bulkrestore.impl.spec.BulkRestoreInput;
import com.instaclustr.bulkrestore.operations.OperationRequest;
import picocli.CommandLine.Option;

import static java.lang.String.format;

/**
 * Completes the restore groups of an input document with its default input. The document is either given
 * inline or read from {@link #inputFile}.
 */
public class ValidateOperationRequest extends OperationRequest {

    @Option(names = {"--input", "-i"}, description = "path to the JSON document holding DefaultInput and RestoreGroups")
    @JsonProperty("input_file")
    public Path inputFile;

    @Option(names = {"--output", "-o"}, description = "file to write validated restore groups to, standard output when not set")
    @JsonProperty("output_file")
    public Path outputFile;

    @JsonProperty("input")
    public BulkRestoreInput input;

    @JsonProperty("response")
    public BulkRestoreInput response;

    public ValidateOperationRequest() {
        // for picocli
    }

    @JsonCreator
    public ValidateOperationRequest(@JsonProperty("type") final String type,
                                    @JsonProperty("input_file") final Path inputFile,
                                    @JsonProperty("output_file") final Path outputFile,
                                    @JsonProperty("input") final BulkRestoreInput input) {
        this.type = type;
        this.inputFile = inputFile;
        this.outputFile = outputFile;
        this.input = input;
    }

    @Override
    public void validate() {
        if (input == null && inputFile == null) {
            throw new ValidationException("input", "either an input document or a path to it has to be set");
        }
        if (input == null && !Files.isRegularFile(inputFile)) {
            throw new ValidationException("input_file", format("input file %s does not exist or it is not a file", inputFile));
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("inputFile", inputFile)
            .add("outputFile", outputFile)
            .add("input", input)
            .toString();
    }
}
