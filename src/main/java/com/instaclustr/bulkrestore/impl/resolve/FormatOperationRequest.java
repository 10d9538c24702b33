package com.instaclustr.bulkrestore.impl.resolve;

import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.instaclustr.bulkrestore.impl.ValidationException;
import com.instaclustr.bulkrestore.impl.list.DiscoveryResult;
import com.instaclustr.bulkrestore.impl.spec.BulkRestoreInput;
import com.instaclustr.bulkrestore.impl.spec.TargetSpecs;
import com.instaclustr.bulkrestore.operations.OperationRequest;
import picocli.CommandLine.Option;

import static java.lang.String.format;

/**
 * Turns discovered backups and operator target specs into restore groups. Both documents are either given
 * inline or read from files.
 */
public class FormatOperationRequest extends OperationRequest {

    @Option(names = {"--discovery", "-d"}, description = "path to the JSON document of discovered backups")
    @JsonProperty("discovery_file")
    public Path discoveryFile;

    @Option(names = {"--targets", "-t"}, description = "path to the JSON document of target specs per resource type")
    @JsonProperty("targets_file")
    public Path targetsFile;

    @Option(names = {"--output", "-o"}, description = "file to write restore groups to, standard output when not set")
    @JsonProperty("output_file")
    public Path outputFile;

    @JsonProperty("discovery")
    public DiscoveryResult discovery;

    @JsonProperty("targets")
    public TargetSpecs targets;

    @JsonProperty("response")
    public BulkRestoreInput response;

    public FormatOperationRequest() {
        // for picocli
    }

    @JsonCreator
    public FormatOperationRequest(@JsonProperty("type") final String type,
                                  @JsonProperty("discovery_file") final Path discoveryFile,
                                  @JsonProperty("targets_file") final Path targetsFile,
                                  @JsonProperty("output_file") final Path outputFile,
                                  @JsonProperty("discovery") final DiscoveryResult discovery,
                                  @JsonProperty("targets") final TargetSpecs targets) {
        this.type = type;
        this.discoveryFile = discoveryFile;
        this.targetsFile = targetsFile;
        this.outputFile = outputFile;
        this.discovery = discovery;
        this.targets = targets;
    }

    @Override
    public void validate() {
        if (discovery == null) {
            checkFile("discovery_file", discoveryFile);
        }
        if (targets == null) {
            checkFile("targets_file", targetsFile);
        }
    }

    private static void checkFile(final String field, final Path file) {
        if (file == null) {
            throw new ValidationException(field, format("%s has to be set", field));
        }
        if (!Files.isRegularFile(file)) {
            throw new ValidationException(field, format("%s %s does not exist or it is not a file", field, file));
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("discoveryFile", discoveryFile)
            .add("targetsFile", targetsFile)
            .add("outputFile", outputFile)
            .add("discovery", discovery)
            .add("targets", targets)
            .toString();
    }
}
