package org.profd.cli.commands.session;

import com.google.protobuf.Descriptors.FieldDescriptor;
import org.profd.api.contracts.ProfilingConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Builds an encoded {@link ProfilingConfig} for {@code start-proto}. Only fields named with
 * {@code --set} are present in the output; all others keep their daemon defaults when merged.
 */
@Command(
    name = "encode-config",
    description = "Writes an encoded ProfilingConfig to stdout or a file."
)
public class SessionEncodeConfigCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = "--set", paramLabel = "field=value",
        description = "Sets a field by its name, e.g. sample_duration_in_s=5. Repeatable.")
    private List<String> assignments = new ArrayList<>();

    @Option(names = {"-o", "--output"}, description = "Output file instead of stdout.")
    private Path output;

    @Override
    public Integer call() throws IOException {
        final ProfilingConfig config;
        try {
            config = build(assignments);
        } catch (final IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
        }
        if (output != null) {
            Files.write(output, config.toByteArray());
        } else {
            final OutputStream out = System.out;
            config.writeTo(out);
            out.flush();
        }
        return 0;
    }

    /**
     * Builds a configuration from {@code field=value} assignments.
     *
     * @param assignments Field assignments using the message's field names.
     * @return The configuration with exactly the assigned fields present.
     * @throws IllegalArgumentException if a field is unknown or a value does not fit its type.
     */
    static ProfilingConfig build(final List<String> assignments) {
        final ProfilingConfig.Builder builder = ProfilingConfig.newBuilder();
        for (final String assignment : assignments) {
            final int separator = assignment.indexOf('=');
            if (separator <= 0) {
                throw new IllegalArgumentException("Expected field=value but got '" + assignment + "'");
            }
            final String name = assignment.substring(0, separator).trim();
            final String value = assignment.substring(separator + 1).trim();
            final FieldDescriptor field = ProfilingConfig.getDescriptor().findFieldByName(name);
            if (field == null) {
                throw new IllegalArgumentException("Unknown field '" + name + "'");
            }
            builder.setField(field, parse(field, value));
        }
        return builder.build();
    }

    private static Object parse(final FieldDescriptor field, final String value) {
        switch (field.getJavaType()) {
            case INT:
                try {
                    return Integer.decode(value);
                } catch (final NumberFormatException e) {
                    throw new IllegalArgumentException("Field '" + field.getName() + "' expects an integer but got '" + value + "'");
                }
            case BOOLEAN:
                if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
                    return Boolean.parseBoolean(value);
                }
                throw new IllegalArgumentException("Field '" + field.getName() + "' expects true or false but got '" + value + "'");
            case STRING:
                return value;
            default:
                throw new IllegalArgumentException("Field '" + field.getName() + "' has unsupported type " + field.getJavaType());
        }
    }
}
