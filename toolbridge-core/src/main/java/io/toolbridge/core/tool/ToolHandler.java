package io.toolbridge.core.tool;

import java.util.List;
import java.util.Objects;

/**
 * A tool implementation, either taking no argument or a single named string argument.
 *
 * <p>The {@link #documentation()} text is where the {@code MCP Parameters:} section describing the argument
 * lives; it is read once when the tool is registered.
 */
public sealed interface ToolHandler permits ToolHandler.NoArgument, ToolHandler.SingleArgument {

    List<String> parameters();

    String documentation();

    static ToolHandler noArgument(NoArgumentFunction function) {
        return new NoArgument("", function);
    }

    static ToolHandler noArgument(String documentation, NoArgumentFunction function) {
        return new NoArgument(documentation, function);
    }

    static ToolHandler singleArgument(String parameter, String documentation, SingleArgumentFunction function) {
        return new SingleArgument(parameter, documentation, function);
    }

    @FunctionalInterface
    interface NoArgumentFunction {
        String apply() throws Exception;
    }

    @FunctionalInterface
    interface SingleArgumentFunction {
        String apply(String argument) throws Exception;
    }

    record NoArgument(String documentation, NoArgumentFunction function) implements ToolHandler {
        public NoArgument {
            documentation = documentation == null ? "" : documentation;
            Objects.requireNonNull(function, "function must not be null");
        }

        @Override
        public List<String> parameters() {
            return List.of();
        }
    }

    record SingleArgument(String parameter, String documentation, SingleArgumentFunction function) implements ToolHandler {
        public SingleArgument {
            if (parameter == null || parameter.isBlank()) {
                throw new IllegalArgumentException("parameter name must not be blank");
            }
            parameter = parameter.trim();
            documentation = documentation == null ? "" : documentation;
            Objects.requireNonNull(function, "function must not be null");
        }

        @Override
        public List<String> parameters() {
            return List.of(parameter);
        }
    }
}
