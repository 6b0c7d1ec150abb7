package io.toolbridge.core.tool;

public final class ToolHandlers {

    private ToolHandlers() {
    }

    /**
     * Wraps {@code handler} so that any failure it raises reaches the client as a tool error
     * ({@code isError: true}) instead of an internal error.
     */
    public static ToolHandler guarded(ToolHandler handler) {
        if (handler instanceof ToolHandler.NoArgument noArgument) {
            return new ToolHandler.NoArgument(
                noArgument.documentation(),
                () -> {
                    try {
                        return noArgument.function().apply();
                    } catch (ToolException e) {
                        throw e;
                    } catch (Exception e) {
                        throw asToolException(e);
                    }
                }
            );
        }
        ToolHandler.SingleArgument single = (ToolHandler.SingleArgument) handler;
        return new ToolHandler.SingleArgument(
            single.parameter(),
            single.documentation(),
            argument -> {
                try {
                    return single.function().apply(argument);
                } catch (ToolException e) {
                    throw e;
                } catch (Exception e) {
                    throw asToolException(e);
                }
            }
        );
    }

    private static ToolException asToolException(Exception e) {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        return new ToolException(message, e);
    }
}
