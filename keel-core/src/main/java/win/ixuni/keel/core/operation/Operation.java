package win.ixuni.keel.core.operation;

/**
 * 引擎操作
 * <p>
 * An immutable request value. {@link OperationHandlerRegistry} finds the handler by the
 * operation's class, and {@code R} is what the handler emits.
 *
 * @param <R> result type
 */
public interface Operation<R> {

    /**
     * Name used in log lines: the simple class name without its "Operation" suffix
     */
    default String getOperationName() {
        String name = getClass().getSimpleName();
        return name.endsWith("Operation") ? name.substring(0, name.length() - "Operation".length()) : name;
    }
}
